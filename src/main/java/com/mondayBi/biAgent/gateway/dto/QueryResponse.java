package com.mondayBi.biAgent.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mondayBi.biAgent.cleaning.model.QualityReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response DTO for business questions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueryResponse {

    private String answer;

    /**
     * What the agent did, in order. Returned on failures too.
     */
    @JsonProperty("action_trace")
    @Builder.Default
    private List<String> actionTrace = new ArrayList<>();

    @JsonProperty("data_quality_report")
    @Builder.Default
    private QualityReport dataQualityReport = QualityReport.empty();
}
