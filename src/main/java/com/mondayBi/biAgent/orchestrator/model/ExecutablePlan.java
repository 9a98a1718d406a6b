package com.mondayBi.biAgent.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mondayBi.biAgent.board.model.BoardTag;
import com.mondayBi.biAgent.query.model.MetricTag;
import com.mondayBi.biAgent.query.model.QueryFilters;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Validated query plan: which boards to read, how to filter them and what to compute.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public final class ExecutablePlan implements PlanOutcome {

    @JsonProperty("boards_to_query")
    @Builder.Default
    private List<BoardTag> boardsToQuery = new ArrayList<>();

    @JsonProperty("filters")
    @Builder.Default
    private QueryFilters filters = QueryFilters.none();

    @JsonProperty("metrics")
    @Builder.Default
    private List<MetricTag> metrics = new ArrayList<>();

    @JsonProperty("analysis_type")
    @Builder.Default
    private AnalysisType analysisType = AnalysisType.SUMMARY;

    @JsonProperty("explanation")
    private String explanation;
}
