package com.mondayBi.biAgent.query.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OverdueItem {

    @JsonProperty("name")
    private String name;

    @JsonProperty("end_date")
    private String endDate;

    @JsonProperty("status")
    private String status;

    @JsonProperty("value")
    private String value;
}
