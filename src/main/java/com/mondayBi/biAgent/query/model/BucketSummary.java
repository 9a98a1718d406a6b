package com.mondayBi.biAgent.query.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Item count and value sum of one group_by or pipeline_summary bucket.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BucketSummary {

    @JsonProperty("count")
    private int count;

    @JsonProperty("total_value")
    private double totalValue;

    @JsonProperty("total_value_formatted")
    private String totalValueFormatted;
}
