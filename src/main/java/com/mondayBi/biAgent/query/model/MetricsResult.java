package com.mondayBi.biAgent.query.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Computed metrics of one board. Only the requested metrics are set; the rest stay null
 * and are left out of the JSON handed to the language model.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MetricsResult {

    @JsonProperty("total_value")
    private Double totalValue;

    @JsonProperty("total_value_formatted")
    private String totalValueFormatted;

    @JsonProperty("count")
    private Integer count;

    @JsonProperty("average_value")
    private Double averageValue;

    @JsonProperty("average_value_formatted")
    private String averageValueFormatted;

    /** group_by buckets keyed by sector. */
    @JsonProperty("groups")
    private Map<String, BucketSummary> groups;

    /** pipeline_summary buckets keyed by stage. */
    @JsonProperty("pipeline")
    private Map<String, BucketSummary> pipeline;

    @JsonProperty("overdue_items")
    private List<OverdueItem> overdueItems;

    @JsonProperty("overdue_count")
    private Integer overdueCount;

    /** list_items detail dump, at most {@code MetricsEngine.MAX_LISTED_ITEMS} entries. */
    @JsonProperty("items")
    private List<Map<String, Object>> items;
}
