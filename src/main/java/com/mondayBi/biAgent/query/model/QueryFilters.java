package com.mondayBi.biAgent.query.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Declarative filters of a query plan. A null or empty filter is not applied.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueryFilters {

    /** Sector terms; an item matches when its sector contains any of them. */
    @JsonProperty("sector")
    private List<String> sector;

    /** Status terms; an item matches when its status contains any of them. */
    @JsonProperty("status")
    private List<String> status;

    @JsonProperty("date_range")
    private DateRange dateRange;

    public static QueryFilters none() {
        return new QueryFilters();
    }
}
