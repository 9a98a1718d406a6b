package com.mondayBi.biAgent.cleaning.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mondayBi.biAgent.board.model.ItemGroup;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Board item after normalization. Has exactly the column titles of its raw item;
 * each value is an ISO date string, a Double, a canonical status, title-cased text,
 * the untouched raw text of an unclassified column, or null.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CleanedItem {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("group")
    private ItemGroup group;

    @JsonProperty("columns")
    @Builder.Default
    private Map<String, Object> columns = new LinkedHashMap<>();

    public Object get(String columnTitle) {
        return columnTitle == null ? null : columns.get(columnTitle);
    }

    /**
     * Name plus every non-null column, the compact form sent to the language model.
     */
    public Map<String, Object> toSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("name", name);
        columns.forEach((column, value) -> {
            if (value != null) {
                summary.put(column, value);
            }
        });
        return summary;
    }
}
