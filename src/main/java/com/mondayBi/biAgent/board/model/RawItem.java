package com.mondayBi.biAgent.board.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One board item as fetched from the board source: column title to display text.
 * Blank cells are carried as null.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RawItem {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("group")
    @Builder.Default
    private ItemGroup group = ItemGroup.empty();

    @JsonProperty("columns")
    @Builder.Default
    private Map<String, String> columns = new LinkedHashMap<>();
}
