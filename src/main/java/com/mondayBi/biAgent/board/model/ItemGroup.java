package com.mondayBi.biAgent.board.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Board group an item belongs to (typically a pipeline stage or category).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ItemGroup {

    @JsonProperty("id")
    @Builder.Default
    private String id = "";

    @JsonProperty("title")
    @Builder.Default
    private String title = "";

    public static ItemGroup empty() {
        return new ItemGroup("", "");
    }
}
