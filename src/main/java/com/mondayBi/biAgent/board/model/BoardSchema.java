package com.mondayBi.biAgent.board.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Board name and its column definitions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BoardSchema {

    @JsonProperty("board_name")
    private String boardName;

    @JsonProperty("columns")
    @Builder.Default
    private List<BoardColumn> columns = new ArrayList<>();

    /**
     * Renders the schema as the plain-text block embedded in the planning prompt.
     *
     * @return One header line plus one line per column
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Board: ").append(boardName).append('\n');
        sb.append("Columns:");
        for (BoardColumn column : columns) {
            sb.append("\n  - ").append(column.getTitle())
                    .append(" (type: ").append(column.getType())
                    .append(", id: ").append(column.getId()).append(')');
        }
        return sb.toString();
    }
}
