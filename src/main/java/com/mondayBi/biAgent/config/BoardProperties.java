package com.mondayBi.biAgent.config;

import com.mondayBi.biAgent.board.model.BoardTag;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Board ids and column roles, bound from {@code bi.boards.<tag>}.
 */
@Data
@ConfigurationProperties(prefix = "bi")
public class BoardProperties {

    private Map<BoardTag, BoardDefinition> boards = new LinkedHashMap<>();

    /**
     * Looks up the definition of a board.
     *
     * @param tag Board tag
     * @return Board definition
     * @throws IllegalStateException if the board is not configured
     */
    public BoardDefinition get(BoardTag tag) {
        BoardDefinition definition = boards.get(tag);
        if (definition == null) {
            throw new IllegalStateException("Board '" + tag + "' is not configured under bi.boards");
        }
        return definition;
    }

    @Data
    public static class BoardDefinition {

        /** monday.com board id. */
        private String id;

        /** Plural label used in trace lines, e.g. "deals" or "work orders". */
        private String label;

        /** Column matched by the sector filter and bucketed by group_by. */
        private String sectorColumn;

        /** Column matched by the status filter and checked by overdue_check. */
        private String statusColumn;

        /** Column bucketed by pipeline_summary. */
        private String stageColumn;

        /** Column compared against the date range and used as the overdue end date. */
        private String dateColumn;

        /** Column summed and averaged by the value metrics. */
        private String valueColumn;

        /** Columns whose distinct values are listed in the planning prompt. */
        private List<String> availableValueColumns = new ArrayList<>();
    }
}
