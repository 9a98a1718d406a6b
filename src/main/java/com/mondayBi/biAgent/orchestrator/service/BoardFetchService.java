package com.mondayBi.biAgent.orchestrator.service;

import com.mondayBi.biAgent.board.client.BoardDataService;
import com.mondayBi.biAgent.board.model.BoardSchema;
import com.mondayBi.biAgent.board.model.BoardTag;
import com.mondayBi.biAgent.board.model.RawItem;
import com.mondayBi.biAgent.cleaning.normalizer.TextNormalizer;
import com.mondayBi.biAgent.config.BoardProperties;
import com.mondayBi.biAgent.orchestrator.model.OrchestrationState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Fetches board schemas and rows for a turn and derives the filter values shown to the planner.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BoardFetchService {

    private final BoardDataService boardDataService;
    private final BoardProperties boardProperties;

    /**
     * Step FETCH_SCHEMAS - reads the schema of every configured board.
     *
     * @param state Current orchestration state
     * @return Updated state with schemas
     */
    public OrchestrationState fetchSchemas(OrchestrationState state) {
        log.debug("Step FETCH_SCHEMAS - correlationId: {}", state.getCorrelationId());

        List<String> described = new ArrayList<>();
        for (BoardTag board : BoardTag.values()) {
            BoardSchema schema = boardDataService.getBoardSchema(boardProperties.get(board).getId());
            state.getSchemas().put(board, schema);
            described.add(displayName(board) + " (" + schema.getColumns().size() + " columns)");
        }

        state.trace("Retrieved schemas: " + String.join(", ", described));
        log.info("Schemas fetched - correlationId: {}, boards: {}", state.getCorrelationId(), state.getSchemas().size());
        return state;
    }

    /**
     * Step FETCH_SAMPLES - pulls the rows of every board and lists the distinct values of
     * the filterable columns so the planner can use the spellings that actually occur.
     * The rows are kept in the state and reused when the boards are cleaned.
     *
     * @param state Current orchestration state
     * @return Updated state with raw items and the available-values block
     */
    public OrchestrationState fetchSamples(OrchestrationState state) {
        log.debug("Step FETCH_SAMPLES - correlationId: {}", state.getCorrelationId());

        StringBuilder availableValues = new StringBuilder();
        for (BoardTag board : BoardTag.values()) {
            BoardProperties.BoardDefinition definition = boardProperties.get(board);
            List<RawItem> items = boardDataService.getAllItems(definition.getId());
            state.getRawItems().put(board, items);

            if (availableValues.length() > 0) {
                availableValues.append('\n');
            }
            availableValues.append(displayName(board)).append(" Board Available Values:\n");
            for (String column : definition.getAvailableValueColumns()) {
                TreeSet<String> values = distinctValues(items, column);
                if (!values.isEmpty()) {
                    availableValues.append("  ").append(column).append(": ")
                            .append(String.join(", ", values)).append('\n');
                }
            }
            log.info("Board rows fetched - correlationId: {}, board: {}, items: {}",
                    state.getCorrelationId(), board, items.size());
        }

        state.setAvailableValues(availableValues.toString());
        return state;
    }

    /**
     * "Deals", "Work Orders": the configured label title-cased.
     */
    public String displayName(BoardTag board) {
        return TextNormalizer.normalize(boardProperties.get(board).getLabel());
    }

    private static TreeSet<String> distinctValues(List<RawItem> items, String column) {
        TreeSet<String> values = new TreeSet<>();
        for (RawItem item : items) {
            Map<String, String> columns = item.getColumns();
            String value = columns != null ? columns.get(column) : null;
            if (value != null && !value.isBlank()) {
                values.add(value.trim());
            }
        }
        return values;
    }
}
