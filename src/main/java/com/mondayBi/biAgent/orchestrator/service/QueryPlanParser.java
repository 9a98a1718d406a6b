package com.mondayBi.biAgent.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mondayBi.biAgent.board.model.BoardTag;
import com.mondayBi.biAgent.cleaning.normalizer.DateNormalizer;
import com.mondayBi.biAgent.orchestrator.exception.PlanParseException;
import com.mondayBi.biAgent.orchestrator.model.AnalysisType;
import com.mondayBi.biAgent.orchestrator.model.ClarificationRequest;
import com.mondayBi.biAgent.orchestrator.model.ExecutablePlan;
import com.mondayBi.biAgent.orchestrator.model.PlanOutcome;
import com.mondayBi.biAgent.query.model.DateRange;
import com.mondayBi.biAgent.query.model.MetricTag;
import com.mondayBi.biAgent.query.model.QueryFilters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Turns the planner's reply text into a {@link PlanOutcome}.
 * <p>
 * The reply may be wrapped in a markdown code fence. When it does not parse as JSON,
 * the text between the first '{' and the last '}' is tried once more. The resulting
 * object must be either a clarification request or carry at least one plan field.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryPlanParser {

    static final String DEFAULT_CLARIFICATION = "Could you be more specific about what you'd like to know?";

    private static final String FENCE = "```";
    private static final List<String> PLAN_FIELDS = List.of("boards_to_query", "filters", "metrics", "analysis_type");
    private static final List<BoardTag> DEFAULT_BOARDS = List.of(BoardTag.DEALS);
    private static final List<MetricTag> DEFAULT_METRICS = List.of(MetricTag.COUNT, MetricTag.TOTAL_VALUE);

    private final ObjectMapper objectMapper;

    /**
     * Parses and validates a planner reply.
     *
     * @param planText Raw reply text
     * @return Executable plan or clarification request
     * @throws PlanParseException if the text is not JSON or matches neither shape
     */
    public PlanOutcome parse(String planText) {
        if (planText == null || planText.isBlank()) {
            throw new PlanParseException("Query plan is empty");
        }

        JsonNode root = readJson(stripFence(planText.trim()));
        if (!root.isObject()) {
            throw new PlanParseException("Query plan is not a JSON object");
        }

        if (isTrue(root.get("needs_clarification"))) {
            String question = text(root.get("clarification_question"));
            return new ClarificationRequest(question != null ? question : DEFAULT_CLARIFICATION);
        }

        if (PLAN_FIELDS.stream().noneMatch(root::has)) {
            throw new PlanParseException("Reply is neither a query plan nor a clarification request");
        }

        return ExecutablePlan.builder()
                .boardsToQuery(root.has("boards_to_query")
                        ? tags(root.get("boards_to_query"), BoardTag::fromTag, "board")
                        : DEFAULT_BOARDS)
                .filters(filters(root.get("filters")))
                .metrics(root.has("metrics")
                        ? tags(root.get("metrics"), MetricTag::fromTag, "metric")
                        : DEFAULT_METRICS)
                .analysisType(analysisType(root.get("analysis_type")))
                .explanation(text(root.get("explanation")))
                .build();
    }

    private static String stripFence(String text) {
        if (!text.startsWith(FENCE)) {
            return text;
        }
        String[] parts = text.split(FENCE, -1);
        String inner = parts.length > 1 ? parts[1] : "";
        if (inner.startsWith("json")) {
            inner = inner.substring(4);
        }
        return inner.trim();
    }

    private JsonNode readJson(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException primary) {
            int start = text.indexOf('{');
            int end = text.lastIndexOf('}');
            if (start < 0 || end <= start) {
                throw new PlanParseException("Query plan is not valid JSON: " + primary.getOriginalMessage(), primary);
            }
            try {
                return objectMapper.readTree(text.substring(start, end + 1));
            } catch (JsonProcessingException retry) {
                throw new PlanParseException("Query plan is not valid JSON: " + retry.getOriginalMessage(), retry);
            }
        }
    }

    private static QueryFilters filters(JsonNode node) {
        if (node == null || !node.isObject()) {
            return QueryFilters.none();
        }
        return QueryFilters.builder()
                .sector(terms(node.get("sector")))
                .status(terms(node.get("status")))
                .dateRange(dateRange(node.get("date_range")))
                .build();
    }

    /** Accepts a single string or an array of strings; anything else is no filter. */
    private static List<String> terms(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        List<String> terms = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(term -> {
                String value = text(term);
                if (value != null) {
                    terms.add(value);
                }
            });
        } else {
            String value = text(node);
            if (value != null) {
                terms.add(value);
            }
        }
        return terms.isEmpty() ? null : terms;
    }

    // Bounds are ISO dates only; partial dates like "March 2026" are rejected.
    private static DateRange dateRange(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        DateRange range = new DateRange(bound(node.get("start"), "start"), bound(node.get("end"), "end"));
        return range.isBounded() ? range : null;
    }

    private static LocalDate bound(JsonNode node, String name) {
        String raw = text(node);
        if (raw == null) {
            return null;
        }
        LocalDate date = DateNormalizer.parseIso(raw);
        if (date == null) {
            throw new PlanParseException("date_range " + name + " is not a YYYY-MM-DD date: '" + raw + "'");
        }
        return date;
    }

    private static <T> List<T> tags(JsonNode node, Function<String, Optional<T>> lookup, String kind) {
        Set<T> tags = new LinkedHashSet<>();
        List<JsonNode> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(values::add);
        } else if (node != null && !node.isNull()) {
            values.add(node);
        }
        for (JsonNode value : values) {
            String raw = text(value);
            Optional<T> tag = lookup.apply(raw);
            if (tag.isPresent()) {
                tags.add(tag.get());
            } else {
                log.warn("Ignoring unknown {} in query plan: '{}'", kind, raw);
            }
        }
        return new ArrayList<>(tags);
    }

    private static AnalysisType analysisType(JsonNode node) {
        String raw = text(node);
        if (raw == null) {
            return AnalysisType.SUMMARY;
        }
        return AnalysisType.fromValue(raw).orElseGet(() -> {
            log.warn("Unknown analysis_type in query plan: '{}', using summary", raw);
            return AnalysisType.SUMMARY;
        });
    }

    private static boolean isTrue(JsonNode node) {
        if (node == null) {
            return false;
        }
        return node.isBoolean() ? node.booleanValue() : "true".equalsIgnoreCase(node.asText());
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }
}
