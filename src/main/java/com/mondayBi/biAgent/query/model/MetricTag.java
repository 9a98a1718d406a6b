package com.mondayBi.biAgent.query.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Aggregates a query plan can request.
 */
public enum MetricTag {
    TOTAL_VALUE("total_value"),
    COUNT("count"),
    AVERAGE_VALUE("average_value"),
    GROUP_BY("group_by"),
    PIPELINE_SUMMARY("pipeline_summary"),
    OVERDUE_CHECK("overdue_check"),
    LIST_ITEMS("list_items");

    private final String tag;

    MetricTag(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    public static Optional<MetricTag> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String wanted = tag.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(metric -> metric.tag.equals(wanted))
                .findFirst();
    }
}
