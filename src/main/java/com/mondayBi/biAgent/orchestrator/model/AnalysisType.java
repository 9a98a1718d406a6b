package com.mondayBi.biAgent.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Kind of answer the planner expects to give.
 */
public enum AnalysisType {
    SUMMARY,
    COMPARISON,
    TREND,
    DETAIL,
    RISK;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<AnalysisType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.getValue().equals(value.trim().toLowerCase(Locale.ROOT)))
                .findFirst();
    }
}
