package com.mondayBi.biAgent.board.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The boards the agent can query, by the tag used in query plans and configuration.
 */
public enum BoardTag {
    DEALS("deals"),
    WORKORDERS("workorders");

    private final String tag;

    BoardTag(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    public static Optional<BoardTag> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String wanted = tag.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(board -> board.tag.equals(wanted))
                .findFirst();
    }

    @JsonCreator
    static BoardTag ofJson(String tag) {
        return fromTag(tag).orElse(null);
    }

    @Override
    public String toString() {
        return tag;
    }
}
