package com.mondayBi.biAgent.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * One earlier message of the conversation, supplied by the caller.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationTurn {

    @JsonProperty("role")
    private Role role;

    @JsonProperty("content")
    private String content;

    public enum Role {
        USER("user"),
        ASSISTANT("assistant");

        private final String value;

        Role(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @JsonCreator
        public static Role of(String value) {
            if (value == null) {
                return null;
            }
            String wanted = value.trim().toLowerCase(Locale.ROOT);
            for (Role role : values()) {
                if (role.value.equals(wanted)) {
                    return role;
                }
            }
            throw new IllegalArgumentException("Unknown conversation role: " + value);
        }
    }
}
