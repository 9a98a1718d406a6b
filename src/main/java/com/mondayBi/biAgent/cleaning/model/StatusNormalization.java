package com.mondayBi.biAgent.cleaning.model;

/**
 * Result of normalizing a status cell.
 *
 * @param value   Canonical label, or the title-cased original when the vocabulary has no entry
 * @param outcome Whether the value came from the canonical vocabulary
 */
public record StatusNormalization(String value, Outcome outcome) {

    public enum Outcome {
        CANONICAL,
        PASSTHROUGH_UNMAPPED
    }

    public static StatusNormalization canonical(String value) {
        return new StatusNormalization(value, Outcome.CANONICAL);
    }

    public static StatusNormalization passthroughUnmapped(String value) {
        return new StatusNormalization(value, Outcome.PASSTHROUGH_UNMAPPED);
    }

    public boolean isCanonical() {
        return outcome == Outcome.CANONICAL;
    }
}
