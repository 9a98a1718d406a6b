package com.mondayBi.biAgent.cleaning.normalizer;

import com.mondayBi.biAgent.cleaning.model.StatusNormalization;

import java.util.Locale;
import java.util.Map;

/**
 * Maps status spellings from the deal, execution, billing, closure and invoice
 * vocabularies onto canonical labels. Unknown statuses are kept, title-cased.
 */
public final class StatusNormalizer {

    private static final Map<String, String> CANONICAL_STATUSES = Map.ofEntries(
            // deal
            Map.entry("open", "Open"),
            Map.entry("closed", "Closed"),
            Map.entry("closed won", "Closed Won"),
            Map.entry("closed lost", "Closed Lost"),
            Map.entry("closedwon", "Closed Won"),
            Map.entry("closedlost", "Closed Lost"),
            Map.entry("won", "Closed Won"),
            Map.entry("lost", "Closed Lost"),
            // execution
            Map.entry("not started", "Not Started"),
            Map.entry("notstarted", "Not Started"),
            Map.entry("in progress", "In Progress"),
            Map.entry("inprogress", "In Progress"),
            Map.entry("in_progress", "In Progress"),
            Map.entry("wip", "In Progress"),
            Map.entry("completed", "Completed"),
            Map.entry("complete", "Completed"),
            Map.entry("done", "Completed"),
            Map.entry("executed until current month", "Executed Until Current Month"),
            // billing
            Map.entry("partially billed", "Partially Billed"),
            Map.entry("fully billed", "Fully Billed"),
            Map.entry("not billed", "Not Billed"),
            Map.entry("update required", "Update Required"),
            // closure probability
            Map.entry("high", "High"),
            Map.entry("medium", "Medium"),
            Map.entry("low", "Low"),
            Map.entry("very high", "Very High"),
            Map.entry("very low", "Very Low"),
            // invoice
            Map.entry("pending", "Pending"),
            Map.entry("paid", "Paid"),
            Map.entry("overdue", "Overdue"),
            Map.entry("cancelled", "Cancelled"),
            Map.entry("canceled", "Cancelled")
    );

    private StatusNormalizer() {}

    /**
     * Normalizes a raw status value.
     *
     * @param value Raw text, may be null
     * @return Normalization result, or null if the value is blank
     */
    public static StatusNormalization normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        String canonical = CANONICAL_STATUSES.get(trimmed.toLowerCase(Locale.ROOT));
        if (canonical != null) {
            return StatusNormalization.canonical(canonical);
        }
        return StatusNormalization.passthroughUnmapped(TextNormalizer.titleCase(trimmed));
    }
}
