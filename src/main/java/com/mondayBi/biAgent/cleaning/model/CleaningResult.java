package com.mondayBi.biAgent.cleaning.model;

import java.util.List;
import java.util.Set;

/**
 * Cleaned items, in the order of the raw items, plus the report of the pass that produced them.
 *
 * @param unmappedStatuses Raw status values, trimmed, that had no canonical label and were kept title-cased
 */
public record CleaningResult(List<CleanedItem> items, QualityReport qualityReport, Set<String> unmappedStatuses) {
}
