package com.mondayBi.biAgent.cleaning.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Data quality counters and sample issues for one or more cleaning passes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QualityReport {

    /** Issue lines kept per cleaning pass before the overflow marker. */
    public static final int MAX_ISSUES = 20;

    @JsonProperty("total_items")
    private int totalItems;

    @JsonProperty("missing_values")
    private int missingValues;

    @JsonProperty("unparseable_dates")
    private int unparseableDates;

    @JsonProperty("unparseable_numbers")
    private int unparseableNumbers;

    @JsonProperty("normalized_statuses")
    private int normalizedStatuses;

    @JsonProperty("normalized_text")
    private int normalizedText;

    @JsonProperty("issues")
    @Builder.Default
    private List<String> issues = new ArrayList<>();

    @JsonProperty("summary")
    @Builder.Default
    private String summary = "";

    public static QualityReport empty() {
        return QualityReport.builder().build();
    }

    /**
     * Missing values plus unparseable dates and numbers. Status and text rewrites are not issues.
     */
    public int countIssues() {
        return missingValues + unparseableDates + unparseableNumbers;
    }

    /**
     * Adds another pass into this report: counters are summed and issue lines appended as they are.
     * The summary is left untouched; call {@link #summarizeMerged()} once all passes are merged.
     *
     * @param other Report of another cleaning pass
     */
    public void merge(QualityReport other) {
        if (other == null) {
            return;
        }
        totalItems += other.totalItems;
        missingValues += other.missingValues;
        unparseableDates += other.unparseableDates;
        unparseableNumbers += other.unparseableNumbers;
        normalizedStatuses += other.normalizedStatuses;
        normalizedText += other.normalizedText;
        issues.addAll(other.issues);
    }

    public void summarizePass() {
        summary = String.format("%d data quality issues found across %d items: "
                        + "%d missing values, %d unparseable dates, %d unparseable numbers.",
                countIssues(), totalItems, missingValues, unparseableDates, unparseableNumbers);
    }

    public void summarizeMerged() {
        summary = String.format("%d missing values, %d unparseable dates, %d unparseable numbers "
                        + "across %d total items.",
                missingValues, unparseableDates, unparseableNumbers, totalItems);
    }
}
