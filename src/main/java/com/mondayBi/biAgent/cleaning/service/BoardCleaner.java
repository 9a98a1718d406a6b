package com.mondayBi.biAgent.cleaning.service;

import com.mondayBi.biAgent.board.model.ItemGroup;
import com.mondayBi.biAgent.board.model.RawItem;
import com.mondayBi.biAgent.cleaning.model.CleanedItem;
import com.mondayBi.biAgent.cleaning.model.CleaningResult;
import com.mondayBi.biAgent.cleaning.model.ColumnType;
import com.mondayBi.biAgent.cleaning.model.QualityReport;
import com.mondayBi.biAgent.cleaning.model.StatusNormalization;
import com.mondayBi.biAgent.cleaning.normalizer.CurrencyNormalizer;
import com.mondayBi.biAgent.cleaning.normalizer.DateNormalizer;
import com.mondayBi.biAgent.cleaning.normalizer.StatusNormalizer;
import com.mondayBi.biAgent.cleaning.normalizer.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Applies the column classifier and field normalizers to every cell of a board.
 * <p>
 * Never fails on malformed cells: blank cells become null and are counted as
 * missing, unreadable dates and amounts become null and are reported as issues.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BoardCleaner {

    private static final String UNKNOWN_ITEM = "unknown";

    private final ColumnClassifier columnClassifier;

    /**
     * Cleans one board's items.
     *
     * @param items Raw items of a single board
     * @return Cleaned items in input order, with the quality report for this pass
     */
    public CleaningResult clean(List<RawItem> items) {
        List<RawItem> source = items != null ? items : List.of();
        QualityReport report = QualityReport.empty();
        report.setTotalItems(source.size());

        List<String> issues = new ArrayList<>();
        Set<String> unmappedStatuses = new TreeSet<>();
        List<CleanedItem> cleaned = new ArrayList<>(source.size());

        for (RawItem item : source) {
            cleaned.add(cleanItem(item, report, issues, unmappedStatuses));
        }

        if (!unmappedStatuses.isEmpty()) {
            log.info("Statuses outside the canonical vocabulary, kept title-cased: {}", unmappedStatuses);
        }

        report.setIssues(capIssues(issues));
        report.summarizePass();

        if (report.countIssues() > 0) {
            log.warn("Board cleaning completed with issues - {}", report.getSummary());
        } else {
            log.info("Board cleaning completed - items: {}", report.getTotalItems());
        }
        return new CleaningResult(cleaned, report, unmappedStatuses);
    }

    private CleanedItem cleanItem(RawItem item, QualityReport report, List<String> issues,
                                  Set<String> unmappedStatuses) {
        String itemName = item.getName() != null ? item.getName() : UNKNOWN_ITEM;
        Map<String, Object> columns = new LinkedHashMap<>();

        Map<String, String> rawColumns = item.getColumns() != null ? item.getColumns() : Map.of();
        for (Map.Entry<String, String> cell : rawColumns.entrySet()) {
            String column = cell.getKey();
            String raw = cell.getValue();

            if (raw == null || raw.isBlank()) {
                report.setMissingValues(report.getMissingValues() + 1);
                columns.put(column, null);
                continue;
            }

            columns.put(column, cleanCell(column, raw, itemName, report, issues, unmappedStatuses));
        }

        return CleanedItem.builder()
                .id(item.getId())
                .name(item.getName())
                .group(item.getGroup() != null ? item.getGroup() : ItemGroup.empty())
                .columns(columns)
                .build();
    }

    private Object cleanCell(String column, String raw, String itemName, QualityReport report, List<String> issues,
                             Set<String> unmappedStatuses) {
        ColumnType type = columnClassifier.classify(column);
        switch (type) {
            case DATE -> {
                String date = DateNormalizer.normalize(raw);
                if (date == null) {
                    report.setUnparseableDates(report.getUnparseableDates() + 1);
                    issues.add(String.format("Unparseable date in '%s' for item '%s': '%s'", column, itemName, raw));
                }
                return date;
            }
            case CURRENCY -> {
                Double amount = CurrencyNormalizer.normalize(raw);
                if (amount == null) {
                    report.setUnparseableNumbers(report.getUnparseableNumbers() + 1);
                    issues.add(String.format("Unparseable number in '%s' for item '%s': '%s'", column, itemName, raw));
                }
                return amount;
            }
            case STATUS -> {
                StatusNormalization status = StatusNormalizer.normalize(raw);
                if (!status.isCanonical()) {
                    unmappedStatuses.add(raw.trim());
                }
                if (!status.value().equals(raw)) {
                    report.setNormalizedStatuses(report.getNormalizedStatuses() + 1);
                }
                return status.value();
            }
            case TEXT -> {
                String text = TextNormalizer.normalize(raw);
                if (!text.equals(raw)) {
                    report.setNormalizedText(report.getNormalizedText() + 1);
                }
                return text;
            }
            default -> {
                return raw;
            }
        }
    }

    private static List<String> capIssues(List<String> issues) {
        if (issues.size() <= QualityReport.MAX_ISSUES) {
            return issues;
        }
        List<String> capped = new ArrayList<>(issues.subList(0, QualityReport.MAX_ISSUES));
        capped.add(String.format("... and %d more issues", issues.size() - QualityReport.MAX_ISSUES));
        return capped;
    }
}
