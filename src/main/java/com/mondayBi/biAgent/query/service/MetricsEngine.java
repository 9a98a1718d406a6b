package com.mondayBi.biAgent.query.service;

import com.mondayBi.biAgent.board.model.BoardTag;
import com.mondayBi.biAgent.cleaning.model.CleanedItem;
import com.mondayBi.biAgent.cleaning.normalizer.CurrencyNormalizer;
import com.mondayBi.biAgent.cleaning.normalizer.DateNormalizer;
import com.mondayBi.biAgent.config.BoardProperties;
import com.mondayBi.biAgent.query.model.BucketSummary;
import com.mondayBi.biAgent.query.model.MetricTag;
import com.mondayBi.biAgent.query.model.MetricsResult;
import com.mondayBi.biAgent.query.model.OverdueItem;
import com.mondayBi.biAgent.query.util.NumberFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes the metrics a query plan asks for over the filtered items of one board.
 * Each metric is computed independently; metrics that were not requested stay unset.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsEngine {

    public static final int MAX_LISTED_ITEMS = 50;

    static final String UNKNOWN_BUCKET = "Unknown";

    private static final Set<String> CLOSED_STATUSES = Set.of("closed", "closed won", "closed lost", "completed");

    private final BoardProperties boardProperties;
    private final Clock clock;

    /**
     * Computes the requested metrics.
     *
     * @param items   Filtered items of one board
     * @param metrics Requested metrics
     * @param board   Board the items come from; selects the value, sector, stage, status and date columns
     * @return Metrics result with only the requested metrics set
     */
    public MetricsResult compute(List<CleanedItem> items, Collection<MetricTag> metrics, BoardTag board) {
        List<CleanedItem> source = items != null ? items : List.of();
        Set<MetricTag> requested = metrics != null ? Set.copyOf(metrics) : Set.of();
        BoardProperties.BoardDefinition definition = boardProperties.get(board);
        String valueColumn = definition.getValueColumn();

        List<Double> values = source.stream()
                .map(item -> CurrencyNormalizer.toDouble(item.get(valueColumn)))
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        double total = values.stream().mapToDouble(Double::doubleValue).sum();

        MetricsResult result = new MetricsResult();

        if (requested.contains(MetricTag.TOTAL_VALUE)) {
            result.setTotalValue(total);
            result.setTotalValueFormatted(NumberFormatter.format(total));
        }

        if (requested.contains(MetricTag.COUNT)) {
            result.setCount(source.size());
        }

        if (requested.contains(MetricTag.AVERAGE_VALUE)) {
            double average = values.isEmpty() ? 0d : total / values.size();
            result.setAverageValue(average);
            result.setAverageValueFormatted(NumberFormatter.format(average));
        }

        if (requested.contains(MetricTag.GROUP_BY)) {
            result.setGroups(bucket(source, definition.getSectorColumn(), valueColumn));
        }

        if (requested.contains(MetricTag.PIPELINE_SUMMARY)) {
            result.setPipeline(bucket(source, definition.getStageColumn(), valueColumn));
        }

        if (requested.contains(MetricTag.OVERDUE_CHECK)) {
            List<OverdueItem> overdue = findOverdue(source, definition);
            result.setOverdueItems(overdue);
            result.setOverdueCount(overdue.size());
        }

        if (requested.contains(MetricTag.LIST_ITEMS)) {
            result.setItems(source.stream()
                    .limit(MAX_LISTED_ITEMS)
                    .map(CleanedItem::toSummary)
                    .collect(Collectors.toList()));
        }

        log.debug("Computed metrics for {} board - items: {}, metrics: {}", board, source.size(), requested);
        return result;
    }

    private static Map<String, BucketSummary> bucket(List<CleanedItem> items, String keyColumn, String valueColumn) {
        Map<String, BucketSummary> buckets = new LinkedHashMap<>();
        for (CleanedItem item : items) {
            Object key = item.get(keyColumn);
            String bucketKey = key != null ? key.toString() : UNKNOWN_BUCKET;
            BucketSummary bucket = buckets.computeIfAbsent(bucketKey, k -> new BucketSummary());
            bucket.setCount(bucket.getCount() + 1);
            Double value = CurrencyNormalizer.toDouble(item.get(valueColumn));
            if (value != null) {
                bucket.setTotalValue(bucket.getTotalValue() + value);
            }
        }
        buckets.values().forEach(bucket -> bucket.setTotalValueFormatted(NumberFormatter.format(bucket.getTotalValue())));
        return buckets;
    }

    private List<OverdueItem> findOverdue(List<CleanedItem> items, BoardProperties.BoardDefinition definition) {
        LocalDate today = LocalDate.now(clock);
        List<OverdueItem> overdue = new ArrayList<>();
        for (CleanedItem item : items) {
            Object endDate = item.get(definition.getDateColumn());
            LocalDate due = DateNormalizer.parseIso(endDate);
            if (due == null || !due.isBefore(today)) {
                continue;
            }
            Object status = item.get(definition.getStatusColumn());
            if (status != null && CLOSED_STATUSES.contains(status.toString().trim().toLowerCase(Locale.ROOT))) {
                continue;
            }
            Double value = CurrencyNormalizer.toDouble(item.get(definition.getValueColumn()));
            overdue.add(OverdueItem.builder()
                    .name(item.getName())
                    .endDate(endDate.toString())
                    .status(status != null ? status.toString() : null)
                    .value(NumberFormatter.format(value != null ? value : 0d))
                    .build());
        }
        return overdue;
    }
}
