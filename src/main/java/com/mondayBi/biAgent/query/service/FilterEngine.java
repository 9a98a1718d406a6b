package com.mondayBi.biAgent.query.service;

import com.mondayBi.biAgent.board.model.BoardTag;
import com.mondayBi.biAgent.cleaning.model.CleanedItem;
import com.mondayBi.biAgent.cleaning.normalizer.DateNormalizer;
import com.mondayBi.biAgent.config.BoardProperties;
import com.mondayBi.biAgent.query.model.DateRange;
import com.mondayBi.biAgent.query.model.QueryFilters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Applies a plan's sector, status and date-range filters to cleaned items.
 * Filters are ANDed; input order is preserved.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FilterEngine {

    private final BoardProperties boardProperties;

    /**
     * Filters the items of one board.
     *
     * @param items   Cleaned items
     * @param filters Plan filters, may be null
     * @param board   Board the items come from; selects the sector, status and date columns
     * @return Items passing every filter, in input order
     */
    public List<CleanedItem> apply(List<CleanedItem> items, QueryFilters filters, BoardTag board) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        if (filters == null) {
            return List.copyOf(items);
        }

        BoardProperties.BoardDefinition definition = boardProperties.get(board);
        Predicate<CleanedItem> predicate = item -> true;

        List<String> sectorTerms = lowerCaseTerms(filters.getSector());
        if (!sectorTerms.isEmpty()) {
            predicate = predicate.and(containsAny(definition.getSectorColumn(), sectorTerms));
        }

        List<String> statusTerms = lowerCaseTerms(filters.getStatus());
        if (!statusTerms.isEmpty()) {
            predicate = predicate.and(containsAny(definition.getStatusColumn(), statusTerms));
        }

        DateRange dateRange = filters.getDateRange();
        if (dateRange != null && dateRange.isBounded()) {
            predicate = predicate.and(withinRange(definition.getDateColumn(), dateRange));
        }

        List<CleanedItem> filtered = items.stream()
                .filter(predicate)
                .collect(Collectors.toList());

        log.debug("Filtered {} board - in: {}, out: {}", board, items.size(), filtered.size());
        return filtered;
    }

    private static Predicate<CleanedItem> containsAny(String column, List<String> terms) {
        return item -> {
            Object value = item.get(column);
            if (value == null) {
                return false;
            }
            String haystack = value.toString().toLowerCase(Locale.ROOT);
            if (haystack.isEmpty()) {
                return false;
            }
            return terms.stream().anyMatch(haystack::contains);
        };
    }

    // Items without a readable date in the column are dropped once a bound is set.
    private static Predicate<CleanedItem> withinRange(String column, DateRange range) {
        return item -> {
            LocalDate date = DateNormalizer.parseIso(item.get(column));
            return date != null && range.contains(date);
        };
    }

    private static List<String> lowerCaseTerms(List<String> terms) {
        if (terms == null) {
            return List.of();
        }
        return terms.stream()
                .filter(Objects::nonNull)
                .map(term -> term.trim().toLowerCase(Locale.ROOT))
                .filter(term -> !term.isEmpty())
                .collect(Collectors.toList());
    }
}
