package com.mondayBi.biAgent.cleaning.normalizer;

import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes free-form date text to ISO {@code YYYY-MM-DD}.
 * <p>
 * Explicit formats are tried in a fixed order, so an ambiguous value such as
 * {@code 03/04/2026} resolves day-first. When no explicit format matches, a
 * tolerant day-first scan of the text is attempted before giving up.
 * </p>
 */
@Slf4j
public final class DateNormalizer {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE;

    private static final Pattern ISO_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern ORDINAL_SUFFIX = Pattern.compile("(\\d+)(st|nd|rd|th)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOKEN = Pattern.compile("\\d+|[A-Za-z]+");

    // Order matters: day-first variants come before their month-first twins.
    private static final List<DateTimeFormatter> EXPLICIT_FORMATS = List.of(
            formatter("uuuu-M-d"),
            formatter("d/M/uuuu"),
            formatter("M/d/uuuu"),
            formatter("d-M-uuuu"),
            formatter("M-d-uuuu"),
            formatter("d MMM uuuu"),
            formatter("d MMMM uuuu"),
            formatter("MMM d, uuuu"),
            formatter("MMMM d, uuuu"),
            formatter("d/M/uu"),
            formatter("M/d/uu")
    );

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("january", 1),
            Map.entry("feb", 2), Map.entry("february", 2),
            Map.entry("mar", 3), Map.entry("march", 3),
            Map.entry("apr", 4), Map.entry("april", 4),
            Map.entry("may", 5),
            Map.entry("jun", 6), Map.entry("june", 6),
            Map.entry("jul", 7), Map.entry("july", 7),
            Map.entry("aug", 8), Map.entry("august", 8),
            Map.entry("sep", 9), Map.entry("sept", 9), Map.entry("september", 9),
            Map.entry("oct", 10), Map.entry("october", 10),
            Map.entry("nov", 11), Map.entry("november", 11),
            Map.entry("dec", 12), Map.entry("december", 12)
    );

    private DateNormalizer() {}

    /**
     * Normalizes a raw date value.
     *
     * @param value Raw text, may be null
     * @return ISO date string, or null if the value is blank or cannot be read as a date
     */
    public static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();

        if (ISO_PATTERN.matcher(trimmed).matches()) {
            return trimmed;
        }

        String cleaned = ORDINAL_SUFFIX.matcher(trimmed).replaceAll("$1");

        for (DateTimeFormatter format : EXPLICIT_FORMATS) {
            try {
                return LocalDate.parse(cleaned, format).format(ISO_FORMATTER);
            } catch (DateTimeParseException e) {
                // next format
            }
        }

        LocalDate scanned = scanDayFirst(cleaned);
        if (scanned != null) {
            return scanned.format(ISO_FORMATTER);
        }

        log.warn("Could not parse date: '{}'", value);
        return null;
    }

    /**
     * Parses an already normalized ISO date.
     *
     * @param isoDate Value produced by {@link #normalize(String)}
     * @return The date, or null if the value is not a valid ISO date
     */
    public static LocalDate parseIso(Object isoDate) {
        if (!(isoDate instanceof String text) || text.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(text.trim(), ISO_FORMATTER);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Tolerant scan used when no explicit format matched: picks a month name if one
     * is present, a four-digit year, and reads the remaining numbers day-first.
     */
    private static LocalDate scanDayFirst(String text) {
        Integer month = null;
        Integer year = null;
        boolean yearFirst = false;
        List<Integer> numbers = new ArrayList<>();

        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            String token = matcher.group();
            if (Character.isDigit(token.charAt(0))) {
                if (token.length() > 9) {
                    continue;
                }
                if (token.length() == 4 && year == null) {
                    year = Integer.parseInt(token);
                    yearFirst = numbers.isEmpty() && month == null;
                } else {
                    numbers.add(Integer.parseInt(token));
                }
            } else if (month == null) {
                month = MONTHS.get(token.toLowerCase(Locale.ROOT));
            }
        }

        if (year == null && numbers.size() >= 3) {
            year = 2000 + numbers.remove(2);
        }
        if (year == null) {
            return null;
        }

        int day;
        if (month != null) {
            day = numbers.isEmpty() ? 1 : numbers.get(0);
        } else {
            if (numbers.size() < 2) {
                return null;
            }
            int first = numbers.get(0);
            int second = numbers.get(1);
            if (yearFirst) {
                month = first;
                day = second;
            } else if (second > 12 && first <= 12) {
                month = first;
                day = second;
            } else {
                day = first;
                month = second;
            }
        }

        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
