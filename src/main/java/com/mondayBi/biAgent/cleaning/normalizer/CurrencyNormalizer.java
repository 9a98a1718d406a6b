package com.mondayBi.biAgent.cleaning.normalizer;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes amounts such as {@code "₹1,200"}, {@code "1.5M"} or {@code "2 Lakh"} to a double.
 */
@Slf4j
public final class CurrencyNormalizer {

    private static final Pattern SYMBOLS_AND_SEPARATORS = Pattern.compile("[₹$€£¥,\\s]");
    private static final Pattern CURRENCY_CODE_PREFIX = Pattern.compile("^(?i)(rs\\.?|inr|usd)");
    private static final Pattern SUFFIXED_NUMBER = Pattern.compile(
            "^(-?\\d+\\.?\\d*)(K|M|B|Cr|Crore|Crores|L|Lakh|Lakhs)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern PLAIN_NUMBER = Pattern.compile("^[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?$");

    private static final Map<String, Double> MULTIPLIERS = Map.of(
            "K", 1_000d,
            "M", 1_000_000d,
            "B", 1_000_000_000d,
            "CR", 10_000_000d,
            "CRORE", 10_000_000d,
            "CRORES", 10_000_000d,
            "L", 100_000d,
            "LAKH", 100_000d,
            "LAKHS", 100_000d
    );

    private CurrencyNormalizer() {}

    /**
     * Normalizes a raw amount.
     *
     * @param value Raw text, may be null
     * @return Parsed amount, or null if the value is blank or not a number
     */
    public static Double normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }

        String cleaned = SYMBOLS_AND_SEPARATORS.matcher(value).replaceAll("");
        cleaned = CURRENCY_CODE_PREFIX.matcher(cleaned).replaceFirst("");
        if (cleaned.isEmpty()) {
            return null;
        }

        double multiplier = 1d;
        Matcher suffixed = SUFFIXED_NUMBER.matcher(cleaned);
        if (suffixed.matches()) {
            cleaned = suffixed.group(1);
            multiplier = MULTIPLIERS.getOrDefault(suffixed.group(2).toUpperCase(Locale.ROOT), 1d);
        }

        if (!PLAIN_NUMBER.matcher(cleaned).matches()) {
            log.warn("Could not parse currency/number: '{}'", value);
            return null;
        }
        return Double.parseDouble(cleaned) * multiplier;
    }

    /**
     * Reads a cleaned cell as a number. Cells of currency columns are already doubles;
     * anything else is parsed leniently and skipped when it is not numeric.
     *
     * @param cell Cleaned cell value
     * @return Numeric value, or null
     */
    public static Double toDouble(Object cell) {
        if (cell instanceof Number number) {
            return number.doubleValue();
        }
        if (cell instanceof String text && PLAIN_NUMBER.matcher(text.trim()).matches()) {
            return Double.parseDouble(text.trim());
        }
        return null;
    }
}
