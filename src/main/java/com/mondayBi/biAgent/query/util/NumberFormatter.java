package com.mondayBi.biAgent.query.util;

import java.util.Locale;

/**
 * Formats rupee amounts the way Indian business reports write them:
 * Crore (Cr), Lakh (L) and Thousand (K) abbreviations.
 */
public final class NumberFormatter {

    private static final String CURRENCY = "₹";
    private static final double CRORE = 10_000_000d;
    private static final double LAKH = 100_000d;
    private static final double THOUSAND = 1_000d;

    private NumberFormatter() {}

    /**
     * Formats an amount for display.
     *
     * @param value Amount, may be null
     * @return e.g. {@code "₹1.7Cr"}, {@code "₹12.5L"}, {@code "₹950"}, or {@code "N/A"} for null
     */
    public static String format(Double value) {
        if (value == null) {
            return "N/A";
        }
        double magnitude = Math.abs(value);
        if (magnitude >= CRORE) {
            return CURRENCY + String.format(Locale.ENGLISH, "%.1fCr", value / CRORE);
        }
        if (magnitude >= LAKH) {
            return CURRENCY + String.format(Locale.ENGLISH, "%.1fL", value / LAKH);
        }
        if (magnitude >= THOUSAND) {
            return CURRENCY + String.format(Locale.ENGLISH, "%.1fK", value / THOUSAND);
        }
        return CURRENCY + String.format(Locale.ENGLISH, "%,.0f", value);
    }
}
