package com.mondayBi.biAgent.cleaning.normalizer;

import java.util.regex.Pattern;

/**
 * Trims, collapses whitespace and title-cases free text so that
 * {@code "energy"}, {@code " ENERGY "} and {@code "Energy"} compare equal.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TextNormalizer() {}

    public static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String collapsed = WHITESPACE_RUN.matcher(value.trim()).replaceAll(" ");
        return titleCase(collapsed);
    }

    /**
     * Upper-cases every letter that follows a non-letter and lower-cases the rest,
     * so {@code "closed-won deal"} becomes {@code "Closed-Won Deal"}.
     */
    static String titleCase(String text) {
        StringBuilder result = new StringBuilder(text.length());
        boolean previousIsLetter = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLetter(c)) {
                result.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousIsLetter = true;
            } else {
                result.append(c);
                previousIsLetter = false;
            }
        }
        return result.toString();
    }
}
