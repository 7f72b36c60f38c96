package com.kgbio.lookup.util;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Timestamps as returned by the query service, e.g. {@code 1972-01-05T00:00:00Z}.
 */
public final class WikidataDates {
    private WikidataDates() {}

    /** Parsed instant, or null when absent or not an ISO instant. */
    public static Instant parse(String value) {
        if (value == null || value.isBlank()) return null;
        String s = value.trim();
        if (s.startsWith("+")) s = s.substring(1);
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Year part of a timestamp for display ({@code 1972-01-05T00:00:00Z} gives {@code 1972}),
     * null when absent.
     */
    public static String year(String value) {
        if (value == null || value.isBlank()) return null;
        String s = value.trim();
        boolean negative = s.startsWith("-");
        if (s.startsWith("+") || negative) s = s.substring(1);
        int dash = s.indexOf('-');
        String digits = dash > 0 ? s.substring(0, dash) : (s.length() >= 4 ? s.substring(0, 4) : s);
        if (digits.isEmpty()) return null;
        return negative ? "-" + digits : digits;
    }
}
