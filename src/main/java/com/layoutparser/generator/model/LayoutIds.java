package com.layoutparser.generator.model;

import java.util.Locale;

/**
 * Normalizes layout identifiers so stored and referenced forms compare equal.
 */
public final class LayoutIds {

    private static final String[] PREFIXES = { "LAY_", "GRT_" };

    private LayoutIds() {
        // Utility class
    }

    public static String normalize(String id) {
        if (id == null) {
            return "";
        }
        String value = id.trim();
        for (String prefix : PREFIXES) {
            if (value.regionMatches(true, 0, prefix, 0, prefix.length())) {
                value = value.substring(prefix.length());
                break;
            }
        }
        return value.toLowerCase(Locale.ROOT);
    }

    public static boolean sameLayout(String left, String right) {
        return !normalize(left).isEmpty() && normalize(left).equals(normalize(right));
    }
}
