package com.layoutparser.generator.codegen;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utility for XML-safe element names and the field names used in generated maps.
 */
public final class ElementNames {

    private static final Pattern INVALID_CHARS = Pattern.compile("[^A-Za-z0-9_.\\-]");
    private static final Pattern VALID_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.\\-]*$");
    private static final Pattern RESERVED_PREFIX = Pattern.compile("^(?i)(xmlns|xml)(:|_)?");
    private static final Pattern REPEATED_UNDERSCORES = Pattern.compile("_{2,}");
    private static final String FALLBACK = "element";
    private static final String LEADING_DIGIT_PREFIX = "n";

    private ElementNames() {
        // Utility class
    }

    /**
     * Makes {@code name} usable as an XML element name: drops a reserved {@code xml}/{@code xmlns}
     * prefix, replaces illegal characters (including {@code :}) with '_', collapses and trims
     * underscores, and prefixes names that start with a digit.
     */
    public static String sanitize(String name) {
        if (name == null || name.isBlank()) {
            return FALLBACK;
        }
        String cleaned = RESERVED_PREFIX.matcher(name.trim()).replaceFirst("");
        cleaned = INVALID_CHARS.matcher(cleaned).replaceAll("_");
        cleaned = REPEATED_UNDERSCORES.matcher(cleaned).replaceAll("_");
        cleaned = trimUnderscores(cleaned);
        if (cleaned.isEmpty()) {
            return FALLBACK;
        }
        if (!Character.isLetter(cleaned.charAt(0))) {
            cleaned = LEADING_DIGIT_PREFIX + cleaned;
        }
        return cleaned;
    }

    private static String trimUnderscores(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == '_') {
            start++;
        }
        while (end > start && text.charAt(end - 1) == '_') {
            end--;
        }
        return text.substring(start, end);
    }

    public static boolean isValid(String name) {
        return name != null && VALID_NAME.matcher(name).matches();
    }

    /**
     * Field name as written to a map: spaces, hyphens and underscores removed and the first
     * character lower-cased.
     */
    public static String toMapFieldName(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        String compact = name.replace(" ", "").replace("-", "").replace("_", "");
        if (compact.isEmpty()) {
            return compact;
        }
        return Character.toLowerCase(compact.charAt(0)) + compact.substring(1);
    }

    /**
     * Lower-cased name without underscores, used for loose comparisons.
     */
    public static String normalizedKey(String name) {
        return name == null ? "" : name.replace("_", "").toLowerCase(Locale.ROOT);
    }
}
