package com.layoutparser.generator.codegen;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.layoutparser.generator.model.LineDef;

/**
 * Maps line names to the short identifiers and ordering keys used in generated maps.
 *
 * HEADER keeps its name, anything containing TRAILER becomes TRAILER, and numbered
 * lines ({@code LINHAnnn}) become A..Z, then AA..AZ, then Znn.
 */
public final class LineIdentifiers {

    private static final Pattern NUMBERED_LINE = Pattern.compile("^LINHA(\\d+)$", Pattern.CASE_INSENSITIVE);

    public static final int HEADER_KEY = 0;
    public static final int TRAILER_KEY = Integer.MAX_VALUE;
    public static final int UNNUMBERED_KEY = 5000;

    private LineIdentifiers() {
        // Utility class
    }

    public static String identifierFor(String lineName) {
        if (lineName == null || lineName.isEmpty()) {
            return "UNKNOWN";
        }
        String upper = lineName.toUpperCase(Locale.ROOT);
        if (upper.equals(LineDef.HEADER)) {
            return LineDef.HEADER;
        }
        if (upper.contains(LineDef.TRAILER)) {
            return LineDef.TRAILER;
        }

        Matcher m = NUMBERED_LINE.matcher(lineName);
        if (m.matches()) {
            int num = lineNumber(m.group(1));
            if (num <= 25) {
                return String.valueOf((char) ('A' + num));
            }
            if (num <= 51) {
                int offset = num - 26;
                return "" + (char) ('A' + offset / 26) + (char) ('A' + offset % 26);
            }
            return String.format("Z%02d", num);
        }

        return Character.isLetter(lineName.charAt(0))
                ? String.valueOf(Character.toUpperCase(lineName.charAt(0)))
                : "UNKNOWN";
    }

    public static int sequenceKeyFor(String lineName) {
        if (lineName == null) {
            return UNNUMBERED_KEY;
        }
        String upper = lineName.toUpperCase(Locale.ROOT);
        if (upper.equals(LineDef.HEADER)) {
            return HEADER_KEY;
        }
        if (upper.contains(LineDef.TRAILER)) {
            return TRAILER_KEY;
        }
        Matcher m = NUMBERED_LINE.matcher(lineName);
        if (m.matches()) {
            return lineNumber(m.group(1)) + 1;
        }
        return UNNUMBERED_KEY;
    }

    // Capped so that numbered keys stay below TRAILER_KEY
    private static int lineNumber(String digits) {
        String trimmed = digits.replaceFirst("^0+(?=\\d)", "");
        if (trimmed.length() > 9) {
            return Integer.MAX_VALUE - 2;
        }
        return Math.min(Integer.parseInt(trimmed), Integer.MAX_VALUE - 2);
    }
}
