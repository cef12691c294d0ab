package com.layoutparser.generator.model;

import java.util.Locale;

/**
 * Alignment of a value inside its fixed-width slot.
 */
public enum Alignment {
    LEFT,
    RIGHT,
    CENTER;

    public static Alignment fromValue(String value) {
        if (value == null) {
            return LEFT;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "RIGHT", "DIREITA", "2" -> RIGHT;
            case "CENTER", "CENTRO", "3" -> CENTER;
            default -> LEFT;
        };
    }

    /**
     * Truncates or pads {@code value} with spaces to exactly {@code width} characters.
     */
    public String fit(String value, int width) {
        String text = value == null ? "" : value;
        if (text.length() >= width) {
            return text.substring(0, width);
        }
        int padding = width - text.length();
        return switch (this) {
            case RIGHT -> " ".repeat(padding) + text;
            case CENTER -> " ".repeat(padding / 2) + text + " ".repeat(padding - padding / 2);
            case LEFT -> text + " ".repeat(padding);
        };
    }
}
