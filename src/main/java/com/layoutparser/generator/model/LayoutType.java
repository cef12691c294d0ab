package com.layoutparser.generator.model;

import java.util.Locale;

/**
 * Physical format of a layout.
 */
public enum LayoutType {
    TEXT_POSITIONAL,
    XML,
    JSON;

    public static LayoutType fromValue(String value) {
        if (value == null) {
            return TEXT_POSITIONAL;
        }
        String normalized = value.toUpperCase(Locale.ROOT).replace("-", "").replace("_", "").trim();
        return switch (normalized) {
            case "XML" -> XML;
            case "JSON" -> JSON;
            default -> TEXT_POSITIONAL;
        };
    }
}
