package com.layoutparser.generator.codegen.transform;

import java.util.ArrayList;
import java.util.List;

import com.layoutparser.generator.model.expression.RuleArgument;

/**
 * XPath and XML text helpers for generated stylesheets.
 */
final class XslExpressions {

    private XslExpressions() {
        // Utility class
    }

    /**
     * Maps an input path ({@code LINE/field}) to its location in the intermediate record.
     */
    static String sourcePath(String path) {
        return "ROOT/" + path;
    }

    static String argument(RuleArgument argument) {
        return argument.isLiteral()
                ? literal(argument.getValue())
                : "normalize-space(" + sourcePath(argument.getValue()) + ")";
    }

    /**
     * XPath string literal, safe inside a double-quoted attribute.
     */
    static String literal(String value) {
        if (!value.contains("'")) {
            return "'" + escapeAttribute(value) + "'";
        }
        List<String> parts = new ArrayList<>();
        String[] pieces = value.split("'", -1);
        for (int i = 0; i < pieces.length; i++) {
            if (i > 0) {
                parts.add("&quot;'&quot;");
            }
            if (!pieces[i].isEmpty()) {
                parts.add("'" + escapeAttribute(pieces[i]) + "'");
            }
        }
        return parts.size() == 1 ? parts.get(0) : "concat(" + String.join(", ", parts) + ")";
    }

    static String escapeText(String value) {
        return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    static String escapeAttribute(String value) {
        return escapeText(value).replace("\"", "&quot;");
    }

    /**
     * Text safe inside an XML comment: no {@code --} run and no trailing dash.
     */
    static String commentText(String value) {
        String text = value.replaceAll("-{2,}", "-");
        while (text.endsWith("-")) {
            text = text.substring(0, text.length() - 1);
        }
        return text;
    }

    static String nonEmpty(String xpath) {
        return "normalize-space(" + xpath + ") != ''";
    }
}
