package com.layoutparser.generator.codegen.transform;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Final pass over a stylesheet: removes the legacy vendor extension namespace and makes
 * sure {@code xsi} is declared wherever it is used. Running it twice changes nothing.
 */
public class XslPostProcessor {

    public static final String XSI_DECLARATION = "xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\"";

    private static final Pattern VENDOR_NAMESPACE = Pattern.compile("\\s+xmlns:ng=\"[^\"]*\"");
    private static final Pattern EXCLUDE_PREFIXES = Pattern.compile("\\s+exclude-result-prefixes=\"ng\"");
    private static final Pattern EXTENSION_PREFIXES = Pattern.compile("\\s+extension-element-prefixes=\"ng\"");
    private static final Pattern XSI_USAGE = Pattern.compile("(?<!xmlns:)\\bxsi:");
    private static final Pattern STYLESHEET_TAG = Pattern.compile("<xsl:stylesheet\\b[^>]*>");
    private static final Pattern OUTPUT_ROOT_TAG = Pattern.compile("<(?!xsl:)([A-Za-z_][\\w.\\-]*)\\b[^>]*\\sxmlns=\"[^\"]*\"[^>]*>");

    public String clean(String stylesheet) {
        if (stylesheet == null) {
            return null;
        }
        String result = VENDOR_NAMESPACE.matcher(stylesheet).replaceAll("");
        result = EXCLUDE_PREFIXES.matcher(result).replaceAll("");
        result = EXTENSION_PREFIXES.matcher(result).replaceAll("");

        if (XSI_USAGE.matcher(result).find()) {
            result = declareXsi(result, STYLESHEET_TAG);
            result = declareXsi(result, OUTPUT_ROOT_TAG);
        }
        return result;
    }

    private static String declareXsi(String text, Pattern tagPattern) {
        Matcher m = tagPattern.matcher(text);
        if (!m.find()) {
            return text;
        }
        String tag = m.group();
        if (tag.contains("xmlns:xsi=")) {
            return text;
        }
        int nameEnd = tag.indexOf(' ') > 0 ? tag.indexOf(' ') : tag.length() - 1;
        String updated = tag.substring(0, nameEnd) + " " + XSI_DECLARATION + tag.substring(nameEnd);
        return text.substring(0, m.start()) + updated + text.substring(m.end());
    }
}
