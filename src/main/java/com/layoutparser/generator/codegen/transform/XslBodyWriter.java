package com.layoutparser.generator.codegen.transform;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes the output node tree as the body of the root template.
 */
class XslBodyWriter {

    private static final int BASE_INDENT = 2;

    private final StringBuilder sb = new StringBuilder();

    String write(OutputNode root) {
        sb.setLength(0);
        writeElement(root, BASE_INDENT);
        return sb.toString();
    }

    private void writeElement(OutputNode node, int level) {
        LookupPlan lookup = node.getLookup();
        boolean guarded = lookup != null && !lookup.isEmitWhenUnmatched() && !lookup.getEmbedded().isEmpty();
        int elementLevel = guarded ? level + 1 : level;

        if (guarded) {
            line(level, "<xsl:if test=\"" + anyMatch(lookup.getEmbedded()) + "\">");
        }

        String open = "<" + node.getName()
                + (node.getNamespace() != null ? " xmlns=\"" + XslExpressions.escapeAttribute(node.getNamespace()) + "\"" : "");
        if (node.childNodes().isEmpty() && !node.hasValue()) {
            line(elementLevel, open + "/>");
        } else {
            line(elementLevel, open + ">");
            for (OutputNode child : node.childNodes()) {
                if (child.isAttribute()) {
                    writeAttribute(child, elementLevel + 1);
                }
            }
            writeValue(node, elementLevel + 1);
            for (OutputNode child : node.childNodes()) {
                if (!child.isAttribute()) {
                    writeElement(child, elementLevel + 1);
                }
            }
            line(elementLevel, "</" + node.getName() + ">");
        }

        if (guarded) {
            line(level, "</xsl:if>");
        }
    }

    private void writeAttribute(OutputNode attribute, int level) {
        line(level, "<xsl:attribute name=\"" + attribute.getName() + "\">");
        writeValue(attribute, level + 1);
        line(level, "</xsl:attribute>");
    }

    private void writeValue(OutputNode node, int level) {
        if (node.getValueXsl() != null) {
            line(level, node.getValueXsl());
        } else if (node.getLookup() != null) {
            writeLookup(node.getLookup(), level);
        }
    }

    private void writeLookup(LookupPlan plan, int level) {
        if (plan.getEmbedded().isEmpty()) {
            if (plan.hasDefaultValue()) {
                line(level, "<xsl:text>" + XslExpressions.escapeText(plan.getDefaultValue()) + "</xsl:text>");
            }
            return;
        }
        line(level, "<xsl:choose>");
        for (String candidate : plan.getEmbedded()) {
            line(level + 1, "<xsl:when test=\"" + XslExpressions.nonEmpty(candidate) + "\">"
                    + "<xsl:value-of select=\"normalize-space(" + candidate + ")\"/></xsl:when>");
        }
        if (plan.hasDefaultValue()) {
            line(level + 1, "<xsl:otherwise>" + XslExpressions.escapeText(plan.getDefaultValue()) + "</xsl:otherwise>");
        }
        line(level, "</xsl:choose>");
    }

    private static String anyMatch(List<String> candidates) {
        return candidates.stream().map(XslExpressions::nonEmpty).collect(Collectors.joining(" or "));
    }

    private void line(int level, String text) {
        sb.append("\t".repeat(level)).append(text).append("\n");
    }
}
