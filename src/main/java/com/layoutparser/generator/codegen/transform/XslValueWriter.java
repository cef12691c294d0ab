package com.layoutparser.generator.codegen.transform;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.layoutparser.generator.model.expression.Concat;
import com.layoutparser.generator.model.expression.ConfigLookup;
import com.layoutparser.generator.model.expression.RuleExpressionVisitor;
import com.layoutparser.generator.model.expression.SourceReference;
import com.layoutparser.generator.model.expression.UnknownFunction;

/**
 * Translates a rule expression into the XSL fragment that produces its value.
 */
class XslValueWriter implements RuleExpressionVisitor<String> {

    private static final Logger log = LoggerFactory.getLogger(XslValueWriter.class);

    private final String targetPath;
    private final List<String> warnings;

    XslValueWriter(String targetPath, List<String> warnings) {
        this.targetPath = targetPath;
        this.warnings = warnings;
    }

    @Override
    public String visit(ConfigLookup lookup) {
        // Filled in by the runtime configuration
        return "<!-- config: " + XslExpressions.commentText(lookup.getKey()) + " -->";
    }

    @Override
    public String visit(Concat concat) {
        return "<xsl:value-of select=\"concat(" + XslExpressions.argument(concat.getLeft()) + ", "
                + XslExpressions.argument(concat.getRight()) + ")\"/>";
    }

    @Override
    public String visit(SourceReference reference) {
        return "<xsl:value-of select=\"normalize-space(" + XslExpressions.sourcePath(reference.path()) + ")\"/>";
    }

    @Override
    public String visit(UnknownFunction unknown) {
        warnings.add("Unsupported function '" + unknown.getFunctionName() + "' for " + targetPath
                + ", emitted an empty placeholder");
        log.warn("Unsupported rule function {} for {}", unknown.getFunctionName(), targetPath);
        return "<!-- unsupported: " + XslExpressions.commentText(unknown.getFunctionName()) + " -->";
    }
}
