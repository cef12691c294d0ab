package com.layoutparser.generator.model.expression;

/**
 * Visitor pattern interface for rule expressions.
 */
public interface RuleExpressionVisitor<R> {
    R visit(ConfigLookup lookup);
    R visit(Concat concat);
    R visit(SourceReference reference);
    R visit(UnknownFunction unknown);
}
