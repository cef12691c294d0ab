package com.layoutparser.generator.model.expression;

/**
 * Base class for the right-hand side of a rule assignment.
 */
public abstract class RuleExpression {

    public abstract <R> R accept(RuleExpressionVisitor<R> visitor);
}
