package com.layoutparser.generator.model.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Concatenation of two arguments.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class Concat extends RuleExpression {

    private final RuleArgument left;
    private final RuleArgument right;

    public Concat(RuleArgument left, RuleArgument right) {
        this.left = left;
        this.right = right;
    }

    @Override
    public <R> R accept(RuleExpressionVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
