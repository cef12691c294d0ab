package com.layoutparser.generator.model.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Value supplied by runtime configuration; rendered as an empty placeholder.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class ConfigLookup extends RuleExpression {

    private final String key;

    public ConfigLookup(String key) {
        this.key = key;
    }

    @Override
    public <R> R accept(RuleExpressionVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
