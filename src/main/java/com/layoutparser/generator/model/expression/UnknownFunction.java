package com.layoutparser.generator.model.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Function call outside the supported set. Kept so the generator can warn and emit a placeholder.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class UnknownFunction extends RuleExpression {

    private final String functionName;
    private final String rawText;

    public UnknownFunction(String functionName, String rawText) {
        this.functionName = functionName;
        this.rawText = rawText;
    }

    @Override
    public <R> R accept(RuleExpressionVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
