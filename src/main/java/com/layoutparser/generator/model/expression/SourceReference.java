package com.layoutparser.generator.model.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Direct copy of an input field, addressed as {@code LINE/field}.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class SourceReference extends RuleExpression {

    private final String line;
    private final String field;

    public SourceReference(String line, String field) {
        this.line = line;
        this.field = field;
    }

    public String path() {
        return line + "/" + field;
    }

    @Override
    public <R> R accept(RuleExpressionVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
