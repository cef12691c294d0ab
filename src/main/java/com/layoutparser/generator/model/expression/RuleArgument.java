package com.layoutparser.generator.model.expression;

import lombok.Value;

/**
 * Argument of a rule function: a quoted literal or a reference into the input record.
 */
@Value
public class RuleArgument {

    public enum Kind {
        LITERAL,
        SOURCE
    }

    Kind kind;
    String value;

    public static RuleArgument literal(String value) {
        return new RuleArgument(Kind.LITERAL, value);
    }

    public static RuleArgument source(String path) {
        return new RuleArgument(Kind.SOURCE, path);
    }

    public boolean isLiteral() {
        return kind == Kind.LITERAL;
    }
}
