package com.layoutparser.generator.model.expression;

import java.util.Arrays;
import java.util.List;

import lombok.Value;

/**
 * {@code targetPath = expression}, extracted from a rule's content.
 */
@Value
public class RuleAssignment {
    String targetPath;
    RuleExpression expression;
    int ruleSequence;

    public List<String> targetSegments() {
        return Arrays.stream(targetPath.split("/")).filter(s -> !s.isBlank()).toList();
    }
}
