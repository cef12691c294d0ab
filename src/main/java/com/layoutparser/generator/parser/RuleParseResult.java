package com.layoutparser.generator.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.layoutparser.generator.model.expression.RuleAssignment;

import lombok.Data;

/**
 * Assignments extracted from a mapping's rules, keyed by target path in first-seen order.
 */
@Data
public class RuleParseResult {
    private final Map<String, RuleAssignment> assignments = new LinkedHashMap<>();
    private final List<String> warnings = new ArrayList<>();

    /**
     * Registers an assignment unless its target path was already assigned.
     *
     * @return false when the target path was a duplicate
     */
    public boolean addAssignment(RuleAssignment assignment) {
        return assignments.putIfAbsent(assignment.getTargetPath(), assignment) == null;
    }

    public List<RuleAssignment> getAllAssignments() {
        return new ArrayList<>(assignments.values());
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }
}
