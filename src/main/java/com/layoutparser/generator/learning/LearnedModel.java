package com.layoutparser.generator.learning;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Patterns and mapping rules learned for one layout. Read-only to the generators.
 */
@Value
@Builder
@Jacksonized
public class LearnedModel {
    String layoutName;
    @Singular
    List<LearnedPattern> patterns;
    @Singular
    List<LearnedMappingRule> mappingRules;

    public List<LearnedPattern> patternsOfType(String type) {
        return patterns.stream().filter(p -> type.equals(p.getType())).toList();
    }

    /**
     * Element name to source XPath for rules trusted at least {@code minConfidence}.
     * The most confident rule wins when an element has several.
     */
    public Map<String, String> lookupHints(double minConfidence) {
        Map<String, LearnedMappingRule> best = new LinkedHashMap<>();
        for (LearnedMappingRule rule : mappingRules) {
            if (rule.getConfidence() < minConfidence || rule.getTargetElement() == null
                    || rule.getTargetXPath() == null || rule.getTargetXPath().isBlank()) {
                continue;
            }
            best.merge(rule.getTargetElement(), rule,
                    (current, candidate) -> candidate.getConfidence() > current.getConfidence() ? candidate : current);
        }
        Map<String, String> hints = new LinkedHashMap<>();
        best.forEach((element, rule) -> hints.put(element, rule.getTargetXPath()));
        return hints;
    }
}
