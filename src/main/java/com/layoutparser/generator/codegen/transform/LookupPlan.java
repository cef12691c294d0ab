package com.layoutparser.generator.codegen.transform;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Ranked fallback chain for one looked-up element.
 */
@Value
@Builder
public class LookupPlan {
    String mappingName;
    String elementName;
    @Singular
    List<String> targetSegments;
    // Full ranked list, deduplicated
    @Singular
    List<String> candidates;
    // The prefix of candidates that is written into the stylesheet
    @Singular("embedded")
    List<String> embedded;
    String defaultValue;
    boolean emitWhenUnmatched;

    public boolean hasDefaultValue() {
        return defaultValue != null && !defaultValue.isEmpty();
    }
}
