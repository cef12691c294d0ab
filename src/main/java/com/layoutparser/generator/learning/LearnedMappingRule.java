package com.layoutparser.generator.learning;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A previously confirmed source location for an output element.
 */
@Value
@Builder
@Jacksonized
public class LearnedMappingRule {
    String sourceField;
    String targetElement;
    String targetXPath;
    String transformType;
    double confidence;
}
