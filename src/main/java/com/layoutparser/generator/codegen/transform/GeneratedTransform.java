package com.layoutparser.generator.codegen.transform;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A generated (or embedded) stylesheet with the details that produced it.
 */
@Value
@Builder
public class GeneratedTransform {
    String stylesheet;
    String rootElement;
    String namespace;
    boolean fromEmbeddedXsl;
    int assignmentCount;
    @Singular
    List<LookupPlan> lookupPlans;
    @Singular
    List<String> warnings;
}
