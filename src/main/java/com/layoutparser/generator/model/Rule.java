package com.layoutparser.generator.model;

import lombok.Builder;
import lombok.Value;

/**
 * A rule of a mapping. Its content holds one or more target assignments.
 */
@Value
@Builder
public class Rule {
    String name;
    String description;
    int sequence;
    boolean required;
    String content;
    boolean createOnlyChildren;
}
