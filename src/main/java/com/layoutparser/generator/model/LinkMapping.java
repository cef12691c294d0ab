package com.layoutparser.generator.model;

import lombok.Builder;
import lombok.Value;

/**
 * Lookup of a value from the input record by element name, with an optional default.
 */
@Value
@Builder
public class LinkMapping {
    String name;
    String description;
    int sequence;
    String inputLayoutId;
    String targetLayoutId;
    String defaultValue;
    @Builder.Default
    boolean allowEmpty = true;
    boolean required;

    public boolean hasDefaultValue() {
        return defaultValue != null && !defaultValue.isEmpty();
    }
}
