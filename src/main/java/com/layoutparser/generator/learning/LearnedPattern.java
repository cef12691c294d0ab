package com.layoutparser.generator.learning;

import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A structural pattern with how often it was seen and how much it is trusted.
 */
@Value
@Builder
@Jacksonized
public class LearnedPattern {

    public static final String TCL_LINE = "TclLine";
    public static final String XSL_TEMPLATE = "XslTemplate";

    String type;
    String name;
    String pattern;
    int frequency;
    double confidence;
    @Singular("metadataEntry")
    Map<String, Object> metadata;
}
