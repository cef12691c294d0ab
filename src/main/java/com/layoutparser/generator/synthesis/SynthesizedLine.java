package com.layoutparser.generator.synthesis;

import java.util.List;

import lombok.Value;

/**
 * An accepted line. {@code normalized} marks lines forced to width after the retry budget ran out.
 */
@Value
public class SynthesizedLine {
    String lineName;
    int occurrence;
    String content;
    int attempts;
    boolean normalized;
    List<String> errors;
}
