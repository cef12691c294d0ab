package com.layoutparser.generator.synthesis;

/**
 * How candidate lines are produced.
 */
public enum GenerationMode {
    DETERMINISTIC,
    RANDOM,
    LLM
}
