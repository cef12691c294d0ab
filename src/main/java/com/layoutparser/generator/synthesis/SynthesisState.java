package com.layoutparser.generator.synthesis;

/**
 * States of the per-line generate/validate loop.
 */
public enum SynthesisState {
    GENERATE,
    VALIDATE,
    ACCEPT,
    RETRY,
    GIVE_UP
}
