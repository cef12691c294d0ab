package com.layoutparser.generator.exception;

/**
 * Base type for failures raised by the layout generator.
 */
public class LayoutGeneratorException extends RuntimeException {

    public LayoutGeneratorException(String message) {
        super(message);
    }

    public LayoutGeneratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
