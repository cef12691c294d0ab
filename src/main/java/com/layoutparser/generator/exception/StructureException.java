package com.layoutparser.generator.exception;

/**
 * A layout or mapping definition is malformed, missing, or empty.
 */
public class StructureException extends LayoutGeneratorException {

    public StructureException(String message) {
        super(message);
    }

    public StructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
