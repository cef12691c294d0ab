package com.layoutparser.generator.exception;

import lombok.Getter;

/**
 * An external collaborator (store, decryptor, language model) failed or timed out.
 */
@Getter
public class CollaboratorException extends LayoutGeneratorException {

    private final String collaborator;
    private final boolean timeout;

    public CollaboratorException(String collaborator, String message) {
        this(collaborator, message, false, null);
    }

    public CollaboratorException(String collaborator, String message, Throwable cause) {
        this(collaborator, message, false, cause);
    }

    public CollaboratorException(String collaborator, String message, boolean timeout, Throwable cause) {
        super(collaborator + ": " + message, cause);
        this.collaborator = collaborator;
        this.timeout = timeout;
    }

    public static CollaboratorException timedOut(String collaborator, long seconds) {
        return new CollaboratorException(collaborator, "timed out after " + seconds + "s", true, null);
    }
}
