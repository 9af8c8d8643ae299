package org.example.stylelock.service.generation;

/**
 * Failure reported by a {@link GenerationClient}.
 */
public abstract class GenerationServiceException extends Exception {

    protected GenerationServiceException(String message) {
        super(message);
    }

    protected GenerationServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureKind getFailureKind();
}
