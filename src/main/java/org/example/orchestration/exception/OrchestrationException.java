package org.example.orchestration.exception;

/**
 * Base exception for all workspace orchestration errors.
 */
public abstract class OrchestrationException extends Exception {

    private final ErrorKind kind;

    protected OrchestrationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected OrchestrationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
