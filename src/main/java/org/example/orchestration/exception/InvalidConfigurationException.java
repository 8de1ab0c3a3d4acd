package org.example.orchestration.exception;

import java.util.List;

/**
 * Exception thrown when workspace configuration or workspace data is malformed.
 */
public class InvalidConfigurationException extends OrchestrationException {

    private final List<String> validationErrors;

    public InvalidConfigurationException(String message) {
        super(ErrorKind.INVALID_CONFIGURATION, message);
        this.validationErrors = List.of(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(ErrorKind.INVALID_CONFIGURATION, message, cause);
        this.validationErrors = List.of(message);
    }

    public InvalidConfigurationException(String message, List<String> validationErrors) {
        super(ErrorKind.INVALID_CONFIGURATION, message);
        this.validationErrors = List.copyOf(validationErrors);
    }

    public List<String> getValidationErrors() {
        return validationErrors;
    }
}
