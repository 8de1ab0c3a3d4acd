package org.example.orchestration.exception;

/**
 * Exception thrown when a version string is not a valid {@code major.minor.patch} triple.
 */
public class InvalidVersionException extends OrchestrationException {

    private final String version;

    public InvalidVersionException(String version, String reason) {
        super(ErrorKind.INVALID_VERSION, "Invalid version '" + version + "': " + reason);
        this.version = version;
    }

    public InvalidVersionException(String version, String reason, Throwable cause) {
        super(ErrorKind.INVALID_VERSION, "Invalid version '" + version + "': " + reason, cause);
        this.version = version;
    }

    public String getVersion() {
        return version;
    }
}
