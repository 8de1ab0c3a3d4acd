package org.example.orchestration.exception;

/**
 * Exception thrown when an operation references a project that is not registered.
 */
public class UnknownProjectException extends OrchestrationException {

    private final String projectName;

    public UnknownProjectException(String projectName) {
        super(ErrorKind.UNKNOWN_PROJECT, "Project not found: " + projectName);
        this.projectName = projectName;
    }

    public String getProjectName() {
        return projectName;
    }
}
