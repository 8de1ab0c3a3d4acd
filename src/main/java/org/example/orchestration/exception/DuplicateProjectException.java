package org.example.orchestration.exception;

/**
 * Exception thrown when a project name is registered twice.
 */
public class DuplicateProjectException extends OrchestrationException {

    private final String projectName;

    public DuplicateProjectException(String projectName) {
        super(ErrorKind.DUPLICATE_PROJECT, "Project already registered: " + projectName);
        this.projectName = projectName;
    }

    public String getProjectName() {
        return projectName;
    }
}
