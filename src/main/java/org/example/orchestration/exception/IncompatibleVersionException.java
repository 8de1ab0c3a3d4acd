package org.example.orchestration.exception;

/**
 * Exception thrown when a version update violates a registered constraint.
 */
public class IncompatibleVersionException extends OrchestrationException {

    private final String projectName;
    private final String version;
    private final String constraint;

    public IncompatibleVersionException(String projectName, String version, String constraint) {
        super(ErrorKind.INCOMPATIBLE_VERSION,
                "Version " + version + " of " + projectName + " does not satisfy constraint " + constraint);
        this.projectName = projectName;
        this.version = version;
        this.constraint = constraint;
    }

    public String getProjectName() {
        return projectName;
    }

    public String getVersion() {
        return version;
    }

    public String getConstraint() {
        return constraint;
    }
}
