package org.example.orchestration.model;

import java.util.Objects;

/**
 * Represents a dependency relationship between two workspace projects.
 * This is a directed edge from the dependent ({@code from}) to the dependency ({@code to}).
 */
public class ProjectDependency {

    private final String from;
    private final String to;
    private final DependencyType dependencyType;
    private final String versionConstraint;

    /**
     * Creates a new ProjectDependency.
     *
     * @param from              name of the dependent project
     * @param to                name of the project depended upon
     * @param dependencyType    kind of dependency
     * @param versionConstraint constraint the dependent places on the dependency's version
     *                          (caret, tilde or {@code >=} form; may be empty)
     */
    public ProjectDependency(String from, String to, DependencyType dependencyType, String versionConstraint) {
        this.from = Objects.requireNonNull(from, "from cannot be null");
        this.to = Objects.requireNonNull(to, "to cannot be null");
        this.dependencyType = dependencyType != null ? dependencyType : DependencyType.DIRECT;
        this.versionConstraint = versionConstraint != null ? versionConstraint : "";
    }

    /**
     * Creates a direct dependency without a version constraint.
     */
    public static ProjectDependency direct(String from, String to) {
        return new ProjectDependency(from, to, DependencyType.DIRECT, "");
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    public DependencyType getDependencyType() {
        return dependencyType;
    }

    public String getVersionConstraint() {
        return versionConstraint;
    }

    public boolean hasVersionConstraint() {
        return !versionConstraint.isBlank();
    }

    /**
     * Returns a string representation of this dependency edge.
     */
    public String getEdgeDescription() {
        return from + " -> " + to +
               " (" + dependencyType.name().toLowerCase() +
               (hasVersionConstraint() ? ", " + versionConstraint : "") + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProjectDependency that = (ProjectDependency) o;
        return Objects.equals(from, that.from) &&
               Objects.equals(to, that.to) &&
               dependencyType == that.dependencyType &&
               Objects.equals(versionConstraint, that.versionConstraint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, dependencyType, versionConstraint);
    }

    @Override
    public String toString() {
        return getEdgeDescription();
    }

    /**
     * Builder for ProjectDependency.
     */
    public static class Builder {
        private String from;
        private String to;
        private DependencyType dependencyType = DependencyType.DIRECT;
        private String versionConstraint = "";

        public Builder from(String from) {
            this.from = from;
            return this;
        }

        public Builder to(String to) {
            this.to = to;
            return this;
        }

        public Builder dependencyType(DependencyType dependencyType) {
            this.dependencyType = dependencyType;
            return this;
        }

        public Builder versionConstraint(String versionConstraint) {
            this.versionConstraint = versionConstraint;
            return this;
        }

        public ProjectDependency build() {
            return new ProjectDependency(from, to, dependencyType, versionConstraint);
        }
    }
}
