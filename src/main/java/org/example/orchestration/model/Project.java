package org.example.orchestration.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Represents a project in the workspace.
 * Identified by its name, which is unique within a workspace.
 *
 * <p>Instances are immutable; version and status changes produce a copy.</p>
 */
public class Project {

    private final Path path;
    private final String name;
    private final String projectType;
    private final String version;
    private final ProjectStatus status;

    /**
     * Creates a new Project.
     *
     * @param path        location of the project inside the workspace
     * @param name        unique project name
     * @param projectType build type of the project (e.g. "jar", "pom", "rust")
     * @param version     current version, expected in {@code major.minor.patch} form
     * @param status      health status
     */
    public Project(Path path, String name, String projectType, String version, ProjectStatus status) {
        this.path = Objects.requireNonNull(path, "path cannot be null");
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.projectType = projectType != null ? projectType : "unknown";
        this.version = Objects.requireNonNull(version, "version cannot be null");
        this.status = status != null ? status : ProjectStatus.UNKNOWN;
    }

    /**
     * Creates a new Project using the builder pattern.
     */
    public static Builder builder() {
        return new Builder();
    }

    // Getters

    public Path getPath() {
        return path;
    }

    public String getName() {
        return name;
    }

    public String getProjectType() {
        return projectType;
    }

    public String getVersion() {
        return version;
    }

    public ProjectStatus getStatus() {
        return status;
    }

    // Copies

    public Project withVersion(String newVersion) {
        return new Project(path, name, projectType, newVersion, status);
    }

    public Project withStatus(ProjectStatus newStatus) {
        return new Project(path, name, projectType, version, newStatus);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Project that = (Project) o;
        return Objects.equals(path, that.path) &&
               Objects.equals(name, that.name) &&
               Objects.equals(projectType, that.projectType) &&
               Objects.equals(version, that.version) &&
               status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, name, projectType, version, status);
    }

    @Override
    public String toString() {
        return name + "@" + version;
    }

    /**
     * Builder for Project.
     */
    public static class Builder {
        private Path path;
        private String name;
        private String projectType = "unknown";
        private String version = "0.1.0";
        private ProjectStatus status = ProjectStatus.HEALTHY;

        public Builder path(Path path) {
            this.path = path;
            return this;
        }

        public Builder path(String path) {
            this.path = Path.of(path);
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder projectType(String projectType) {
            this.projectType = projectType;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder status(ProjectStatus status) {
            this.status = status;
            return this;
        }

        /**
         * Builds the project. When no path was given, the name is used as a relative path.
         */
        public Project build() {
            Path resolved = path != null ? path : (name != null ? Path.of(name) : null);
            return new Project(resolved, name, projectType, version, status);
        }
    }
}
