package org.example.orchestration.version;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Record of one applied version update.
 *
 * <p>{@code success} is derived from the absence of an error, so the two never disagree.
 * An error is only recorded for inconsistencies found after the update was applied;
 * rejected updates are reported by exceptions instead.</p>
 */
public class VersionUpdateResult {

    private final String project;
    private final String oldVersion;
    private final String newVersion;
    private final List<String> affectedProjects;
    private final boolean breaking;
    private final String error;

    private VersionUpdateResult(Builder builder) {
        this.project = Objects.requireNonNull(builder.project, "project cannot be null");
        this.oldVersion = Objects.requireNonNull(builder.oldVersion, "oldVersion cannot be null");
        this.newVersion = Objects.requireNonNull(builder.newVersion, "newVersion cannot be null");
        this.affectedProjects = List.copyOf(builder.affectedProjects);
        this.breaking = builder.breaking;
        this.error = builder.error;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getProject() {
        return project;
    }

    public String getOldVersion() {
        return oldVersion;
    }

    public String getNewVersion() {
        return newVersion;
    }

    /**
     * Returns the names of the projects that transitively depend on the updated project.
     */
    public List<String> getAffectedProjects() {
        return affectedProjects;
    }

    public boolean isBreaking() {
        return breaking;
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns a copy of this result carrying the given error.
     */
    VersionUpdateResult withError(String newError) {
        return builder()
                .project(project)
                .oldVersion(oldVersion)
                .newVersion(newVersion)
                .affectedProjects(affectedProjects)
                .breaking(breaking)
                .error(newError)
                .build();
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return String.format("VersionUpdateResult{success=true, project=%s, %s -> %s, breaking=%s, affected=%s}",
                    project, oldVersion, newVersion, breaking, affectedProjects);
        } else {
            return String.format("VersionUpdateResult{success=false, project=%s, %s -> %s, error='%s'}",
                    project, oldVersion, newVersion, error);
        }
    }

    public static class Builder {
        private String project;
        private String oldVersion;
        private String newVersion;
        private List<String> affectedProjects = List.of();
        private boolean breaking;
        private String error;

        public Builder project(String project) {
            this.project = project;
            return this;
        }

        public Builder oldVersion(String oldVersion) {
            this.oldVersion = oldVersion;
            return this;
        }

        public Builder newVersion(String newVersion) {
            this.newVersion = newVersion;
            return this;
        }

        public Builder affectedProjects(List<String> affectedProjects) {
            this.affectedProjects = affectedProjects != null ? affectedProjects : List.of();
            return this;
        }

        public Builder breaking(boolean breaking) {
            this.breaking = breaking;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public VersionUpdateResult build() {
            return new VersionUpdateResult(this);
        }
    }
}
