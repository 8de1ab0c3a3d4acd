package org.example.orchestration.version;

import java.util.List;
import java.util.Objects;

/**
 * One planned version update.
 */
public class VersionUpdateStep {

    private final String project;
    private final String newVersion;
    private final List<String> dependents;
    private final boolean breaking;

    public VersionUpdateStep(String project, String newVersion, List<String> dependents, boolean breaking) {
        this.project = Objects.requireNonNull(project, "project cannot be null");
        this.newVersion = Objects.requireNonNull(newVersion, "newVersion cannot be null");
        this.dependents = dependents != null ? List.copyOf(dependents) : List.of();
        this.breaking = breaking;
    }

    public String getProject() {
        return project;
    }

    public String getNewVersion() {
        return newVersion;
    }

    /**
     * Returns the names of the projects that transitively depend on this step's project.
     */
    public List<String> getDependents() {
        return dependents;
    }

    public boolean isBreaking() {
        return breaking;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VersionUpdateStep that = (VersionUpdateStep) o;
        return breaking == that.breaking &&
               Objects.equals(project, that.project) &&
               Objects.equals(newVersion, that.newVersion) &&
               Objects.equals(dependents, that.dependents);
    }

    @Override
    public int hashCode() {
        return Objects.hash(project, newVersion, dependents, breaking);
    }

    @Override
    public String toString() {
        return project + " -> " + newVersion + (breaking ? " (breaking)" : "");
    }
}
