package org.example.orchestration.model;

import org.example.orchestration.config.WorkspaceConfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of a workspace: its projects, the dependency edges between them
 * and the configured policy rules.
 */
public class Workspace {

    private final Path root;
    private final List<Project> projects;
    private final List<ProjectDependency> dependencies;
    private final WorkspaceConfig config;

    public Workspace(Path root, List<Project> projects, List<ProjectDependency> dependencies, WorkspaceConfig config) {
        this.root = Objects.requireNonNull(root, "root cannot be null");
        this.projects = List.copyOf(Objects.requireNonNull(projects, "projects cannot be null"));
        this.dependencies = List.copyOf(Objects.requireNonNull(dependencies, "dependencies cannot be null"));
        this.config = config != null ? config : WorkspaceConfig.defaults();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path getRoot() {
        return root;
    }

    public List<Project> getProjects() {
        return projects;
    }

    public List<ProjectDependency> getDependencies() {
        return dependencies;
    }

    public WorkspaceConfig getConfig() {
        return config;
    }

    public int getProjectCount() {
        return projects.size();
    }

    public int getDependencyCount() {
        return dependencies.size();
    }

    @Override
    public String toString() {
        return "Workspace{" +
                "root=" + root +
                ", projectCount=" + projects.size() +
                ", dependencyCount=" + dependencies.size() +
                ", rules=" + config.getRules().size() +
                '}';
    }

    /**
     * Builder for Workspace.
     */
    public static class Builder {
        private Path root = Path.of(".");
        private final List<Project> projects = new ArrayList<>();
        private final List<ProjectDependency> dependencies = new ArrayList<>();
        private WorkspaceConfig config = WorkspaceConfig.defaults();

        public Builder root(Path root) {
            this.root = root;
            return this;
        }

        public Builder addProject(Project project) {
            projects.add(project);
            return this;
        }

        public Builder projects(List<Project> projects) {
            this.projects.clear();
            this.projects.addAll(projects != null ? projects : Collections.emptyList());
            return this;
        }

        public Builder addDependency(ProjectDependency dependency) {
            dependencies.add(dependency);
            return this;
        }

        public Builder dependencies(List<ProjectDependency> dependencies) {
            this.dependencies.clear();
            this.dependencies.addAll(dependencies != null ? dependencies : Collections.emptyList());
            return this;
        }

        public Builder config(WorkspaceConfig config) {
            this.config = config;
            return this;
        }

        public Workspace build() {
            return new Workspace(root, projects, dependencies, config);
        }
    }
}
