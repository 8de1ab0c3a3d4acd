package org.example.orchestration.graph;

import org.example.orchestration.exception.CircularDependencyException;
import org.example.orchestration.exception.DuplicateProjectException;
import org.example.orchestration.exception.UnknownProjectException;
import org.example.orchestration.model.Project;
import org.example.orchestration.model.ProjectDependency;
import org.example.orchestration.model.ProjectStatus;
import org.example.orchestration.model.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Represents the dependency graph of a workspace.
 * Contains projects (nodes) and dependencies (edges).
 *
 * <p>Edges are indexed twice, by source and by target, so that both
 * {@link #getDependencies(String)} and {@link #getDependents(String)} only touch
 * the edges incident to the queried project. Cycles are allowed; they are detected
 * on demand, never rejected on insertion.</p>
 */
public class DependencyGraph {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraph.class);

    private final boolean directed;
    private final Map<String, Project> projects;
    private final List<ProjectDependency> dependencies;
    private final Map<String, List<ProjectDependency>> outgoing;
    private final Map<String, List<ProjectDependency>> incoming;

    /**
     * Creates a new empty DependencyGraph.
     *
     * @param directed whether the graph is declared directed; both modes keep a forward
     *                 and a reverse index and answer queries identically
     */
    public DependencyGraph(boolean directed) {
        this.directed = directed;
        this.projects = new LinkedHashMap<>();
        this.dependencies = new ArrayList<>();
        this.outgoing = new HashMap<>();
        this.incoming = new HashMap<>();
    }

    /**
     * Creates a new DependencyGraph using the builder pattern.
     */
    public static Builder builder() {
        return new Builder(true);
    }

    /**
     * Builds a directed graph holding the projects and edges of a workspace.
     *
     * @throws DuplicateProjectException if two projects share a name
     * @throws UnknownProjectException   if an edge names a project the workspace lacks
     */
    public static DependencyGraph of(Workspace workspace) throws DuplicateProjectException, UnknownProjectException {
        Builder builder = builder();
        for (Project project : workspace.getProjects()) {
            builder.addProject(project);
        }
        for (ProjectDependency dependency : workspace.getDependencies()) {
            builder.addDependency(dependency);
        }
        return builder.build();
    }

    /**
     * Returns the flag given at construction. It is recorded for callers only; queries
     * answer the same in both modes.
     */
    public boolean isDirected() {
        return directed;
    }

    // Modification methods

    /**
     * Adds a project to the graph.
     *
     * @throws DuplicateProjectException if a project with the same name is already registered
     */
    public void addProject(Project project) throws DuplicateProjectException {
        Objects.requireNonNull(project, "project cannot be null");
        if (projects.containsKey(project.getName())) {
            throw new DuplicateProjectException(project.getName());
        }
        projects.put(project.getName(), project);
        log.debug("Added project {}", project);
    }

    /**
     * Adds a dependency edge. Duplicate edges are kept.
     *
     * @throws UnknownProjectException if either endpoint is not registered
     */
    public void addDependency(ProjectDependency dependency) throws UnknownProjectException {
        Objects.requireNonNull(dependency, "dependency cannot be null");
        requireProject(dependency.getFrom());
        requireProject(dependency.getTo());

        dependencies.add(dependency);
        outgoing.computeIfAbsent(dependency.getFrom(), k -> new ArrayList<>()).add(dependency);
        incoming.computeIfAbsent(dependency.getTo(), k -> new ArrayList<>()).add(dependency);
        log.debug("Added dependency {}", dependency.getEdgeDescription());
    }

    /**
     * Removes every edge from {@code from} to {@code to}.
     *
     * @return the number of edges removed
     */
    public int removeDependency(String from, String to) {
        int before = dependencies.size();
        dependencies.removeIf(d -> d.getFrom().equals(from) && d.getTo().equals(to));

        List<ProjectDependency> out = outgoing.get(from);
        if (out != null) {
            out.removeIf(d -> d.getTo().equals(to));
        }
        List<ProjectDependency> in = incoming.get(to);
        if (in != null) {
            in.removeIf(d -> d.getFrom().equals(from));
        }
        return before - dependencies.size();
    }

    /**
     * Replaces the status of a registered project.
     *
     * @throws UnknownProjectException if the project is not registered
     */
    public void updateStatus(String name, ProjectStatus status) throws UnknownProjectException {
        Project project = requireProject(name);
        projects.put(name, project.withStatus(status));
    }

    /**
     * Replaces the version of a registered project.
     *
     * @throws UnknownProjectException if the project is not registered
     */
    public void updateVersion(String name, String version) throws UnknownProjectException {
        Project project = requireProject(name);
        projects.put(name, project.withVersion(version));
    }

    // Query methods

    /**
     * Returns all projects, in insertion order.
     */
    public List<Project> getProjects() {
        return new ArrayList<>(projects.values());
    }

    public Optional<Project> getProject(String name) {
        return Optional.ofNullable(projects.get(name));
    }

    public boolean hasProject(String name) {
        return projects.containsKey(name);
    }

    /**
     * Returns all dependency edges, in insertion order.
     */
    public List<ProjectDependency> getAllDependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    public boolean hasDependency(String from, String to) {
        return outgoing.getOrDefault(from, Collections.emptyList()).stream()
                .anyMatch(d -> d.getTo().equals(to));
    }

    public int getProjectCount() {
        return projects.size();
    }

    public int getDependencyCount() {
        return dependencies.size();
    }

    /**
     * Returns the projects {@code name} directly depends on, unique, in first-seen order.
     * Unknown names yield an empty list.
     */
    public List<Project> getDependencies(String name) {
        return toProjects(getDependencyNames(name));
    }

    /**
     * Returns the projects that directly depend on {@code name}, unique, in first-seen order.
     * Unknown names yield an empty list.
     */
    public List<Project> getDependents(String name) {
        return toProjects(getDependentNames(name));
    }

    /**
     * Returns the names of the projects {@code name} directly depends on.
     */
    public List<String> getDependencyNames(String name) {
        Set<String> names = new LinkedHashSet<>();
        for (ProjectDependency dep : outgoing.getOrDefault(name, Collections.emptyList())) {
            names.add(dep.getTo());
        }
        return new ArrayList<>(names);
    }

    /**
     * Returns the names of the projects that directly depend on {@code name}.
     */
    public List<String> getDependentNames(String name) {
        Set<String> names = new LinkedHashSet<>();
        for (ProjectDependency dep : incoming.getOrDefault(name, Collections.emptyList())) {
            names.add(dep.getFrom());
        }
        return new ArrayList<>(names);
    }

    /**
     * Returns the edges leaving {@code name}.
     */
    public List<ProjectDependency> getOutgoingEdges(String name) {
        return Collections.unmodifiableList(outgoing.getOrDefault(name, Collections.emptyList()));
    }

    /**
     * Returns the edges entering {@code name}.
     */
    public List<ProjectDependency> getIncomingEdges(String name) {
        return Collections.unmodifiableList(incoming.getOrDefault(name, Collections.emptyList()));
    }

    /**
     * Returns every project reachable from {@code name} along dependency edges,
     * breadth first. The start project is never included.
     */
    public List<Project> getTransitiveDependencies(String name) {
        return toProjects(traverse(name, true));
    }

    /**
     * Returns every project that reaches {@code name} along dependency edges,
     * breadth first. The start project is never included.
     */
    public List<Project> getTransitiveDependents(String name) {
        return toProjects(traverse(name, false));
    }

    /**
     * Returns true if {@code to} is reachable from {@code from}.
     * A project always reaches itself.
     */
    public boolean canReach(String from, String to) {
        if (from.equals(to)) {
            return true;
        }
        return traverse(from, true).contains(to);
    }

    /**
     * Finds the cycles in the graph, one per distinct set of projects.
     */
    public List<List<String>> findCycles() {
        return new CycleDetector(this).findCycles();
    }

    public boolean hasCycles() {
        return !findCycles().isEmpty();
    }

    /**
     * Orders projects so that every project comes after the projects it depends on.
     * Ties keep insertion order.
     *
     * @throws CircularDependencyException if the graph contains a cycle
     */
    public List<String> topologicalOrder() throws CircularDependencyException {
        Map<String, Integer> remaining = new LinkedHashMap<>();
        for (String name : projects.keySet()) {
            remaining.put(name, getDependencyNames(name).size());
        }

        Deque<String> ready = new ArrayDeque<>();
        remaining.forEach((name, count) -> {
            if (count == 0) {
                ready.add(name);
            }
        });

        List<String> sorted = new ArrayList<>();
        while (!ready.isEmpty()) {
            String current = ready.poll();
            sorted.add(current);
            for (String dependent : getDependentNames(current)) {
                int count = remaining.merge(dependent, -1, Integer::sum);
                if (count == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (sorted.size() != projects.size()) {
            List<List<String>> cycles = findCycles();
            throw new CircularDependencyException(cycles.isEmpty() ? List.of() : cycles.get(0));
        }
        return sorted;
    }

    /**
     * Creates an independent copy of this graph.
     */
    public DependencyGraph copy() {
        DependencyGraph copy = new DependencyGraph(directed);
        copy.projects.putAll(projects);
        for (ProjectDependency dep : dependencies) {
            copy.dependencies.add(dep);
            copy.outgoing.computeIfAbsent(dep.getFrom(), k -> new ArrayList<>()).add(dep);
            copy.incoming.computeIfAbsent(dep.getTo(), k -> new ArrayList<>()).add(dep);
        }
        return copy;
    }

    private List<String> traverse(String start, boolean forward) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            List<String> next = forward ? getDependencyNames(current) : getDependentNames(current);
            for (String neighbor : next) {
                if (!neighbor.equals(start) && visited.add(neighbor)) {
                    queue.add(neighbor);
                }
            }
        }
        return new ArrayList<>(visited);
    }

    private List<Project> toProjects(List<String> names) {
        List<Project> result = new ArrayList<>(names.size());
        for (String name : names) {
            Project project = projects.get(name);
            if (project != null) {
                result.add(project);
            }
        }
        return result;
    }

    private Project requireProject(String name) throws UnknownProjectException {
        Project project = projects.get(name);
        if (project == null) {
            throw new UnknownProjectException(name);
        }
        return project;
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
                "directed=" + directed +
                ", projectCount=" + projects.size() +
                ", dependencyCount=" + dependencies.size() +
                '}';
    }

    /**
     * Returns a detailed string representation of the graph.
     */
    public String toDetailedString() {
        StringBuilder sb = new StringBuilder();
        sb.append("DependencyGraph:\n");
        sb.append("  Projects (").append(projects.size()).append("):\n");
        for (Project project : projects.values()) {
            sb.append("    - ").append(project).append("\n");
        }
        sb.append("  Dependencies (").append(dependencies.size()).append("):\n");
        for (ProjectDependency dep : dependencies) {
            sb.append("    - ").append(dep.getEdgeDescription()).append("\n");
        }
        return sb.toString();
    }

    /**
     * Builder for DependencyGraph.
     */
    public static class Builder {
        private final DependencyGraph graph;

        public Builder(boolean directed) {
            this.graph = new DependencyGraph(directed);
        }

        public Builder addProject(Project project) throws DuplicateProjectException {
            graph.addProject(project);
            return this;
        }

        public Builder addDependency(ProjectDependency dependency) throws UnknownProjectException {
            graph.addDependency(dependency);
            return this;
        }

        public DependencyGraph build() {
            return graph;
        }
    }
}
