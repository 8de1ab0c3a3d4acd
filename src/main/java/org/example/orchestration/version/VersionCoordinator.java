package org.example.orchestration.version;

import org.example.orchestration.exception.IncompatibleVersionException;
import org.example.orchestration.exception.InvalidConfigurationException;
import org.example.orchestration.exception.InvalidVersionException;
import org.example.orchestration.exception.OrchestrationException;
import org.example.orchestration.exception.UnknownProjectException;
import org.example.orchestration.graph.DependencyGraph;
import org.example.orchestration.model.Project;
import org.example.orchestration.model.ProjectDependency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Coordinates version updates across workspace projects.
 *
 * <p>The coordinator works on a snapshot of the dependency graph taken at construction,
 * and keeps its own record of project versions and constraints. Later changes to the
 * caller's graph are not observed, and the coordinator never changes the graph.</p>
 *
 * <p>Not thread-safe: one writer at a time.</p>
 */
public class VersionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(VersionCoordinator.class);

    private final DependencyGraph graph;
    private final Map<String, Project> projects;
    private final Map<String, List<String>> constraints;

    public VersionCoordinator(DependencyGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph cannot be null").copy();
        this.projects = new LinkedHashMap<>();
        this.constraints = new HashMap<>();
    }

    // Registration

    /**
     * Records a project and its current version, replacing any earlier registration.
     */
    public void registerProject(Project project) {
        Objects.requireNonNull(project, "project cannot be null");
        projects.put(project.getName(), project);
        log.debug("Registered {} at version {}", project.getName(), project.getVersion());
    }

    /**
     * Appends a version constraint for the project. The project need not be registered.
     * The constraint is parsed when an update is validated.
     */
    public void registerConstraint(String projectName, String constraint) {
        Objects.requireNonNull(projectName, "projectName cannot be null");
        Objects.requireNonNull(constraint, "constraint cannot be null");
        constraints.computeIfAbsent(projectName, k -> new ArrayList<>()).add(constraint);
    }

    // Queries

    public List<String> getConstraints(String projectName) {
        return List.copyOf(constraints.getOrDefault(projectName, Collections.emptyList()));
    }

    public Optional<String> getVersion(String projectName) {
        return Optional.ofNullable(projects.get(projectName)).map(Project::getVersion);
    }

    public List<Project> getAllProjects() {
        return new ArrayList<>(projects.values());
    }

    /**
     * Returns the projects that transitively depend on the given project, with the versions
     * this coordinator has recorded for them. Projects that were never registered are
     * returned as the graph holds them. Null, unknown and leaf projects yield an empty list.
     */
    public List<Project> getAffectedProjects(String projectName) {
        if (projectName == null || !graph.hasProject(projectName)) {
            return List.of();
        }
        return graph.getTransitiveDependents(projectName).stream()
                .map(dependent -> projects.getOrDefault(dependent.getName(), dependent))
                .collect(Collectors.toList());
    }

    // Validation

    /**
     * Checks a candidate version against every constraint registered for the project.
     * With no constraints, any parseable version is accepted.
     *
     * @throws InvalidVersionException       if the candidate does not parse
     * @throws IncompatibleVersionException  if a constraint rejects the candidate
     * @throws InvalidConfigurationException if a registered constraint is malformed
     */
    public void validateVersionUpdate(String projectName, String newVersion)
            throws InvalidVersionException, IncompatibleVersionException, InvalidConfigurationException {
        Version candidate = Version.parse(newVersion);

        for (String text : constraints.getOrDefault(projectName, Collections.emptyList())) {
            VersionConstraint constraint = VersionConstraint.parse(text);
            if (!constraint.admits(candidate)) {
                throw new IncompatibleVersionException(projectName, newVersion, text);
            }
        }
    }

    /**
     * Returns true if moving the project to the candidate version changes the major version.
     *
     * @throws UnknownProjectException if the project is not registered
     * @throws InvalidVersionException if the candidate or the current version does not parse
     */
    public boolean isBreakingChange(String projectName, String candidateVersion)
            throws UnknownProjectException, InvalidVersionException {
        Project project = requireProject(projectName);
        Version candidate = Version.parse(candidateVersion);
        Version current = Version.parse(project.getVersion());
        return candidate.isBreakingChangeFrom(current);
    }

    // Updates

    /**
     * Validates and applies a version update.
     *
     * @return a successful update record
     * @throws InvalidVersionException       if the new version does not parse
     * @throws UnknownProjectException       if the project is not registered
     * @throws IncompatibleVersionException  if a registered constraint rejects it
     * @throws InvalidConfigurationException if a registered constraint is malformed
     */
    public VersionUpdateResult updateVersion(String projectName, String newVersion)
            throws InvalidVersionException, IncompatibleVersionException,
                   InvalidConfigurationException, UnknownProjectException {
        Version.parse(newVersion);
        Project project = requireProject(projectName);
        validateVersionUpdate(projectName, newVersion);
        return apply(project, newVersion);
    }

    /**
     * Builds an update plan without applying it.
     * Unknown projects and unparseable versions make the plan invalid instead of failing the call.
     */
    public VersionUpdatePlan planVersionUpdates(List<Map.Entry<String, String>> updates) {
        List<VersionUpdateStep> steps = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        Set<String> affected = new LinkedHashSet<>();

        for (Map.Entry<String, String> update : updates) {
            String projectName = update.getKey();
            String newVersion = update.getValue();

            Version candidate;
            try {
                candidate = Version.parse(newVersion);
            } catch (InvalidVersionException e) {
                errors.add("Invalid version for " + projectName + ": " + e.getMessage());
                continue;
            }

            Project project = projects.get(projectName);
            if (project == null) {
                errors.add("Project not found: " + projectName);
                continue;
            }

            List<String> dependents = names(getAffectedProjects(projectName));
            affected.addAll(dependents);
            steps.add(new VersionUpdateStep(projectName, newVersion, dependents, isBreaking(project, candidate)));
        }

        VersionUpdatePlan plan = new VersionUpdatePlan(steps, errors, affected.size());
        log.info("Planned {} version update(s), valid={}, affected={}", steps.size(), plan.isValid(), affected.size());
        return plan;
    }

    /**
     * Convenience overload taking {@code name -> version} pairs in iteration order.
     */
    public VersionUpdatePlan planVersionUpdates(Map<String, String> updates) {
        return planVersionUpdates(new ArrayList<>(updates.entrySet()));
    }

    /**
     * Applies every step of a plan, or none of them.
     *
     * <p>All steps are validated before any is applied. After applying, each result records
     * an error when a dependent's declared constraint on the updated project is no longer
     * satisfied; those updates stay applied.</p>
     *
     * @throws InvalidConfigurationException if the plan is invalid or a constraint is malformed
     * @throws OrchestrationException        the first validation failure among the steps
     */
    public List<VersionUpdateResult> applyPlan(VersionUpdatePlan plan) throws OrchestrationException {
        Objects.requireNonNull(plan, "plan cannot be null");
        if (!plan.isValid()) {
            throw new InvalidConfigurationException(
                    "Cannot apply an invalid version plan:\n- " + String.join("\n- ", plan.getValidationErrors()),
                    plan.getValidationErrors());
        }

        for (VersionUpdateStep step : plan.getUpdates()) {
            validateVersionUpdate(step.getProject(), step.getNewVersion());
            requireProject(step.getProject());
        }

        List<VersionUpdateResult> results = new ArrayList<>();
        for (VersionUpdateStep step : plan.getUpdates()) {
            results.add(apply(projects.get(step.getProject()), step.getNewVersion()));
        }

        List<VersionUpdateResult> checked = new ArrayList<>(results.size());
        for (VersionUpdateResult result : results) {
            String broken = findBrokenDependentConstraints(result.getProject(), result.getNewVersion());
            checked.add(broken == null ? result : result.withError(broken));
        }
        return checked;
    }

    /**
     * Forgets all registered projects, versions and constraints. The graph is kept.
     */
    public void clear() {
        projects.clear();
        constraints.clear();
    }

    private VersionUpdateResult apply(Project project, String newVersion) throws InvalidVersionException {
        String oldVersion = project.getVersion();
        boolean breaking = isBreaking(project, Version.parse(newVersion));

        projects.put(project.getName(), project.withVersion(newVersion));
        log.info("Updated {} from {} to {}{}", project.getName(), oldVersion, newVersion, breaking ? " (breaking)" : "");

        return VersionUpdateResult.builder()
                .project(project.getName())
                .oldVersion(oldVersion)
                .newVersion(newVersion)
                .affectedProjects(names(getAffectedProjects(project.getName())))
                .breaking(breaking)
                .build();
    }

    /**
     * Checks the constraints dependents declare on their edges to the project.
     *
     * @return a description of the unsatisfied constraints, or null if all hold
     */
    private String findBrokenDependentConstraints(String projectName, String newVersion) throws InvalidVersionException {
        Version version = Version.parse(newVersion);
        List<String> broken = new ArrayList<>();

        for (ProjectDependency edge : graph.getIncomingEdges(projectName)) {
            if (!edge.hasVersionConstraint()) {
                continue;
            }
            try {
                if (!VersionConstraint.parse(edge.getVersionConstraint()).admits(version)) {
                    broken.add(edge.getFrom() + " requires " + edge.getVersionConstraint());
                }
            } catch (InvalidConfigurationException e) {
                log.warn("Skipping unreadable constraint on {}: {}", edge.getEdgeDescription(), e.getMessage());
            }
        }

        if (broken.isEmpty()) {
            return null;
        }
        return "Version " + newVersion + " of " + projectName + " no longer satisfies: " + String.join(", ", broken);
    }

    private boolean isBreaking(Project project, Version candidate) {
        try {
            return candidate.isBreakingChangeFrom(Version.parse(project.getVersion()));
        } catch (InvalidVersionException e) {
            log.warn("Current version of {} is not a semantic version, treating update as breaking: {}",
                    project.getName(), e.getMessage());
            return true;
        }
    }

    private Project requireProject(String projectName) throws UnknownProjectException {
        Project project = projects.get(projectName);
        if (project == null) {
            throw new UnknownProjectException(projectName);
        }
        return project;
    }

    private static List<String> names(List<Project> projects) {
        return projects.stream()
                .map(Project::getName)
                .collect(Collectors.toList());
    }
}
