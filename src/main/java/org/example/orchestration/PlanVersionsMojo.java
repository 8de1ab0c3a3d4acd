package org.example.orchestration;

import org.apache.maven.execution.MavenSession;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.project.MavenProject;
import org.example.orchestration.config.WorkspaceConfig;
import org.example.orchestration.exception.DuplicateProjectException;
import org.example.orchestration.exception.IncompatibleVersionException;
import org.example.orchestration.exception.InvalidConfigurationException;
import org.example.orchestration.exception.InvalidVersionException;
import org.example.orchestration.exception.UnknownProjectException;
import org.example.orchestration.graph.DependencyGraph;
import org.example.orchestration.model.Project;
import org.example.orchestration.model.ProjectDependency;
import org.example.orchestration.model.Workspace;
import org.example.orchestration.resolver.WorkspaceResolver;
import org.example.orchestration.version.VersionCoordinator;
import org.example.orchestration.version.VersionUpdatePlan;
import org.example.orchestration.version.VersionUpdateStep;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Plans version updates across the reactor without changing any POM.
 *
 * Usage: mvn workspace:plan-versions -Dworkspace.updates=core=2.0.0,cli=1.4.0
 */
@Mojo(name = "plan-versions", aggregator = true, requiresProject = true, threadSafe = true)
public class PlanVersionsMojo extends AbstractMojo {

    /**
     * Requested updates.
     * Format: projectName=major.minor.patch
     */
    @Parameter(property = "workspace.updates", required = true)
    private List<String> updates;

    /**
     * Whether to fail the build when the plan is invalid.
     */
    @Parameter(property = "workspace.failOnError", defaultValue = "false")
    private boolean failOnError;

    @Parameter(property = "workspace.skip", defaultValue = "false")
    private boolean skip;

    // ========== Maven Injected Components ==========

    @Parameter(defaultValue = "${project}", readonly = true, required = true)
    private MavenProject project;

    @Parameter(defaultValue = "${session}", readonly = true, required = true)
    private MavenSession session;

    // ========== Execution ==========

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        if (skip) {
            getLog().info("Version planning skipped");
            return;
        }
        logBanner();

        List<Map.Entry<String, String>> requested;
        VersionCoordinator coordinator;
        try {
            requested = parseUpdates(updates);
            Workspace workspace = new WorkspaceResolver(project, session).resolve(WorkspaceConfig.defaults());
            coordinator = createCoordinator(workspace);

        } catch (InvalidConfigurationException e) {
            // Configuration errors always fail the build (ignore failOnError)
            logError("Configuration validation failed", e);
            throw new MojoExecutionException("Version plan configuration is invalid: " + e.getMessage(), e);
        }

        VersionUpdatePlan plan = coordinator.planVersionUpdates(requested);
        logPlan(plan);
        logConstraintConflicts(coordinator, plan);

        if (!plan.isValid()) {
            handleInvalidPlan(plan);
        } else {
            getLog().info("Version plan is valid");
            getLog().info("============================================================");
        }
    }

    /**
     * Parses {@code name=version} pairs, keeping their order.
     *
     * @throws InvalidConfigurationException if an entry is not of the form name=version
     */
    static List<Map.Entry<String, String>> parseUpdates(List<String> entries) throws InvalidConfigurationException {
        List<Map.Entry<String, String>> parsed = new ArrayList<>();
        if (entries == null) {
            return parsed;
        }
        for (String entry : entries) {
            int separator = entry != null ? entry.indexOf('=') : -1;
            if (separator <= 0 || separator == entry.length() - 1) {
                throw new InvalidConfigurationException(
                        "Invalid update: '" + entry + "'. Expected format: name=version");
            }
            parsed.add(new AbstractMap.SimpleImmutableEntry<>(
                    entry.substring(0, separator).trim(),
                    entry.substring(separator + 1).trim()));
        }
        return parsed;
    }

    /**
     * Creates a coordinator knowing every reactor project and the constraints that
     * dependents declare on them.
     */
    static VersionCoordinator createCoordinator(Workspace workspace) throws InvalidConfigurationException {
        DependencyGraph graph;
        try {
            graph = DependencyGraph.of(workspace);
        } catch (DuplicateProjectException | UnknownProjectException e) {
            throw new InvalidConfigurationException("Invalid workspace data: " + e.getMessage(), e);
        }

        VersionCoordinator coordinator = new VersionCoordinator(graph);
        for (Project p : workspace.getProjects()) {
            coordinator.registerProject(p);
        }
        for (ProjectDependency dependency : workspace.getDependencies()) {
            if (dependency.hasVersionConstraint()) {
                coordinator.registerConstraint(dependency.getTo(), dependency.getVersionConstraint());
            }
        }
        return coordinator;
    }

    /**
     * Handles an invalid plan based on failOnError flag.
     */
    private void handleInvalidPlan(VersionUpdatePlan plan) throws MojoFailureException {
        getLog().error("Version plan is invalid:");
        for (String error : plan.getValidationErrors()) {
            getLog().error("  " + error);
        }
        if (failOnError) {
            throw new MojoFailureException("Version plan is invalid: " + String.join("; ", plan.getValidationErrors()));
        }
        getLog().warn("Invalid plan but continuing build (failOnError=false)");
    }

    // ========== Logging ==========

    private void logBanner() {
        getLog().info("============================================================");
        getLog().info("Workspace Orchestration - Version Plan");
        getLog().info("============================================================");
    }

    private void logPlan(VersionUpdatePlan plan) {
        getLog().info("Planned Updates:");
        for (VersionUpdateStep step : plan.getUpdates()) {
            getLog().info("  " + step.getProject() + " -> " + step.getNewVersion() +
                          (step.isBreaking() ? " (breaking)" : ""));
            if (!step.getDependents().isEmpty()) {
                getLog().info("    affects: " + String.join(", ", step.getDependents()));
            }
        }
        getLog().info("  Total affected projects: " + plan.getTotalAffected());
        if (plan.hasBreakingChanges()) {
            getLog().warn("  Plan contains breaking changes");
        }
        getLog().info("============================================================");
    }

    /**
     * Reports steps that would break a constraint declared by a dependent.
     * The plan itself does not evaluate constraints.
     */
    private void logConstraintConflicts(VersionCoordinator coordinator, VersionUpdatePlan plan) {
        for (VersionUpdateStep step : plan.getUpdates()) {
            try {
                coordinator.validateVersionUpdate(step.getProject(), step.getNewVersion());
            } catch (IncompatibleVersionException e) {
                getLog().warn("  " + step.getProject() + " " + step.getNewVersion() +
                              " does not satisfy dependent constraint " + e.getConstraint());
            } catch (InvalidVersionException | InvalidConfigurationException e) {
                getLog().warn("  Could not check constraints of " + step.getProject() + ": " + e.getMessage());
            }
        }
    }

    private void logError(String message, Exception e) {
        getLog().error("============================================================");
        getLog().error("Version Planning Failed: " + message);
        getLog().error("============================================================");
        getLog().error("Error: " + e.getMessage());
        if (getLog().isDebugEnabled()) {
            getLog().debug("Stack trace:", e);
        }
        getLog().error("============================================================");
    }
}
