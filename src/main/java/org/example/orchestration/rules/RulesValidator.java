package org.example.orchestration.rules;

import org.example.orchestration.config.LayerDefinition;
import org.example.orchestration.config.RuleType;
import org.example.orchestration.config.WorkspaceConfig;
import org.example.orchestration.config.WorkspaceConfigValidator;
import org.example.orchestration.config.WorkspaceRule;
import org.example.orchestration.exception.DuplicateProjectException;
import org.example.orchestration.exception.InvalidConfigurationException;
import org.example.orchestration.exception.InvalidVersionException;
import org.example.orchestration.exception.UnknownProjectException;
import org.example.orchestration.filter.PatternMatcher;
import org.example.orchestration.graph.DependencyGraph;
import org.example.orchestration.model.Project;
import org.example.orchestration.model.ProjectDependency;
import org.example.orchestration.model.Severity;
import org.example.orchestration.model.Workspace;
import org.example.orchestration.version.Version;
import org.example.orchestration.version.VersionConstraint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Validates a workspace against its configured policy rules.
 *
 * <p>Rule Evaluation:</p>
 * <ol>
 *   <li>Dependency constraint - every cycle is a critical violation; edges whose version
 *       constraint is not met by the target's version are reported too</li>
 *   <li>Naming convention - every project name must follow the configured convention</li>
 *   <li>Architectural boundary - no project may depend on a project in a higher layer</li>
 * </ol>
 *
 * <p>Only enabled rules are evaluated. Every enabled rule runs, so one pass collects all
 * violations. A non-compliant workspace is a normal result, not an error.</p>
 */
public class RulesValidator {

    private static final Logger log = LoggerFactory.getLogger(RulesValidator.class);

    private final Workspace workspace;
    private final WorkspaceConfigValidator configValidator;

    public RulesValidator(Workspace workspace) {
        this.workspace = Objects.requireNonNull(workspace, "workspace cannot be null");
        this.configValidator = new WorkspaceConfigValidator();
    }

    /**
     * Evaluates every enabled rule.
     *
     * @return the collected violations
     * @throws InvalidConfigurationException if the configuration is invalid, a project name
     *                                       is repeated, or an edge names an unknown project
     */
    public ValidationResult validateAll() throws InvalidConfigurationException {
        WorkspaceConfig config = workspace.getConfig();
        configValidator.validateOrThrow(config);
        DependencyGraph graph = buildGraph();

        List<Violation> violations = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (WorkspaceRule rule : config.getEnabledRules()) {
            int before = violations.size();
            switch (rule.getRuleType()) {
                case DEPENDENCY_CONSTRAINT -> checkDependencyConstraints(rule, graph, violations, warnings);
                case NAMING_CONVENTION -> checkNamingConvention(rule, workspace.getProjects(), violations);
                case ARCHITECTURAL_BOUNDARY -> checkArchitecturalBoundaries(rule, graph, violations, warnings);
            }
            log.debug("Rule {} produced {} violation(s)", rule.getName(), violations.size() - before);
        }

        ValidationResult result = new ValidationResult(violations, warnings);
        log.info("Validated {} project(s) against {} enabled rule(s): {} violation(s)",
                workspace.getProjectCount(), config.getEnabledRules().size(), violations.size());
        return result;
    }

    /**
     * Validates a single project against the enabled naming rules.
     *
     * @throws InvalidConfigurationException if the configuration is invalid
     */
    public ValidationResult validateProject(Project project) throws InvalidConfigurationException {
        Objects.requireNonNull(project, "project cannot be null");
        configValidator.validateOrThrow(workspace.getConfig());

        List<Violation> violations = new ArrayList<>();
        for (WorkspaceRule rule : workspace.getConfig().getEnabledRules()) {
            if (rule.getRuleType() == RuleType.NAMING_CONVENTION) {
                checkNamingConvention(rule, List.of(project), violations);
            }
        }
        return new ValidationResult(violations, List.of());
    }

    /**
     * Checks whether adding the given edge to the workspace would close a cycle.
     *
     * @throws InvalidConfigurationException if the configuration or workspace data is invalid
     */
    public ValidationResult validateDependency(ProjectDependency dependency) throws InvalidConfigurationException {
        Objects.requireNonNull(dependency, "dependency cannot be null");
        configValidator.validateOrThrow(workspace.getConfig());
        DependencyGraph graph = buildGraph();

        List<Violation> violations = new ArrayList<>();
        for (WorkspaceRule rule : workspace.getConfig().getEnabledRules()) {
            if (rule.getRuleType() == RuleType.DEPENDENCY_CONSTRAINT
                    && graph.canReach(dependency.getTo(), dependency.getFrom())) {
                violations.add(new Violation(
                        rule.getName(),
                        rule.getRuleType(),
                        Severity.CRITICAL,
                        "Dependency would create a cycle: " + dependency.getFrom() + " -> " + dependency.getTo(),
                        distinct(dependency.getFrom(), dependency.getTo())
                ));
            }
        }
        return new ValidationResult(violations, List.of());
    }

    // Rule checks

    private void checkDependencyConstraints(WorkspaceRule rule, DependencyGraph graph,
                                            List<Violation> violations, List<String> warnings) {
        for (List<String> cycle : graph.findCycles()) {
            violations.add(new Violation(
                    rule.getName(),
                    rule.getRuleType(),
                    Severity.CRITICAL,
                    "Circular dependency detected: " + String.join(" -> ", cycle) + " -> " + cycle.get(0),
                    cycle
            ));
        }

        Severity severity = rule.getSeverity().orElse(Severity.WARNING);
        for (ProjectDependency edge : graph.getAllDependencies()) {
            if (!edge.hasVersionConstraint()) {
                continue;
            }
            Project target = graph.getProject(edge.getTo()).orElseThrow();
            try {
                VersionConstraint constraint = VersionConstraint.parse(edge.getVersionConstraint());
                Version version = Version.parse(target.getVersion());
                if (!constraint.admits(version)) {
                    violations.add(new Violation(
                            rule.getName(),
                            rule.getRuleType(),
                            severity,
                            edge.getFrom() + " requires " + edge.getTo() + " " + constraint +
                            " but the workspace has " + target.getVersion(),
                            distinct(edge.getFrom(), edge.getTo())
                    ));
                }
            } catch (InvalidConfigurationException | InvalidVersionException e) {
                warnings.add("Could not evaluate constraint of " + edge.getEdgeDescription() + ": " + e.getMessage());
            }
        }
    }

    private void checkNamingConvention(WorkspaceRule rule, List<Project> projects, List<Violation> violations) {
        WorkspaceConfig config = workspace.getConfig();
        Severity severity = rule.getSeverity().orElse(Severity.WARNING);

        for (Project project : projects) {
            if (!config.getNamingConvention().accepts(project.getName())) {
                violations.add(new Violation(
                        rule.getName(),
                        rule.getRuleType(),
                        severity,
                        "Project name '" + project.getName() + "' does not follow the " +
                        config.getNamingConvention().getDisplayName() + " naming convention",
                        List.of(project.getName())
                ));
            }
        }
    }

    private void checkArchitecturalBoundaries(WorkspaceRule rule, DependencyGraph graph,
                                              List<Violation> violations, List<String> warnings) {
        List<LayerDefinition> layers = workspace.getConfig().getLayers();
        if (layers.isEmpty()) {
            warnings.add("Rule " + rule.getName() + " is enabled but no layers are configured");
            return;
        }

        List<List<PatternMatcher>> matchers = new ArrayList<>();
        for (LayerDefinition layer : layers) {
            matchers.add(layer.toMatchers());
        }

        Map<String, Integer> ranks = new HashMap<>();
        for (Project project : graph.getProjects()) {
            int rank = rankOf(project.getName(), matchers);
            if (rank >= 0) {
                ranks.put(project.getName(), rank);
            }
        }

        Severity severity = rule.getSeverity().orElse(Severity.WARNING);
        Set<String> reported = new HashSet<>();
        for (ProjectDependency edge : graph.getAllDependencies()) {
            Integer fromRank = ranks.get(edge.getFrom());
            Integer toRank = ranks.get(edge.getTo());
            if (fromRank == null || toRank == null || toRank <= fromRank) {
                continue;
            }
            if (!reported.add(edge.getFrom() + "\u0000" + edge.getTo())) {
                continue;
            }
            violations.add(new Violation(
                    rule.getName(),
                    rule.getRuleType(),
                    severity,
                    edge.getFrom() + " (layer " + layers.get(fromRank).getName() + ") depends on " +
                    edge.getTo() + " (layer " + layers.get(toRank).getName() + ")",
                    List.of(edge.getFrom(), edge.getTo())
            ));
        }
    }

    private int rankOf(String projectName, List<List<PatternMatcher>> layers) {
        for (int i = 0; i < layers.size(); i++) {
            for (PatternMatcher matcher : layers.get(i)) {
                if (matcher.matches(projectName)) {
                    return i;
                }
            }
        }
        return -1;
    }

    // Helpers

    private DependencyGraph buildGraph() throws InvalidConfigurationException {
        try {
            return DependencyGraph.of(workspace);
        } catch (DuplicateProjectException | UnknownProjectException e) {
            throw new InvalidConfigurationException("Invalid workspace data: " + e.getMessage(), e);
        }
    }

    private static List<String> distinct(String from, String to) {
        return from.equals(to) ? List.of(from) : List.of(from, to);
    }
}
