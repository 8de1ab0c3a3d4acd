package org.example.orchestration;

import org.apache.maven.execution.MavenSession;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.project.MavenProject;
import org.example.orchestration.config.LayerDefinition;
import org.example.orchestration.config.NamingConvention;
import org.example.orchestration.config.WorkspaceConfig;
import org.example.orchestration.exception.InvalidConfigurationException;
import org.example.orchestration.model.Severity;
import org.example.orchestration.model.Workspace;
import org.example.orchestration.resolver.WorkspaceResolver;
import org.example.orchestration.rules.RulesValidator;
import org.example.orchestration.rules.ValidationResult;
import org.example.orchestration.rules.Violation;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates the reactor against the workspace policy rules.
 *
 * Usage: mvn workspace:validate
 */
@Mojo(name = "validate", aggregator = true, requiresProject = true, threadSafe = true)
public class ValidateWorkspaceMojo extends AbstractMojo {

    // ========== Rule Configuration ==========

    /**
     * Convention project names must follow: kebab-case, snake_case, camelCase or PascalCase.
     */
    @Parameter(property = "workspace.namingConvention", defaultValue = "kebab-case")
    private String namingConvention;

    /**
     * Architectural layers, lowest first.
     * Format: name:pattern[|pattern...], one layer per list entry.
     * On the command line: -Dworkspace.layers="core:*-core|shared,web:web-*"
     * Configuring layers enables the architectural-boundary rule unless it is disabled explicitly.
     */
    @Parameter(property = "workspace.layers")
    private List<String> layers;

    /**
     * Rule names to enable in addition to the defaults.
     */
    @Parameter(property = "workspace.enabledRules")
    private List<String> enabledRules;

    /**
     * Rule names to disable. Wins over enabledRules.
     */
    @Parameter(property = "workspace.disabledRules")
    private List<String> disabledRules;

    // ========== Outcome ==========

    /**
     * Whether to fail the build when violations at or above failSeverity are found.
     */
    @Parameter(property = "workspace.failOnViolation", defaultValue = "false")
    private boolean failOnViolation;

    /**
     * Lowest severity that fails the build: info, warning or critical.
     */
    @Parameter(property = "workspace.failSeverity", defaultValue = "critical")
    private String failSeverity;

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
            getLog().info("Workspace validation skipped");
            return;
        }
        logBanner();

        ValidationResult result;
        Severity threshold;
        try {
            WorkspaceConfig config = buildConfiguration();
            threshold = Severity.fromString(failSeverity);
            logConfigurationSummary(config, threshold);

            Workspace workspace = new WorkspaceResolver(project, session).resolve(config);
            getLog().info("Validating " + workspace.getProjectCount() + " project(s) and " +
                          workspace.getDependencyCount() + " dependency edge(s)...");
            result = new RulesValidator(workspace).validateAll();

        } catch (InvalidConfigurationException | IllegalArgumentException e) {
            // Configuration errors always fail the build (ignore failOnViolation)
            logError("Configuration validation failed", e);
            throw new MojoExecutionException("Workspace configuration is invalid: " + e.getMessage(), e);
        }

        logResult(result);

        if (result.hasViolationsAtLeast(threshold)) {
            handleViolations(result, threshold);
        } else {
            logSuccess(result, threshold);
        }
    }

    /**
     * Builds the workspace configuration from Mojo parameters, starting from the defaults.
     */
    WorkspaceConfig buildConfiguration() throws InvalidConfigurationException {
        WorkspaceConfig config = WorkspaceConfig.defaults();
        config.setNamingConvention(NamingConvention.fromString(namingConvention));

        List<LayerDefinition> layerDefinitions = new ArrayList<>();
        if (layers != null) {
            for (String layer : layers) {
                layerDefinitions.add(LayerDefinition.parse(layer));
            }
        }
        config.setLayers(layerDefinitions);
        if (!layerDefinitions.isEmpty()) {
            config.setRuleEnabled(WorkspaceConfig.ARCHITECTURAL_BOUNDARY, true);
        }

        toggleRules(config, enabledRules, true);
        toggleRules(config, disabledRules, false);
        return config;
    }

    private void toggleRules(WorkspaceConfig config, List<String> ruleNames, boolean enabled)
            throws InvalidConfigurationException {
        if (ruleNames == null) {
            return;
        }
        for (String ruleName : ruleNames) {
            if (!config.setRuleEnabled(ruleName.trim(), enabled)) {
                throw new InvalidConfigurationException("Unknown rule: '" + ruleName +
                        "'. Expected one of: " + WorkspaceConfig.NO_CIRCULAR_DEPS + ", " +
                        WorkspaceConfig.NAMING_CONVENTION + ", " + WorkspaceConfig.ARCHITECTURAL_BOUNDARY);
            }
        }
    }

    /**
     * Handles violations based on failOnViolation flag.
     */
    private void handleViolations(ValidationResult result, Severity threshold) throws MojoFailureException {
        int count = result.getViolations().size();
        if (failOnViolation) {
            getLog().error("Workspace validation failed: " + count + " violation(s), at least one " + threshold);
            throw new MojoFailureException("Workspace validation failed with " + count + " violation(s)");
        }
        getLog().warn("Violations found but continuing build (failOnViolation=false)");
    }

    // ========== Logging ==========

    private void logBanner() {
        getLog().info("============================================================");
        getLog().info("Workspace Orchestration - Rules Validation");
        getLog().info("============================================================");
    }

    private void logConfigurationSummary(WorkspaceConfig config, Severity threshold) {
        getLog().info("Configuration:");
        getLog().info("  Enabled rules: " + config.getEnabledRules());
        getLog().info("  Naming convention: " + config.getNamingConvention().getDisplayName());
        if (!config.getLayers().isEmpty()) {
            getLog().info("  Layers: " + config.getLayers());
        }
        getLog().info("  Fail on violation: " + failOnViolation + " (severity >= " + threshold + ")");
        getLog().info("============================================================");
    }

    private void logResult(ValidationResult result) {
        getLog().info("============================================================");
        getLog().info("Validation Results:");
        getLog().info("  Critical: " + result.getViolations(Severity.CRITICAL).size());
        getLog().info("  Warning: " + result.getViolations(Severity.WARNING).size());
        getLog().info("  Info: " + result.getViolations(Severity.INFO).size());
        for (Violation violation : result.getViolations()) {
            String line = "  [" + violation.getRuleName() + "] " + violation.getDescription();
            switch (violation.getSeverity()) {
                case CRITICAL -> getLog().error(line);
                case WARNING -> getLog().warn(line);
                case INFO -> getLog().info(line);
            }
        }
        for (String warning : result.getWarnings()) {
            getLog().warn("  " + warning);
        }
        getLog().info("============================================================");
    }

    private void logSuccess(ValidationResult result, Severity threshold) {
        if (result.isPassed()) {
            getLog().info("Workspace validation passed");
        } else {
            getLog().info("Workspace validation passed: no violations at or above " + threshold);
        }
        getLog().info("============================================================");
    }

    private void logError(String message, Exception e) {
        getLog().error("============================================================");
        getLog().error("Workspace Validation Failed: " + message);
        getLog().error("============================================================");
        getLog().error("Error: " + e.getMessage());
        if (getLog().isDebugEnabled()) {
            getLog().debug("Stack trace:", e);
        }
        getLog().error("============================================================");
    }
}
