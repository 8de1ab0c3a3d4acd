package org.example.orchestration.config;

import org.example.orchestration.exception.InvalidConfigurationException;
import org.example.orchestration.filter.PatternMatcher;
import org.example.orchestration.model.Severity;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates workspace policy configuration.
 * Throws InvalidConfigurationException if validation fails.
 */
public class WorkspaceConfigValidator {

    /**
     * Validates the workspace configuration.
     *
     * @param config the configuration to validate
     * @return list of validation errors (empty if valid)
     */
    public List<String> validate(WorkspaceConfig config) {
        List<String> errors = new ArrayList<>();

        if (config == null) {
            errors.add("configuration is required");
            return errors;
        }

        validateRules(config.getRules(), errors);
        validateLayers(config.getLayers(), errors);

        return errors;
    }

    /**
     * Validates configuration and throws exception if invalid.
     *
     * @param config the configuration to validate
     * @throws InvalidConfigurationException if validation fails
     */
    public void validateOrThrow(WorkspaceConfig config) throws InvalidConfigurationException {
        List<String> errors = validate(config);
        if (!errors.isEmpty()) {
            throw new InvalidConfigurationException(
                    "Invalid workspace configuration:\n- " + String.join("\n- ", errors),
                    errors
            );
        }
    }

    private void validateRules(List<WorkspaceRule> rules, List<String> errors) {
        Set<String> seen = new HashSet<>();

        for (WorkspaceRule rule : rules) {
            if (rule == null) {
                errors.add("rules contains a null rule");
                continue;
            }

            if (isBlank(rule.getName())) {
                errors.add("rule name is required");
            } else if (!seen.add(rule.getName())) {
                errors.add("duplicate rule name: " + rule.getName());
            }

            if (rule.getRuleType() == null) {
                errors.add("rule type is required for rule: " + rule.getName());
            }

            // Naming violations are reported at warning level or above
            if (rule.getRuleType() == RuleType.NAMING_CONVENTION &&
                rule.getSeverity().map(s -> s == Severity.INFO).orElse(false)) {
                errors.add("naming convention rule " + rule.getName() +
                           " must use severity warning or critical, but was: info");
            }
        }
    }

    private void validateLayers(List<LayerDefinition> layers, List<String> errors) {
        Set<String> seen = new HashSet<>();

        for (LayerDefinition layer : layers) {
            if (layer == null) {
                errors.add("layers contains a null layer");
                continue;
            }

            if (isBlank(layer.getName())) {
                errors.add("layer name is required");
            } else if (!seen.add(layer.getName())) {
                errors.add("duplicate layer name: " + layer.getName());
            }

            if (layer.getPatterns().isEmpty()) {
                errors.add("layer " + layer.getName() + " must declare at least one pattern");
            }

            for (String pattern : layer.getPatterns()) {
                if (isBlank(pattern)) {
                    errors.add("layer " + layer.getName() + " contains empty pattern");
                } else if (!PatternMatcher.isValidPattern(pattern)) {
                    errors.add("layer " + layer.getName() + " contains invalid pattern: " + pattern +
                               ". Only letters, digits, '.', '_', '-', '*' and '?' are allowed");
                }
            }
        }
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
