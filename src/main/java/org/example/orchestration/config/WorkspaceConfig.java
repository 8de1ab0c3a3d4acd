package org.example.orchestration.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Workspace policy configuration.
 * Contains the rule list, the naming convention and the architectural layers.
 */
public class WorkspaceConfig {

    public static final String NO_CIRCULAR_DEPS = "no-circular-deps";
    public static final String NAMING_CONVENTION = "naming-convention";
    public static final String ARCHITECTURAL_BOUNDARY = "architectural-boundary";

    /**
     * Configured rules, evaluated in order.
     */
    private List<WorkspaceRule> rules = new ArrayList<>();

    /**
     * Convention project names must follow.
     * Default: kebab-case
     */
    private NamingConvention namingConvention = NamingConvention.KEBAB_CASE;

    /**
     * Architectural layers, lowest first.
     * A project may depend on its own layer and the layers listed before it.
     */
    private List<LayerDefinition> layers = new ArrayList<>();

    public WorkspaceConfig() {
    }

    /**
     * Returns the default configuration: cycle and naming checks enabled,
     * architectural boundary check disabled.
     */
    public static WorkspaceConfig defaults() {
        return builder()
                .addRule(new WorkspaceRule(NO_CIRCULAR_DEPS, RuleType.DEPENDENCY_CONSTRAINT, true))
                .addRule(new WorkspaceRule(NAMING_CONVENTION, RuleType.NAMING_CONVENTION, true))
                .addRule(new WorkspaceRule(ARCHITECTURAL_BOUNDARY, RuleType.ARCHITECTURAL_BOUNDARY, false))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // Getters and Setters

    public List<WorkspaceRule> getRules() {
        return rules;
    }

    public void setRules(List<WorkspaceRule> rules) {
        this.rules = rules != null ? rules : new ArrayList<>();
    }

    public NamingConvention getNamingConvention() {
        return namingConvention;
    }

    public void setNamingConvention(NamingConvention namingConvention) {
        this.namingConvention = namingConvention != null ? namingConvention : NamingConvention.KEBAB_CASE;
    }

    public List<LayerDefinition> getLayers() {
        return layers;
    }

    public void setLayers(List<LayerDefinition> layers) {
        this.layers = layers != null ? layers : new ArrayList<>();
    }

    /**
     * Finds a rule by name.
     */
    public Optional<WorkspaceRule> getRule(String name) {
        return rules.stream()
                .filter(r -> Objects.equals(r.getName(), name))
                .findFirst();
    }

    /**
     * Enables or disables the named rule.
     *
     * @return false if no rule has that name
     */
    public boolean setRuleEnabled(String name, boolean enabled) {
        for (int i = 0; i < rules.size(); i++) {
            WorkspaceRule rule = rules.get(i);
            if (Objects.equals(rule.getName(), name)) {
                rules.set(i, rule.withEnabled(enabled));
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the enabled rules, in configuration order.
     */
    public List<WorkspaceRule> getEnabledRules() {
        List<WorkspaceRule> enabled = new ArrayList<>();
        for (WorkspaceRule rule : rules) {
            if (rule.isEnabled()) {
                enabled.add(rule);
            }
        }
        return enabled;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkspaceConfig that = (WorkspaceConfig) o;
        return Objects.equals(rules, that.rules) &&
               namingConvention == that.namingConvention &&
               Objects.equals(layers, that.layers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rules, namingConvention, layers);
    }

    @Override
    public String toString() {
        return "WorkspaceConfig{" +
                "rules=" + rules +
                ", namingConvention=" + namingConvention.getDisplayName() +
                ", layers=" + layers +
                '}';
    }

    /**
     * Builder for WorkspaceConfig.
     */
    public static class Builder {
        private final WorkspaceConfig config = new WorkspaceConfig();

        public Builder rules(List<WorkspaceRule> rules) {
            config.setRules(rules != null ? new ArrayList<>(rules) : null);
            return this;
        }

        public Builder addRule(WorkspaceRule rule) {
            config.getRules().add(rule);
            return this;
        }

        public Builder namingConvention(NamingConvention namingConvention) {
            config.setNamingConvention(namingConvention);
            return this;
        }

        public Builder layers(List<LayerDefinition> layers) {
            config.setLayers(layers != null ? new ArrayList<>(layers) : null);
            return this;
        }

        public Builder addLayer(LayerDefinition layer) {
            config.getLayers().add(layer);
            return this;
        }

        public WorkspaceConfig build() {
            return config;
        }
    }
}
