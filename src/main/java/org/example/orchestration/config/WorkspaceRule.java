package org.example.orchestration.config;

import org.example.orchestration.model.Severity;

import java.util.Objects;
import java.util.Optional;

/**
 * A configured policy rule.
 * The severity override, when present, replaces the rule kind's default severity.
 */
public class WorkspaceRule {

    private final String name;
    private final RuleType ruleType;
    private final boolean enabled;
    private final Severity severity;

    public WorkspaceRule(String name, RuleType ruleType, boolean enabled) {
        this(name, ruleType, enabled, null);
    }

    public WorkspaceRule(String name, RuleType ruleType, boolean enabled, Severity severity) {
        this.name = name;
        this.ruleType = ruleType;
        this.enabled = enabled;
        this.severity = severity;
    }

    public String getName() {
        return name;
    }

    public RuleType getRuleType() {
        return ruleType;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Optional<Severity> getSeverity() {
        return Optional.ofNullable(severity);
    }

    public WorkspaceRule withEnabled(boolean newEnabled) {
        return new WorkspaceRule(name, ruleType, newEnabled, severity);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkspaceRule that = (WorkspaceRule) o;
        return enabled == that.enabled &&
               Objects.equals(name, that.name) &&
               ruleType == that.ruleType &&
               severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, ruleType, enabled, severity);
    }

    @Override
    public String toString() {
        return name + "[" + ruleType + (enabled ? "" : ", disabled") +
               (severity != null ? ", " + severity : "") + "]";
    }
}
