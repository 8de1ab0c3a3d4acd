package org.example.orchestration.rules;

import org.example.orchestration.config.RuleType;
import org.example.orchestration.model.Severity;

import java.util.List;
import java.util.Objects;

/**
 * A detected non-compliance with a workspace rule.
 */
public class Violation {

    private final String ruleName;
    private final RuleType ruleType;
    private final Severity severity;
    private final String description;
    private final List<String> affectedProjects;

    /**
     * Creates a new Violation.
     *
     * @throws IllegalArgumentException if no affected project is given
     */
    public Violation(String ruleName, RuleType ruleType, Severity severity, String description,
                     List<String> affectedProjects) {
        this.ruleName = Objects.requireNonNull(ruleName, "ruleName cannot be null");
        this.ruleType = Objects.requireNonNull(ruleType, "ruleType cannot be null");
        this.severity = Objects.requireNonNull(severity, "severity cannot be null");
        this.description = description != null ? description : "";
        if (affectedProjects == null || affectedProjects.isEmpty()) {
            throw new IllegalArgumentException("A violation must name at least one affected project");
        }
        this.affectedProjects = List.copyOf(affectedProjects);
    }

    public String getRuleName() {
        return ruleName;
    }

    public RuleType getRuleType() {
        return ruleType;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getAffectedProjects() {
        return affectedProjects;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Violation that = (Violation) o;
        return Objects.equals(ruleName, that.ruleName) &&
               ruleType == that.ruleType &&
               severity == that.severity &&
               Objects.equals(description, that.description) &&
               Objects.equals(affectedProjects, that.affectedProjects);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleName, ruleType, severity, description, affectedProjects);
    }

    @Override
    public String toString() {
        return "[" + severity + "] " + ruleName + ": " + description + " " + affectedProjects;
    }
}
