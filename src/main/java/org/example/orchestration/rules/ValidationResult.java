package org.example.orchestration.rules;

import org.example.orchestration.model.Severity;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of validating a workspace against its rules.
 * The result passes exactly when there are no violations; warnings never affect it.
 */
public class ValidationResult {

    private final List<Violation> violations;
    private final List<String> warnings;

    public ValidationResult(List<Violation> violations, List<String> warnings) {
        this.violations = List.copyOf(violations);
        this.warnings = List.copyOf(warnings);
    }

    public static ValidationResult empty() {
        return new ValidationResult(List.of(), List.of());
    }

    public boolean isPassed() {
        return violations.isEmpty();
    }

    public List<Violation> getViolations() {
        return violations;
    }

    /**
     * Returns notes about data that could not be evaluated.
     */
    public List<String> getWarnings() {
        return warnings;
    }

    public List<Violation> getViolations(Severity severity) {
        return violations.stream()
                .filter(v -> v.getSeverity() == severity)
                .collect(Collectors.toList());
    }

    /**
     * Returns true if any violation is at least as severe as the given level.
     */
    public boolean hasViolationsAtLeast(Severity severity) {
        return violations.stream().anyMatch(v -> v.getSeverity().isAtLeast(severity));
    }

    @Override
    public String toString() {
        return String.format("ValidationResult{passed=%s, violations=%d, warnings=%d}",
                isPassed(), violations.size(), warnings.size());
    }
}
