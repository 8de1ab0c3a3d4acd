package org.example.orchestration.model;

/**
 * Severity of a rule violation, ordered from least to most severe.
 */
public enum Severity {
    INFO,
    WARNING,
    CRITICAL;

    /**
     * Returns true if this severity is at least as severe as the given one.
     */
    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Parses a severity name, ignoring case.
     *
     * @throws IllegalArgumentException if the name is not a known severity
     */
    public static Severity fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Severity cannot be null or empty");
        }
        try {
            return Severity.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: '" + value + "'. Expected one of: info, warning, critical", e);
        }
    }
}
