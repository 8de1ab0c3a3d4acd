package org.example.orchestration.version;

import org.example.orchestration.exception.InvalidConfigurationException;
import org.example.orchestration.exception.InvalidVersionException;

import java.util.Objects;

/**
 * A parsed version constraint in caret ({@code ^1.2.0}), tilde ({@code ~1.2.0})
 * or comparison ({@code >=1.2.0}) form.
 */
public final class VersionConstraint {

    private final String text;
    private final ConstraintOperator operator;
    private final Version declared;

    private VersionConstraint(String text, ConstraintOperator operator, Version declared) {
        this.text = text;
        this.operator = operator;
        this.declared = declared;
    }

    /**
     * Parses a constraint string.
     *
     * @throws InvalidConfigurationException if the operator is not recognized
     *                                       or the declared version is malformed
     */
    public static VersionConstraint parse(String text) throws InvalidConfigurationException {
        if (text == null || text.trim().isEmpty()) {
            throw new InvalidConfigurationException("Version constraint cannot be null or empty");
        }

        String trimmed = text.trim();
        for (ConstraintOperator operator : ConstraintOperator.values()) {
            if (trimmed.startsWith(operator.getSymbol())) {
                String versionPart = trimmed.substring(operator.getSymbol().length());
                try {
                    return new VersionConstraint(trimmed, operator, Version.parse(versionPart));
                } catch (InvalidVersionException e) {
                    throw new InvalidConfigurationException(
                            "Invalid version in constraint '" + text + "': " + e.getMessage(), e);
                }
            }
        }

        throw new InvalidConfigurationException(
                "Unsupported version constraint: '" + text + "'. Expected ^X.Y.Z, ~X.Y.Z or >=X.Y.Z");
    }

    /**
     * Tests if the candidate version satisfies this constraint.
     */
    public boolean admits(Version candidate) {
        return operator.admits(declared, candidate);
    }

    public String getText() {
        return text;
    }

    public ConstraintOperator getOperator() {
        return operator;
    }

    public Version getDeclared() {
        return declared;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VersionConstraint that = (VersionConstraint) o;
        return operator == that.operator && Objects.equals(declared, that.declared);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, declared);
    }

    @Override
    public String toString() {
        return text;
    }
}
