package org.example.orchestration.version;

/**
 * Operators accepted in version constraints.
 * Prefixes are tried in declaration order, so longer prefixes come first.
 */
public enum ConstraintOperator {

    /** {@code >=X.Y.Z}: any version at or above the declared one. */
    GREATER_OR_EQUAL(">=") {
        @Override
        boolean admits(Version declared, Version candidate) {
            return candidate.isAtLeast(declared);
        }
    },

    /** {@code ^X.Y.Z}: same major, at or above the declared version. */
    CARET("^") {
        @Override
        boolean admits(Version declared, Version candidate) {
            return candidate.getMajor() == declared.getMajor() && candidate.isAtLeast(declared);
        }
    },

    /** {@code ~X.Y.Z}: same major and minor, at or above the declared version. */
    TILDE("~") {
        @Override
        boolean admits(Version declared, Version candidate) {
            return candidate.getMajor() == declared.getMajor()
                    && candidate.getMinor() == declared.getMinor()
                    && candidate.isAtLeast(declared);
        }
    };

    private final String symbol;

    ConstraintOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    abstract boolean admits(Version declared, Version candidate);
}
