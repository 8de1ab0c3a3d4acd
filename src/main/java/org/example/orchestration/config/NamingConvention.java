package org.example.orchestration.config;

import java.util.regex.Pattern;

/**
 * Supported project naming conventions.
 */
public enum NamingConvention {

    /** Lowercase letters and digits separated by single hyphens, e.g. {@code my-project-2}. */
    KEBAB_CASE("kebab-case", "^[a-z0-9]+(-[a-z0-9]+)*$"),

    /** Lowercase letters and digits separated by single underscores, e.g. {@code my_project}. */
    SNAKE_CASE("snake_case", "^[a-z0-9]+(_[a-z0-9]+)*$"),

    /** Lower camel case, e.g. {@code myProject}. */
    CAMEL_CASE("camelCase", "^[a-z][a-zA-Z0-9]*$"),

    /** Upper camel case, e.g. {@code MyProject}. */
    PASCAL_CASE("PascalCase", "^[A-Z][a-zA-Z0-9]*$");

    private final String displayName;
    private final Pattern pattern;

    NamingConvention(String displayName, String regex) {
        this.displayName = displayName;
        this.pattern = Pattern.compile(regex);
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Returns true if the name follows this convention.
     */
    public boolean accepts(String name) {
        return name != null && pattern.matcher(name).matches();
    }

    /**
     * Resolves a convention from its display name or constant name, ignoring case
     * and treating '-' and '_' alike.
     *
     * @throws IllegalArgumentException if no convention matches
     */
    public static NamingConvention fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Naming convention cannot be null or empty");
        }
        String normalized = normalize(value);
        for (NamingConvention convention : values()) {
            if (normalize(convention.displayName).equals(normalized) || normalize(convention.name()).equals(normalized)) {
                return convention;
            }
        }
        throw new IllegalArgumentException("Unknown naming convention: '" + value +
                "'. Expected one of: kebab-case, snake_case, camelCase, PascalCase");
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase().replace('-', '_');
    }
}
