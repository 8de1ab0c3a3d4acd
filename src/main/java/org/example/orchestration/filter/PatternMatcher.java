package org.example.orchestration.filter;

import java.util.regex.Pattern;

/**
 * Matches project names against glob-style patterns.
 *
 * <p>Wildcards:</p>
 * <ul>
 *   <li>{@code *} - matches zero or more characters</li>
 *   <li>{@code ?} - matches exactly one character</li>
 * </ul>
 *
 * <p>Examples:</p>
 * <ul>
 *   <li>{@code *-core} - core, storage-core, api-core</li>
 *   <li>{@code web-*} - every project with the web prefix</li>
 *   <li>{@code svc-?} - svc-a, svc-b, etc.</li>
 * </ul>
 */
public class PatternMatcher {

    /**
     * Characters allowed in a pattern: letters, numbers, dots, hyphens, underscores and wildcards.
     */
    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-zA-Z0-9.*?_-]+$");

    private final String originalPattern;
    private final Pattern namePattern;

    /**
     * Creates a new PatternMatcher for the given pattern.
     *
     * @param pattern the glob pattern
     * @throws IllegalArgumentException if pattern is invalid
     */
    public PatternMatcher(String pattern) {
        if (pattern == null || pattern.trim().isEmpty()) {
            throw new IllegalArgumentException("Pattern cannot be null or empty");
        }

        this.originalPattern = pattern.trim();

        if (!isValidPattern(originalPattern)) {
            throw new IllegalArgumentException(
                    "Invalid pattern: '" + pattern + "'. Only letters, digits, '.', '_', '-', '*' and '?' are allowed");
        }

        this.namePattern = globToRegex(originalPattern);
    }

    /**
     * Returns true if the given string is an acceptable glob pattern.
     */
    public static boolean isValidPattern(String pattern) {
        return pattern != null && VALID_PATTERN.matcher(pattern.trim()).matches();
    }

    /**
     * Tests if the given project name matches this pattern.
     *
     * @param projectName the name to match
     * @return true if the whole name matches
     */
    public boolean matches(String projectName) {
        if (projectName == null) {
            return false;
        }
        return namePattern.matcher(projectName).matches();
    }

    /**
     * Returns the original pattern string.
     */
    public String getPattern() {
        return originalPattern;
    }

    /**
     * Converts a glob pattern to a regex Pattern.
     *
     * <p>{@code *} becomes {@code .*}, {@code ?} becomes {@code .}, and dots are escaped.</p>
     */
    private Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        regex.append("^");

        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append(".");
                case '.' -> regex.append("\\.");
                default -> regex.append(c);
            }
        }

        regex.append("$");
        return Pattern.compile(regex.toString());
    }

    @Override
    public String toString() {
        return "PatternMatcher{" + originalPattern + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PatternMatcher that = (PatternMatcher) o;
        return originalPattern.equals(that.originalPattern);
    }

    @Override
    public int hashCode() {
        return originalPattern.hashCode();
    }
}
