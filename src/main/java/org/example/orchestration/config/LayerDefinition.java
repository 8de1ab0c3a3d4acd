package org.example.orchestration.config;

import org.example.orchestration.filter.PatternMatcher;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * An architectural layer: a named group of projects selected by glob patterns.
 *
 * <p>Text format: {@code name:pattern[|pattern...]}, e.g. {@code core:*-core|shared}.
 * Commas separate list entries in Maven properties, so patterns use {@code |}.</p>
 */
public class LayerDefinition {

    private static final String PATTERN_SEPARATOR = "|";

    private final String name;
    private final List<String> patterns;

    public LayerDefinition(String name, List<String> patterns) {
        this.name = name;
        this.patterns = patterns != null ? List.copyOf(patterns) : List.of();
    }

    /**
     * Parses a layer from its text form.
     *
     * @throws IllegalArgumentException if the text has no name or no patterns
     */
    public static LayerDefinition parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("Layer definition cannot be null or empty");
        }
        int colonIndex = text.indexOf(':');
        if (colonIndex == -1) {
            throw new IllegalArgumentException(
                    "Invalid layer definition: '" + text + "'. Expected format: name:pattern[|pattern...]");
        }
        String name = text.substring(0, colonIndex).trim();
        List<String> patterns = Arrays.stream(text.substring(colonIndex + 1).split(Pattern.quote(PATTERN_SEPARATOR)))
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .collect(Collectors.toList());
        if (name.isEmpty() || patterns.isEmpty()) {
            throw new IllegalArgumentException(
                    "Invalid layer definition: '" + text + "'. Both name and at least one pattern are required");
        }
        return new LayerDefinition(name, patterns);
    }

    public String getName() {
        return name;
    }

    public List<String> getPatterns() {
        return patterns;
    }

    /**
     * Compiles the patterns of this layer.
     *
     * @throws IllegalArgumentException if a pattern is invalid
     */
    public List<PatternMatcher> toMatchers() {
        return patterns.stream()
                .map(PatternMatcher::new)
                .collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LayerDefinition that = (LayerDefinition) o;
        return Objects.equals(name, that.name) && Objects.equals(patterns, that.patterns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, patterns);
    }

    @Override
    public String toString() {
        return name + ":" + String.join(PATTERN_SEPARATOR, patterns);
    }
}
