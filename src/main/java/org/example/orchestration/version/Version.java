package org.example.orchestration.version;

import org.example.orchestration.exception.InvalidVersionException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A semantic version {@code major.minor.patch}.
 * Versions compare lexicographically on (major, minor, patch).
 */
public final class Version implements Comparable<Version> {

    /**
     * Three dot-separated non-negative integers without leading zeros,
     * so that formatting a parsed version reproduces the input.
     */
    private static final Pattern VERSION_PATTERN = Pattern.compile(
            "^(0|[1-9][0-9]*)\\.(0|[1-9][0-9]*)\\.(0|[1-9][0-9]*)$"
    );

    private final int major;
    private final int minor;
    private final int patch;

    public Version(int major, int minor, int patch) {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException(
                    "Version components must be non-negative, but was: " + major + "." + minor + "." + patch);
        }
        this.major = major;
        this.minor = minor;
        this.patch = patch;
    }

    /**
     * Parses a {@code major.minor.patch} string.
     *
     * @throws InvalidVersionException if the string is not a valid version
     */
    public static Version parse(String text) throws InvalidVersionException {
        if (text == null || text.isEmpty()) {
            throw new InvalidVersionException(String.valueOf(text), "version cannot be null or empty");
        }

        Matcher matcher = VERSION_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new InvalidVersionException(text, "expected format major.minor.patch");
        }

        try {
            return new Version(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3))
            );
        } catch (NumberFormatException e) {
            throw new InvalidVersionException(text, "version component out of range", e);
        }
    }

    /**
     * Returns true if the string parses as a version.
     */
    public static boolean isValid(String text) {
        try {
            parse(text);
            return true;
        } catch (InvalidVersionException e) {
            return false;
        }
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public int getPatch() {
        return patch;
    }

    /**
     * Returns true if the two versions differ in their major component.
     */
    public boolean isBreakingChangeFrom(Version other) {
        return major != other.major;
    }

    public boolean isAtLeast(Version other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(Version other) {
        int result = Integer.compare(major, other.major);
        if (result != 0) {
            return result;
        }
        result = Integer.compare(minor, other.minor);
        if (result != 0) {
            return result;
        }
        return Integer.compare(patch, other.patch);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Version that = (Version) o;
        return major == that.major && minor == that.minor && patch == that.patch;
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
