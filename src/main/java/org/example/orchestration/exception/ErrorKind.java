package org.example.orchestration.exception;

/**
 * Classifies orchestration failures so callers can decide on remediation
 * without inspecting messages.
 */
public enum ErrorKind {
    DUPLICATE_PROJECT,
    UNKNOWN_PROJECT,
    INVALID_VERSION,
    INCOMPATIBLE_VERSION,
    CIRCULAR_DEPENDENCY,
    INVALID_CONFIGURATION
}
