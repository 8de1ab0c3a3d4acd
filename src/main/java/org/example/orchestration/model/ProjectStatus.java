package org.example.orchestration.model;

/**
 * Health status of a workspace project.
 */
public enum ProjectStatus {
    HEALTHY,
    WARNING,
    CRITICAL,
    UNKNOWN
}
