package org.example.orchestration.model;

/**
 * Kind of dependency edge between two projects.
 */
public enum DependencyType {
    /** Declared directly by the dependent project. */
    DIRECT,
    /** Pulled in through another dependency. */
    TRANSITIVE,
    /** Needed only for development or tests. */
    DEV
}
