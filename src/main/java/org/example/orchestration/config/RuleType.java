package org.example.orchestration.config;

/**
 * Kind of workspace policy rule.
 */
public enum RuleType {
    /** Dependency shape: cycles and unsatisfied version constraints. */
    DEPENDENCY_CONSTRAINT,
    /** Project naming convention. */
    NAMING_CONVENTION,
    /** Layering between groups of projects. */
    ARCHITECTURAL_BOUNDARY
}
