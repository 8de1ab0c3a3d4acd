package org.example.orchestration.exception;

import java.util.List;

/**
 * Exception thrown when an operation requires an acyclic graph but a cycle exists.
 */
public class CircularDependencyException extends OrchestrationException {

    private final List<String> cycle;

    public CircularDependencyException(List<String> cycle) {
        super(ErrorKind.CIRCULAR_DEPENDENCY, "Circular dependency detected: " + describe(cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Returns the projects on the cycle, in traversal order.
     */
    public List<String> getCycle() {
        return cycle;
    }

    private static String describe(List<String> cycle) {
        if (cycle.isEmpty()) {
            return "(empty)";
        }
        return String.join(" -> ", cycle) + " -> " + cycle.get(0);
    }
}
