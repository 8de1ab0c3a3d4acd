package org.example.orchestration.version;

import java.util.List;

/**
 * Ordered set of version updates proposed for several projects.
 *
 * <p>A plan is valid when every referenced project is registered and every target version
 * parses. Constraint compatibility is not part of plan validity.</p>
 */
public class VersionUpdatePlan {

    private final List<VersionUpdateStep> updates;
    private final boolean valid;
    private final List<String> validationErrors;
    private final int totalAffected;

    public VersionUpdatePlan(List<VersionUpdateStep> updates, List<String> validationErrors, int totalAffected) {
        this.updates = List.copyOf(updates);
        this.validationErrors = List.copyOf(validationErrors);
        this.valid = validationErrors.isEmpty();
        this.totalAffected = totalAffected;
    }

    /**
     * Returns the well-formed steps, in request order.
     */
    public List<VersionUpdateStep> getUpdates() {
        return updates;
    }

    public boolean isValid() {
        return valid;
    }

    public List<String> getValidationErrors() {
        return validationErrors;
    }

    /**
     * Returns the number of distinct projects affected by any step.
     */
    public int getTotalAffected() {
        return totalAffected;
    }

    public boolean hasBreakingChanges() {
        return updates.stream().anyMatch(VersionUpdateStep::isBreaking);
    }

    @Override
    public String toString() {
        return String.format("VersionUpdatePlan{valid=%s, updates=%s, totalAffected=%d, errors=%s}",
                valid, updates, totalAffected, validationErrors);
    }
}
