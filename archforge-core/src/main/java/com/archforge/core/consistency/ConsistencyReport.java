package com.archforge.core.consistency;

import com.archforge.core.model.ArchitectureModel;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of reconciling a model.
 *
 * @param model model with drifted methods rewritten
 * @param drifts corrected mismatches
 * @param consistentMethods dependent methods that already matched, as {@code Class.method}
 */
public record ConsistencyReport(
    ArchitectureModel model,
    List<DriftWarning> drifts,
    List<String> consistentMethods
) {
    /**
     * Compact constructor with validation.
     */
    public ConsistencyReport {
        Objects.requireNonNull(model, "model must not be null");
        drifts = drifts == null ? List.of() : List.copyOf(drifts);
        consistentMethods = consistentMethods == null ? List.of() : List.copyOf(consistentMethods);
    }

    public boolean hasDrift() {
        return !drifts.isEmpty();
    }
}
