package com.archforge.core.consistency;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of reconciling one generated source file against canonical signatures.
 *
 * @param content possibly rewritten content
 * @param drifts signatures rewritten in the content
 */
public record SourceReconciliation(String content, List<DriftWarning> drifts) {

    /**
     * Compact constructor with validation.
     */
    public SourceReconciliation {
        Objects.requireNonNull(content, "content must not be null");
        drifts = drifts == null ? List.of() : List.copyOf(drifts);
    }

    public boolean changed() {
        return !drifts.isEmpty();
    }
}
