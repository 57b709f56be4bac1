package com.archforge.core.pipeline;

import com.archforge.core.consistency.ConsistencyReport;
import com.archforge.core.model.ArchitectureModel;
import com.archforge.core.parser.ParseResult;
import com.archforge.core.registry.SymbolRegistry;

import java.util.Objects;

/**
 * A parsed and reconciled model together with the registry built from it.
 *
 * @param parse raw parse result
 * @param consistency reconciliation outcome; its model is the one to plan from
 * @param registry run registry, already holding reconciled signatures
 */
public record ModelPreparation(
    ParseResult parse,
    ConsistencyReport consistency,
    SymbolRegistry registry
) {
    /**
     * Compact constructor with validation.
     */
    public ModelPreparation {
        Objects.requireNonNull(parse, "parse must not be null");
        Objects.requireNonNull(consistency, "consistency must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
    }

    public ArchitectureModel model() {
        return consistency.model();
    }
}
