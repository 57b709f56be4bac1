package com.archforge.core.generator;

import com.archforge.core.model.ArchitectureModel;
import com.archforge.core.model.InfraContext;
import com.archforge.core.registry.SymbolRegistry;

import java.util.Objects;

/**
 * Run-scoped inputs shared by all generators of one run.
 *
 * @param model reconciled architecture model
 * @param registry run symbol registry
 * @param infraContext infrastructure settings for build and deploy prompts
 */
public record GenerationContext(
    ArchitectureModel model,
    SymbolRegistry registry,
    InfraContext infraContext
) {
    /**
     * Compact constructor with validation.
     */
    public GenerationContext {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
        if (infraContext == null) {
            infraContext = model.infraContext();
        }
    }
}
