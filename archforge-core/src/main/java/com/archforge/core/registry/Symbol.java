package com.archforge.core.registry;

import com.archforge.core.model.Layer;
import com.archforge.core.model.Visibility;

import java.util.Objects;
import java.util.Set;

/**
 * Snapshot of one registry entry.
 *
 * <p>Ids follow {@code <layer>_<owner>_<member>} for members and {@code <layer>_<owner>}
 * for units and exports. Dependency and dependent sets hold symbol ids and are kept
 * mutually consistent by {@link SymbolRegistry}.
 *
 * @param id unique id
 * @param name simple name
 * @param owner owning unit name (equal to {@code name} for units and exports)
 * @param type what the symbol denotes
 * @param filePath artifact path that defines the symbol
 * @param layer architectural layer
 * @param visibility visibility
 * @param dependencies ids of symbols this one depends on
 * @param dependents ids of symbols depending on this one
 */
public record Symbol(
    String id,
    String name,
    String owner,
    SymbolType type,
    String filePath,
    Layer layer,
    Visibility visibility,
    Set<String> dependencies,
    Set<String> dependents
) {
    /**
     * Compact constructor with validation.
     */
    public Symbol {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(layer, "layer must not be null");
        dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
        dependents = dependents == null ? Set.of() : Set.copyOf(dependents);
        if (visibility == null) {
            visibility = Visibility.PUBLIC;
        }
    }
}
