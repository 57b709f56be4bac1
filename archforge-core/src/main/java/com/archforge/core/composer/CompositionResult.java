package com.archforge.core.composer;

import java.util.List;

/**
 * Outcome of a composition.
 *
 * @param written output-root relative paths written
 * @param deleted output-root relative paths removed during cleanup
 */
public record CompositionResult(List<String> written, List<String> deleted) {

    /**
     * Compact constructor with validation.
     */
    public CompositionResult {
        written = written == null ? List.of() : List.copyOf(written);
        deleted = deleted == null ? List.of() : List.copyOf(deleted);
    }
}
