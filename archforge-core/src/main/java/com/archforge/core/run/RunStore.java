package com.archforge.core.run;

import java.time.Duration;
import java.util.Optional;

/**
 * Keyed storage for run state.
 *
 * <p>The backing is swappable (in-memory, key-value store). Entries carry a time to live;
 * an expired entry is never returned.
 *
 * @param <V> stored value type
 */
public interface RunStore<V> {

    /**
     * Returns the value of a run.
     *
     * @param runId run identifier
     * @return stored value, empty if absent or expired
     */
    Optional<V> get(String runId);

    /**
     * Stores or replaces the value of a run.
     *
     * @param runId run identifier
     * @param value value to store
     * @param ttl time to live from now
     */
    void set(String runId, V value, Duration ttl);

    /**
     * Removes a run at once.
     *
     * @param runId run identifier
     */
    void expire(String runId);
}
