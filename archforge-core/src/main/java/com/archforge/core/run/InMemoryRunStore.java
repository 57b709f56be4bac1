package com.archforge.core.run;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link RunStore} backed by a concurrent map. Expired entries are dropped lazily on read
 * and by {@link #purgeExpired()}.
 *
 * @param <V> stored value type
 */
public class InMemoryRunStore<V> implements RunStore<V> {

    private final Map<String, Entry<V>> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRunStore() {
        this(Clock.systemUTC());
    }

    public InMemoryRunStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<V> get(String runId) {
        Entry<V> entry = entries.get(runId);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(runId, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String runId, V value, Duration ttl) {
        entries.put(runId, new Entry<>(value, clock.instant().plus(ttl)));
    }

    @Override
    public void expire(String runId) {
        entries.remove(runId);
    }

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }

    private record Entry<V>(V value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
