package com.riansoft.route_planner.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Concurrent key/value cache with a fixed time-to-live per entry.
 * Entries may disappear at any time; callers must be able to recompute them.
 */
public class TtlCache<K, V> {

    private final ConcurrentMap<K, Entry<V>> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;
    private volatile Instant nextPurge;

    public TtlCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
        this.nextPurge = clock.instant().plus(ttl);
    }

    public Optional<V> get(K key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.expiresAt.isAfter(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    /**
     * Stores {@code value}. At most once per TTL this also drops every expired entry,
     * so keys that are never read again do not pile up.
     */
    public void put(K key, V value) {
        Instant now = clock.instant();
        if (!now.isBefore(nextPurge)) {
            nextPurge = now.plus(ttl);
            entries.values().removeIf(entry -> !entry.expiresAt.isAfter(now));
        }
        entries.put(key, new Entry<>(value, now.plus(ttl)));
    }

    public void invalidateAll() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private static final class Entry<V> {
        private final V value;
        private final Instant expiresAt;

        private Entry(V value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
