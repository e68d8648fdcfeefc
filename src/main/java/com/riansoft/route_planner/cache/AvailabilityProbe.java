package com.riansoft.route_planner.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Remembers whether an external service answered recently. The answer is advisory:
 * a cached "down" never stops a caller from trying the real request.
 */
public class AvailabilityProbe {

    private static final String KEY = "available";

    private final TtlCache<String, Boolean> cache;

    public AvailabilityProbe(Duration ttl, Clock clock) {
        this.cache = new TtlCache<>(ttl, clock);
    }

    /**
     * Cached state if fresh, otherwise runs {@code probe} and caches its result.
     */
    public boolean isAvailable(BooleanSupplier probe) {
        Optional<Boolean> cached = cache.get(KEY);
        if (cached.isPresent()) {
            return cached.get();
        }
        boolean available = probe.getAsBoolean();
        cache.put(KEY, available);
        return available;
    }

    /** Feeds back the outcome of a real request. */
    public void record(boolean available) {
        cache.put(KEY, available);
    }

    public void reset() {
        cache.invalidateAll();
    }
}
