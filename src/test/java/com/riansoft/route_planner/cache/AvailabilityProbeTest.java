package com.riansoft.route_planner.cache;

import com.riansoft.route_planner.testutil.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AvailabilityProbeTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
    private final AvailabilityProbe probe = new AvailabilityProbe(Duration.ofSeconds(30), clock);

    @Test
    @DisplayName("the probe query runs once per TTL window")
    void cachesProbeResult() {
        AtomicInteger calls = new AtomicInteger();
        assertTrue(probe.isAvailable(() -> calls.incrementAndGet() > 0));
        assertTrue(probe.isAvailable(() -> calls.incrementAndGet() > 0));
        assertEquals(1, calls.get());

        clock.advance(Duration.ofSeconds(31));
        probe.isAvailable(() -> calls.incrementAndGet() > 0);
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("a real request outcome overrides the cached probe")
    void recordOverrides() {
        assertFalse(probe.isAvailable(() -> false));
        probe.record(true);
        assertTrue(probe.isAvailable(() -> false));

        probe.reset();
        assertFalse(probe.isAvailable(() -> false));
    }
}
