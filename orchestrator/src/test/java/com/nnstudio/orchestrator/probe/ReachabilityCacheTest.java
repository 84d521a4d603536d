package com.nnstudio.orchestrator.probe;

import com.nnstudio.orchestrator.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ReachabilityCacheTest {

    MutableClock clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
    ReachabilityCache cache = new ReachabilityCache(Duration.ofMinutes(5), clock);

    @Test
    void isReachable_withinTtl_probesOnce() {
        AtomicInteger probes = new AtomicInteger();

        assertThat(cache.isReachable("p/l/m", () -> probes.incrementAndGet() > 0)).isTrue();
        clock.advance(Duration.ofMinutes(4));
        assertThat(cache.isReachable("p/l/m", () -> probes.incrementAndGet() > 0)).isTrue();

        assertThat(probes).hasValue(1);
    }

    @Test
    void isReachable_afterTtl_probesAgain() {
        AtomicInteger probes = new AtomicInteger();
        cache.isReachable("p/l/m", () -> probes.incrementAndGet() > 0);

        clock.advance(Duration.ofMinutes(5));
        cache.isReachable("p/l/m", () -> probes.incrementAndGet() > 0);

        assertThat(probes).hasValue(2);
    }

    @Test
    void isReachable_negativeResultCached() {
        assertThat(cache.isReachable("p/l/m", () -> false)).isFalse();
        assertThat(cache.isReachable("p/l/m", () -> true)).isFalse();
    }

    @Test
    void isReachable_probeThrows_unreachable() {
        assertThat(cache.isReachable("p/l/m", () -> { throw new IllegalStateException("boom"); })).isFalse();
    }

    @Test
    void isReachable_keysIndependent() {
        cache.isReachable("a", () -> false);

        assertThat(cache.isReachable("b", () -> true)).isTrue();
    }

    @Test
    void clear_forgetsEntries() {
        cache.isReachable("p/l/m", () -> false);
        cache.clear();

        assertThat(cache.isReachable("p/l/m", () -> true)).isTrue();
    }
}
