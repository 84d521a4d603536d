package com.nnstudio.orchestrator.probe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;

/**
 * Remembers whether a sync client answered its liveness probe, so
 * provider selection does not probe on every job. In-memory only.
 */
@Component
public class ReachabilityCache {

    private static final Logger log = LoggerFactory.getLogger(ReachabilityCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final Duration ttl;
    private final Clock    clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    private record Entry(boolean reachable, Instant checkedAt) {}

    public ReachabilityCache(@Value("${nn.probe.reachability-ttl:PT5M}") Duration ttl, Clock clock) {
        this.ttl   = ttl;
        this.clock = clock;
    }

    /**
     * Cached answer for {@code key} while younger than the TTL, otherwise
     * runs {@code probe} and caches its result. A probe that throws counts
     * as unreachable.
     */
    public boolean isReachable(String key, BooleanSupplier probe) {
        Instant now = clock.instant();
        Entry hit = entries.get(key);
        if (hit != null && Duration.between(hit.checkedAt(), now).compareTo(ttl) < 0) {
            return hit.reachable();
        }
        boolean reachable;
        try {
            reachable = probe.getAsBoolean();
        } catch (RuntimeException e) {
            log.warn("Reachability probe for {} failed: {}", key, e.getMessage());
            reachable = false;
        }
        entries.put(key, new Entry(reachable, now));
        return reachable;
    }

    public void clear() {
        entries.clear();
    }
}
