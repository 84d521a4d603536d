package com.nnstudio.orchestrator.render;

/**
 * @param maxConcurrency    configured worker cap (further capped at {@link SyncRenderer#HARD_CONCURRENCY_CAP})
 * @param styleGuardEnabled check outputs against style references
 * @param styleRetries      extra generations after a style-guard failure
 * @param styleRetryJitterMs upper bound of the random pause before each extra generation
 */
public record RenderSettings(
        int     maxConcurrency,
        boolean styleGuardEnabled,
        int     styleRetries,
        long    styleRetryJitterMs
) {
    public static RenderSettings defaults() {
        return new RenderSettings(2, true, 2, 2000);
    }
}
