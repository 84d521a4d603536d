package com.nnstudio.orchestrator.batch;

/**
 * Tunables for the batch job manager.
 *
 * @param pricePerImageUsd  optional price used for cost warnings; null when unknown
 * @param styleGuardEnabled run the style guard over fetched images
 * @param maxPolls          watch mode gives up after this many polls
 * @param watchBaseDelayMs  first watch interval; grows 1.5x per poll
 * @param watchMaxDelayMs   watch interval ceiling
 */
public record BatchSettings(
        Double  pricePerImageUsd,
        boolean styleGuardEnabled,
        int     maxPolls,
        long    watchBaseDelayMs,
        long    watchMaxDelayMs
) {
    public static final int  LARGE_BATCH_THRESHOLD = 100;

    public static BatchSettings defaults() {
        return new BatchSettings(null, true, 1000, 2000, 30_000);
    }

    /** Interval before the next poll after {@code pollsSoFar} polls. */
    public long watchDelay(int pollsSoFar) {
        double delay = watchBaseDelayMs * Math.pow(1.5, Math.min(pollsSoFar, 10));
        return (long) Math.min(delay, watchMaxDelayMs);
    }

    public Double estimatedCost(int images) {
        return pricePerImageUsd == null ? null : images * pricePerImageUsd;
    }
}
