package com.nnstudio.orchestrator.probe;

/**
 * Health verdict for one model as seen by {@link PublisherHealthCache}.
 *
 * {@code status} and {@code http} are null when the verdict was assumed
 * (no snapshot, or the model was not probed).
 */
public record ModelHealth(boolean healthy, ProbeStatus status, Integer http) {

    public static ModelHealth assumedHealthy() {
        return new ModelHealth(true, null, null);
    }

    public static ModelHealth from(ModelProbeResult result) {
        return new ModelHealth(result.isHealthy(), result.status(), result.http());
    }
}
