package com.nnstudio.orchestrator.probe;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Outcome of probing one publisher model.
 *
 * {@code http} is 0 when the request never got an answer; {@code code}
 * is one of model-not-entitled, error-json, non-json, timeout, network-error.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelProbeResult(
        String      model,
        ProbeStatus status,
        int         http,
        String      code,
        Instant     timestamp,
        String      endpoint
) {
    public boolean isHealthy() {
        return status == ProbeStatus.HEALTHY;
    }
}
