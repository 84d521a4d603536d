package com.nnstudio.orchestrator.probe;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Contents of {@code artifacts/probe/publishers.json}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProbeSnapshot(
        Instant                timestamp,
        String                 project,
        String                 location,
        List<ModelProbeResult> results
) {
    public ProbeSnapshot {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public Optional<ModelProbeResult> find(String model) {
        return results.stream().filter(r -> model.equals(r.model())).findFirst();
    }
}
