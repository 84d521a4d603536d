package com.nnstudio.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Backends a job can be routed to.
 *
 * BATCH  - asynchronous batch API behind the relay (queued, retried server-side)
 * VERTEX - synchronous per-request generation
 */
public enum ProviderName {
    BATCH("batch", "gemini-batch"),
    VERTEX("vertex", "vertex");

    private final String id;
    private final String manifestName;

    ProviderName(String id, String manifestName) {
        this.id           = id;
        this.manifestName = manifestName;
    }

    @JsonValue
    public String id() { return id; }

    /** Name recorded in job manifests ("gemini-batch" | "vertex"). */
    public String manifestName() { return manifestName; }

    /**
     * Lenient parse used for configuration values: anything other than
     * "vertex" resolves to BATCH.
     */
    public static ProviderName fromConfig(String value) {
        return value != null && value.trim().equalsIgnoreCase("vertex") ? VERTEX : BATCH;
    }

    /** Strict parse used for per-job overrides; unknown names are rejected. */
    @JsonCreator
    public static ProviderName parse(String value) {
        if (value == null) return null;
        for (ProviderName p : values()) {
            if (p.id.equalsIgnoreCase(value.trim())) return p;
        }
        throw new IllegalArgumentException("provider=" + value + ". Must be 'batch' or 'vertex'");
    }
}
