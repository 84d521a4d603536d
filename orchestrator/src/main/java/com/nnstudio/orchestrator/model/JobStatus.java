package com.nnstudio.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of an async batch job.
 *
 * Transitions (happy path):
 *   PENDING → RUNNING → SUCCEEDED
 *
 * Any non-terminal state can move to FAILED (remote failure) or
 * CANCELED (user request).
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStatus fromWire(String value) {
        if (value == null) return null;
        String v = value.trim().toUpperCase(Locale.ROOT);
        // some relays spell it the British way
        if (v.equals("CANCELLED")) return CANCELED;
        return JobStatus.valueOf(v);
    }
}
