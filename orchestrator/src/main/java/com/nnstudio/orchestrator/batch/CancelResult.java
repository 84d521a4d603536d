package com.nnstudio.orchestrator.batch;

/** {@code status} is "canceled" or "not_found", as reported by the relay. */
public record CancelResult(String jobId, String status, boolean manifestUpdated) {}
