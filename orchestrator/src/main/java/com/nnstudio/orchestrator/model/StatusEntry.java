package com.nnstudio.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/** One line of a job's status history. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusEntry(
        Instant   timestamp,
        JobStatus status,
        Integer   completed,
        Integer   total
) {
    public static StatusEntry of(Instant timestamp, JobStatus status) {
        return new StatusEntry(timestamp, status, null, null);
    }
}
