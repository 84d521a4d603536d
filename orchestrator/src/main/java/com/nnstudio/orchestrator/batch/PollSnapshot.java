package com.nnstudio.orchestrator.batch;

import com.nnstudio.orchestrator.model.JobStatus;

/**
 * Remote status after one or more polls.
 *
 * @param polls    number of polls made by this call
 * @param appended whether the last poll added a history entry
 */
public record PollSnapshot(
        String    jobId,
        JobStatus status,
        Integer   completed,
        Integer   total,
        int       polls,
        boolean   appended
) {}
