package com.nnstudio.orchestrator.batch;

import com.nnstudio.orchestrator.model.JobStatus;
import com.nnstudio.orchestrator.problem.Problem;

import java.util.List;

/**
 * Outcome of a fetch. When {@code ready} is false the job was still
 * pending/running and nothing was downloaded.
 */
public record FetchResult(
        String           jobId,
        JobStatus        status,
        boolean          ready,
        List<SavedImage> results,
        List<Problem>    problems
) {
    public FetchResult {
        results  = results  == null ? List.of() : List.copyOf(results);
        problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public static FetchResult notReady(String jobId, JobStatus status) {
        return new FetchResult(jobId, status, false, List.of(), List.of());
    }
}
