package com.nnstudio.orchestrator.batch;

import com.nnstudio.orchestrator.model.JobStatus;

/**
 * @param fetch results when the job had succeeded, otherwise null
 * @param hint  what to do next when the job is not finished, otherwise null
 */
public record ResumeResult(String jobId, JobStatus status, FetchResult fetch, String hint) {}
