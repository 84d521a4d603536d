package com.nnstudio.orchestrator.batch;

public record SubmitResult(String jobId, int estCount) {}
