package com.nnstudio.orchestrator.service;

import com.nnstudio.orchestrator.batch.SubmitResult;
import com.nnstudio.orchestrator.model.ProviderName;
import com.nnstudio.orchestrator.preflight.PreflightResult;
import com.nnstudio.orchestrator.problem.Problem;
import com.nnstudio.orchestrator.render.RenderResult;

import java.util.List;

/**
 * Result of {@link GenerationOrchestrator#generate}. Which fields are set
 * depends on {@link #kind}:
 *
 * ESTIMATED       - estimate
 * BATCH_SUBMITTED - jobs (one per chunk); problems if a later chunk failed
 * RENDERED        - render; problems for items that failed after retries
 * REJECTED        - problems
 */
public record GenerationOutcome(
        Kind               kind,
        ProviderName       provider,
        PreflightResult    preflight,
        CostEstimate       estimate,
        List<SubmitResult> jobs,
        RenderResult       render,
        List<Problem>      problems
) {
    public enum Kind { ESTIMATED, BATCH_SUBMITTED, RENDERED, REJECTED }

    public GenerationOutcome {
        jobs     = jobs     == null ? List.of() : List.copyOf(jobs);
        problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public static GenerationOutcome estimated(PreflightResult preflight, CostEstimate estimate) {
        return new GenerationOutcome(Kind.ESTIMATED, estimate.provider(), preflight, estimate, null, null, null);
    }

    public static GenerationOutcome submitted(PreflightResult preflight, List<SubmitResult> jobs, List<Problem> problems) {
        return new GenerationOutcome(Kind.BATCH_SUBMITTED, ProviderName.BATCH, preflight, null, jobs, null, problems);
    }

    public static GenerationOutcome rendered(PreflightResult preflight, RenderResult render) {
        return new GenerationOutcome(Kind.RENDERED, ProviderName.VERTEX, preflight, null, null, render, render.problems());
    }

    public static GenerationOutcome rejected(PreflightResult preflight, List<Problem> problems) {
        return new GenerationOutcome(Kind.REJECTED, null, preflight, null, null, null, problems);
    }

    public boolean isRejected() {
        return kind == Kind.REJECTED;
    }
}
