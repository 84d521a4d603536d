package com.nnstudio.orchestrator.render;

import com.nnstudio.orchestrator.problem.Problem;

import java.util.List;

/**
 * Outcome of a synchronous render.
 *
 * @param styleRejected items dropped because every generation copied a style reference
 * @param failed        items whose generation failed (after retries)
 * @param skipped       items never started because the run was cancelled
 * @param problems      one per failed item, carrying the final remote status
 */
public record RenderResult(
        List<RenderedImage> results,
        int                 total,
        int                 styleRejected,
        int                 failed,
        int                 skipped,
        List<Problem>       problems
) {
    public RenderResult {
        results  = results == null ? List.of() : List.copyOf(results);
        problems = problems == null ? List.of() : List.copyOf(problems);
    }
}
