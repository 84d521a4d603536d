package com.nnstudio.orchestrator.batch;

import com.nnstudio.orchestrator.model.JobManifest;
import com.nnstudio.orchestrator.model.PromptRow;
import com.nnstudio.orchestrator.model.ReferencePack;

import java.util.List;

/**
 * Everything needed to submit one batch job.
 *
 * @param pack      reference pack, or null when the job has no references
 * @param preflight summary stored in the manifest, or null
 * @param chunk     position of this job when a request was split, or null
 */
public record SubmitRequest(
        List<PromptRow>               rows,
        int                           variants,
        ReferencePack                 pack,
        JobManifest.PreflightSummary  preflight,
        JobManifest.ChunkInfo         chunk
) {
    public SubmitRequest {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static SubmitRequest of(List<PromptRow> rows, int variants, ReferencePack pack) {
        return new SubmitRequest(rows, variants, pack, null, null);
    }
}
