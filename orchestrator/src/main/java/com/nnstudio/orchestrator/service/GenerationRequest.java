package com.nnstudio.orchestrator.service;

import com.nnstudio.orchestrator.model.PromptRow;
import com.nnstudio.orchestrator.model.ProviderName;
import com.nnstudio.orchestrator.model.ReferencePack;
import com.nnstudio.orchestrator.util.CancellationToken;

import java.nio.file.Path;
import java.util.List;

/**
 * One generation request as handed over by a front end.
 *
 * @param pack        reference pack, or null
 * @param provider    per-job provider override, or null for the configured default
 * @param outDir      output root, or null for the configured one
 * @param concurrency sync worker cap override, or null
 * @param compress    preflight compression override, or null
 * @param split       preflight split override, or null
 */
public record GenerationRequest(
        List<PromptRow>   rows,
        int               variants,
        ReferencePack     pack,
        ProviderName      provider,
        boolean           noFallback,
        RunMode           mode,
        Path              outDir,
        Integer           concurrency,
        Boolean           compress,
        Boolean           split,
        CancellationToken cancellation
) {
    public GenerationRequest {
        rows = rows == null ? List.of() : List.copyOf(rows);
        if (mode == null) mode = RunMode.DRY_RUN;
        if (cancellation == null) cancellation = CancellationToken.create();
    }

    public static GenerationRequest dryRun(List<PromptRow> rows, int variants, ReferencePack pack) {
        return new GenerationRequest(rows, variants, pack, null, false, RunMode.DRY_RUN,
                null, null, null, null, null);
    }

    public static GenerationRequest live(List<PromptRow> rows, int variants, ReferencePack pack,
                                         ProviderName provider, boolean noFallback, Path outDir) {
        return new GenerationRequest(rows, variants, pack, provider, noFallback, RunMode.LIVE,
                outDir, null, null, null, null);
    }
}
