package com.nnstudio.orchestrator.service;

import com.nnstudio.orchestrator.batch.BatchJobManager;
import com.nnstudio.orchestrator.batch.BatchSettings;
import com.nnstudio.orchestrator.batch.OperationsLedger;
import com.nnstudio.orchestrator.batch.SubmitRequest;
import com.nnstudio.orchestrator.batch.SubmitResult;
import com.nnstudio.orchestrator.model.JobManifest;
import com.nnstudio.orchestrator.model.PromptRow;
import com.nnstudio.orchestrator.model.ProviderName;
import com.nnstudio.orchestrator.preflight.PreflightBudgets;
import com.nnstudio.orchestrator.preflight.PreflightResult;
import com.nnstudio.orchestrator.preflight.ReferenceRegistry;
import com.nnstudio.orchestrator.problem.Problem;
import com.nnstudio.orchestrator.problem.ProblemException;
import com.nnstudio.orchestrator.problem.ProblemTypes;
import com.nnstudio.orchestrator.provider.ImageProvider;
import com.nnstudio.orchestrator.provider.ProviderSelector;
import com.nnstudio.orchestrator.provider.ProviderSettings;
import com.nnstudio.orchestrator.provider.SyncImageProvider;
import com.nnstudio.orchestrator.render.RenderResult;
import com.nnstudio.orchestrator.render.SyncRenderer;
import com.nnstudio.orchestrator.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for image generation.
 *
 * <pre>
 *   validate → preflight → (dry run: estimate)
 *            → select provider → batch: one job per chunk
 *                              → sync:  render in-process
 * </pre>
 *
 * Every failure is returned as a REJECTED outcome carrying Problems; this
 * class never throws to its caller. Identical requests (same prompts,
 * references and variants) may not run concurrently in this process.
 */
@Service
public class GenerationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GenerationOrchestrator.class);

    public static final String OP_RENDER   = "render";
    public static final String OP_GENERATE = "generate";

    private final ReferenceRegistry registry;
    private final PreflightBudgets  budgets;
    private final ProviderSelector  selector;
    private final ProviderSettings  providerSettings;
    private final BatchJobManager   batchJobs;
    private final SyncRenderer      renderer;
    private final OperationsLedger  ledger;
    private final Double            pricePerImageUsd;
    private final Path              defaultOutDir;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public GenerationOrchestrator(ReferenceRegistry registry, PreflightBudgets budgets,
                                  ProviderSelector selector, ProviderSettings providerSettings,
                                  BatchJobManager batchJobs, SyncRenderer renderer, OperationsLedger ledger,
                                  Double pricePerImageUsd, Path defaultOutDir) {
        this.registry         = registry;
        this.budgets          = budgets;
        this.selector         = selector;
        this.providerSettings = providerSettings;
        this.batchJobs        = batchJobs;
        this.renderer         = renderer;
        this.ledger           = ledger;
        this.pricePerImageUsd = pricePerImageUsd;
        this.defaultOutDir    = defaultOutDir;
    }

    @Autowired
    public GenerationOrchestrator(ReferenceRegistry registry, PreflightBudgets budgets,
                                  ProviderSelector selector, ProviderSettings providerSettings,
                                  BatchJobManager batchJobs, SyncRenderer renderer, OperationsLedger ledger,
                                  BatchSettings batchSettings,
                                  @Value("${nn.out-dir}") String outDir) {
        this(registry, budgets, selector, providerSettings, batchJobs, renderer, ledger,
                batchSettings.pricePerImageUsd(), Path.of(outDir));
    }

    public GenerationOutcome generate(GenerationRequest request) {
        try {
            BatchJobManager.validate(request.rows(), request.variants());

            PreflightResult preflight = registry.preflight(request.rows(), request.pack(),
                    budgets.withOverrides(request.compress(), request.split()));
            if (!preflight.ok()) {
                log.warn("Preflight rejected request: {}", preflight.problems().get(0).title());
                return GenerationOutcome.rejected(preflight, preflight.problems());
            }

            int imageCount = request.rows().size() * request.variants();
            if (request.mode() == RunMode.DRY_RUN) {
                ProviderName provider = request.provider() != null ? request.provider() : providerSettings.defaultProvider();
                CostEstimate estimate = CostEstimate.of(provider, imageCount, pricePerImageUsd);
                log.info("Dry run: {} images via {}, ~{}s{}", imageCount, provider.id(), estimate.estimatedSeconds(),
                        estimate.estimatedCostUsd() == null ? "" : String.format(", ~$%.2f", estimate.estimatedCostUsd()));
                return GenerationOutcome.estimated(preflight, estimate);
            }

            String fingerprint = fingerprint(request);
            if (!inFlight.add(fingerprint)) {
                return GenerationOutcome.rejected(preflight, List.of(Problem.of(ProblemTypes.REQUEST_IN_FLIGHT,
                        "Request already in flight",
                        "An identical request (" + fingerprint.substring(0, 12) + ") is still running", 409)));
            }
            try {
                ImageProvider provider = selector.selectProvider(request.provider(), request.noFallback());
                Path outDir = request.outDir() != null ? request.outDir() : defaultOutDir;
                if (provider instanceof SyncImageProvider sync) {
                    return renderSync(sync, request, preflight, outDir);
                }
                return submitBatch(request, preflight);
            } finally {
                inFlight.remove(fingerprint);
            }

        } catch (ProblemException e) {
            log.warn("Generation rejected: {}", e.getMessage());
            return GenerationOutcome.rejected(null, List.of(e.problem()));
        } catch (RuntimeException e) {
            log.error("Generation failed unexpectedly: {}", e.getMessage(), e);
            Problem problem = Problem.of(ProblemTypes.INTERNAL, "Generation failed", e.getMessage(), 500);
            ledger.recordProblem(OP_GENERATE, "rows=" + request.rows().size(), problem, Map.of());
            return GenerationOutcome.rejected(null, List.of(problem));
        }
    }

    // ------------------------------------------------------------------
    // Paths
    // ------------------------------------------------------------------

    private GenerationOutcome submitBatch(GenerationRequest request, PreflightResult preflight) {
        List<List<PromptRow>> slices = slice(request.rows(), preflight.chunks());
        JobManifest.PreflightSummary summary = new JobManifest.PreflightSummary(preflight.chunks(),
                preflight.uniqueRefs(), preflight.bytes().before(), preflight.bytes().after());

        List<SubmitResult> jobs = new ArrayList<>();
        for (int i = 0; i < slices.size(); i++) {
            JobManifest.ChunkInfo chunk = slices.size() > 1 ? new JobManifest.ChunkInfo(i, slices.size()) : null;
            try {
                jobs.add(batchJobs.submit(new SubmitRequest(slices.get(i), request.variants(),
                        request.pack(), summary, chunk)));
            } catch (ProblemException e) {
                if (jobs.isEmpty()) {
                    throw e;
                }
                log.error("Chunk {}/{} failed after {} job(s) were submitted", i + 1, slices.size(), jobs.size());
                return GenerationOutcome.submitted(preflight, jobs, List.of(e.problem()));
            }
        }
        return GenerationOutcome.submitted(preflight, jobs, List.of());
    }

    private GenerationOutcome renderSync(SyncImageProvider provider, GenerationRequest request,
                                         PreflightResult preflight, Path outDir) {
        List<Path> styleRefs = request.pack() == null
                ? List.of()
                : request.pack().stylePaths().stream().map(Path::of).toList();
        Path rendersDir = outDir.resolve("renders");

        RenderResult result = renderer.render(provider.client(), request.rows(), request.variants(),
                styleRefs, rendersDir, request.concurrency(), request.cancellation());

        ledger.recordSuccess(OP_RENDER, "rows=" + request.rows().size(), rendersDir.toString(), Map.of(
                "total",         result.total(),
                "saved",         result.results().size(),
                "styleRejected", result.styleRejected(),
                "failed",        result.failed(),
                "skipped",       result.skipped()));
        return GenerationOutcome.rendered(preflight, result);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Contiguous slices of near-equal size; never more slices than rows. */
    static List<List<PromptRow>> slice(List<PromptRow> rows, int chunks) {
        int n = Math.max(1, Math.min(chunks, rows.size()));
        int size = (rows.size() + n - 1) / n;
        List<List<PromptRow>> out = new ArrayList<>();
        for (int start = 0; start < rows.size(); start += size) {
            out.add(rows.subList(start, Math.min(rows.size(), start + size)));
        }
        return out;
    }

    static String fingerprint(GenerationRequest request) {
        StringBuilder sb = new StringBuilder();
        request.rows().forEach(r -> sb.append(r.prompt()).append('\n'));
        sb.append("pack=").append(request.pack() == null ? "-" : request.pack().digest());
        sb.append(";variants=").append(request.variants());
        return Hashing.sha256Hex(sb.toString());
    }
}
