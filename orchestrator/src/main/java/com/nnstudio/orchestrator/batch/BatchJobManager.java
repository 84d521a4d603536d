package com.nnstudio.orchestrator.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.nnstudio.orchestrator.client.BatchClient;
import com.nnstudio.orchestrator.client.RemoteCallException;
import com.nnstudio.orchestrator.client.dto.BatchRow;
import com.nnstudio.orchestrator.client.dto.BatchSubmitRequest;
import com.nnstudio.orchestrator.client.dto.CancelResponse;
import com.nnstudio.orchestrator.client.dto.PollResponse;
import com.nnstudio.orchestrator.client.dto.ResultItem;
import com.nnstudio.orchestrator.client.dto.ResultsResponse;
import com.nnstudio.orchestrator.client.dto.SubmitResponse;
import com.nnstudio.orchestrator.model.JobManifest;
import com.nnstudio.orchestrator.model.JobStatus;
import com.nnstudio.orchestrator.model.PromptRow;
import com.nnstudio.orchestrator.model.ProviderName;
import com.nnstudio.orchestrator.problem.Problem;
import com.nnstudio.orchestrator.problem.ProblemException;
import com.nnstudio.orchestrator.problem.ProblemTypes;
import com.nnstudio.orchestrator.provider.ProviderContext;
import com.nnstudio.orchestrator.retry.RetryPolicy;
import com.nnstudio.orchestrator.retry.Sleeper;
import com.nnstudio.orchestrator.styleguard.StyleGuard;
import com.nnstudio.orchestrator.util.AtomicFiles;
import com.nnstudio.orchestrator.util.Hashing;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Lifecycle of asynchronous batch jobs: submit → poll → fetch, plus cancel
 * and resume.
 *
 * All state lives in the job manifest on disk and is re-read by every
 * operation, so a job submitted by one process can be polled, fetched or
 * canceled by another. Status history only ever grows: a poll appends an
 * entry only when the remote status differs from the last recorded one.
 *
 * Remote calls go through {@link RetryPolicy}; remote failures that survive
 * the retries are recorded as Problems on the manifest and rethrown.
 */
@Service
public class BatchJobManager {

    private static final Logger log = LoggerFactory.getLogger(BatchJobManager.class);

    public static final String OP_SUBMIT = "batch-submit";
    public static final String OP_POLL   = "batch-poll";
    public static final String OP_FETCH  = "batch-fetch";
    public static final String OP_CANCEL = "batch-cancel";

    private final BatchClient      client;
    private final RetryPolicy      retry;
    private final JobManifestStore store;
    private final OperationsLedger ledger;
    private final StyleGuard       styleGuard;
    private final BatchSettings    settings;
    private final Sleeper          sleeper;
    private final Clock            clock;
    private final MeterRegistry    meterRegistry;

    public BatchJobManager(ProviderContext context, RetryPolicy retry, JobManifestStore store,
                           OperationsLedger ledger, StyleGuard styleGuard, BatchSettings settings,
                           Sleeper sleeper, Clock clock, MeterRegistry meterRegistry) {
        this.client        = context.batchClient();
        this.retry         = retry;
        this.store         = store;
        this.ledger        = ledger;
        this.styleGuard    = styleGuard;
        this.settings      = settings;
        this.sleeper       = sleeper;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // submit
    // ------------------------------------------------------------------

    /**
     * Submit one job and persist its manifest with a single {@code pending} entry.
     *
     * @throws ProblemException 400 for invalid rows/variants; 5xx when the
     *         relay keeps failing
     */
    public SubmitResult submit(SubmitRequest request) {
        validate(request.rows(), request.variants());
        int estCount = request.rows().size() * request.variants();

        if (estCount > BatchSettings.LARGE_BATCH_THRESHOLD) {
            Double cost = settings.estimatedCost(estCount);
            log.warn("Large batch of {} images{} - consider splitting for better reliability",
                    estCount, cost == null ? "" : String.format(" (est. $%.2f)", cost));
        }

        List<String> styleRefs = request.pack() == null ? List.of() : request.pack().stylePaths();
        if (!styleRefs.isEmpty()) {
            styleGuard.flagCopyWording(request.rows());
        }
        List<BatchRow> rows = request.rows().stream()
                .map(r -> BatchRow.from(r, StyleGuard.withStyleOnlyPrefix(r.prompt())))
                .toList();
        BatchSubmitRequest body = new BatchSubmitRequest(rows, request.variants(), true, styleRefs);

        return timed(OP_SUBMIT, () -> {
            SubmitResponse resp;
            try {
                resp = retry.withRetry("submit", () -> client.submit(body));
            } catch (RemoteCallException e) {
                Problem problem = remoteProblem("Batch submit failed", e);
                ledger.recordProblem(OP_SUBMIT, "rows=" + rows.size(), problem, Map.of());
                throw new ProblemException(problem, e);
            }
            if (resp.estCount() != estCount) {
                log.warn("Relay estimated {} images for job {}, expected {}", resp.estCount(), resp.jobId(), estCount);
            }

            withJobContext(resp.jobId(), OP_SUBMIT, () -> {
                Instant now = clock.instant();
                JobManifest manifest = new JobManifest(resp.jobId(), ProviderName.BATCH.manifestName(), now, estCount);
                manifest.setPromptsHash(Hashing.promptsHash(request.rows().stream().map(PromptRow::prompt).toList()));
                if (request.pack() != null) {
                    manifest.setStyleRefsHash(request.pack().digest());
                    manifest.setStyleRefs(styleRefs);
                }
                manifest.setChunk(request.chunk());
                manifest.setPreflight(request.preflight());
                manifest.recordStatus(now, JobStatus.PENDING, 0, estCount);
                store.save(manifest);

                Map<String, Object> meta = new LinkedHashMap<>();
                meta.put("estCount", estCount);
                meta.put("variants", request.variants());
                if (request.chunk() != null) meta.put("chunk", request.chunk());
                ledger.recordSuccess(OP_SUBMIT, "rows=" + rows.size(), resp.jobId(), meta);
                log.info("Batch job {} submitted: {} images", resp.jobId(), estCount);
                return null;
            });
            return new SubmitResult(resp.jobId(), estCount);
        });
    }

    // ------------------------------------------------------------------
    // poll
    // ------------------------------------------------------------------

    /**
     * Poll once, or with {@code watch} keep polling with growing intervals
     * until the job reaches a terminal status.
     *
     * @throws ProblemException 504 {@code batch/poll-limit-exceeded} when
     *         watching exceeds the poll limit
     */
    public PollSnapshot poll(String jobId, boolean watch) {
        int polls = 0;
        while (true) {
            polls++;
            PollSnapshot snap = pollOnce(jobId, polls);
            if (!watch || snap.status().isTerminal()) {
                return snap;
            }
            if (polls >= settings.maxPolls()) {
                Problem problem = Problem.of(ProblemTypes.BATCH_POLL_LIMIT, "Poll limit exceeded",
                        "Job " + jobId + " still " + snap.status().wireName() + " after " + polls + " polls", 504);
                withJobContext(jobId, OP_POLL, () -> {
                    store.load(jobId).ifPresent(m -> {
                        m.addProblems(List.of(problem));
                        store.save(m);
                    });
                    return null;
                });
                throw new ProblemException(problem);
            }
            long delay = settings.watchDelay(polls - 1);
            log.debug("Job {} is {}, next poll in {} ms", jobId, snap.status().wireName(), delay);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return snap;
            }
        }
    }

    PollSnapshot pollOnce(String jobId, int pollNumber) {
        return withJobContext(jobId, OP_POLL, () -> {
            JobManifest manifest = loadOrCreate(jobId);

            PollResponse resp;
            try {
                resp = retry.withRetry("poll", () -> client.poll(jobId));
            } catch (RemoteCallException e) {
                Problem problem = remoteProblem("Batch poll failed", e);
                manifest.addProblems(List.of(problem));
                store.save(manifest);
                throw new ProblemException(problem, e);
            }

            boolean appended = manifest.recordStatus(clock.instant(), resp.status(), resp.completed(), resp.total());
            if (appended) {
                if (!resp.errors().isEmpty()) {
                    manifest.addProblems(resp.errors().stream().map(this::toProblem).toList());
                }
                store.save(manifest);
                log.info("Job {} is now {} ({}/{})", jobId, resp.status().wireName(), resp.completed(), resp.total());
            }
            return new PollSnapshot(jobId, resp.status(), resp.completed(), resp.total(), pollNumber, appended);
        });
    }

    // ------------------------------------------------------------------
    // fetch
    // ------------------------------------------------------------------

    /**
     * Download results into {@code outDir} once the job is finished.
     *
     * Per-item failures become Problems in the result; the fetch itself
     * still succeeds. A job still pending/running yields a not-ready result.
     */
    public FetchResult fetch(String jobId, Path outDir) {
        PollSnapshot snap = pollOnce(jobId, 1);
        if (!snap.status().isTerminal()) {
            log.info("Job {} is still {}; nothing to fetch yet", jobId, snap.status().wireName());
            return FetchResult.notReady(jobId, snap.status());
        }

        return timed(OP_FETCH, () -> withJobContext(jobId, OP_FETCH, () -> {
            JobManifest manifest = loadOrCreate(jobId);
            ResultsResponse resp;
            try {
                resp = retry.withRetry("fetch", () -> client.results(jobId));
            } catch (RemoteCallException e) {
                Problem problem = remoteProblem("Batch fetch failed", e);
                manifest.addProblems(List.of(problem));
                store.save(manifest);
                ledger.recordProblem(OP_FETCH, jobId, problem, Map.of("jobId", jobId));
                throw new ProblemException(problem, e);
            }

            List<byte[]> styleRefs = loadStyleRefs(manifest);
            List<SavedImage> saved   = new ArrayList<>();
            List<Problem>    problems = new ArrayList<>();

            for (ResultItem item : resp.results()) {
                try {
                    SavedImage image = saveItem(item, outDir, styleRefs);
                    saved.add(image);
                    ledger.recordSuccess(OP_FETCH, jobId, image.path().toString(),
                            Map.of("prompt", item.prompt() == null ? "" : item.prompt(), "jobId", jobId));
                } catch (ProblemException e) {
                    problems.add(e.problem());
                    ledger.recordProblem(OP_FETCH, jobId, e.problem(), Map.of("jobId", jobId));
                }
            }
            for (JsonNode remote : resp.problems()) {
                Problem p = toProblem(remote);
                problems.add(p);
                ledger.recordProblem(OP_FETCH, jobId, p, Map.of("jobId", jobId));
            }

            manifest.addProblems(problems);
            manifest.setLastFetch(new JobManifest.FetchSummary(clock.instant(), saved.size(), problems.size()));
            store.save(manifest);

            meterRegistry.counter("nn.batch.fetch.items", "status", "saved").increment(saved.size());
            meterRegistry.counter("nn.batch.fetch.items", "status", "failed").increment(problems.size());
            log.info("Fetched job {}: {} saved, {} problems, into {}", jobId, saved.size(), problems.size(), outDir);
            return new FetchResult(jobId, snap.status(), true, saved, problems);
        }));
    }

    private SavedImage saveItem(ResultItem item, Path outDir, List<byte[]> styleRefs) {
        String id = item.id();
        if (id == null || !JobManifestStore.SAFE_ID.matcher(id).matches()) {
            throw itemProblem(ProblemTypes.BATCH_ITEM_INVALID_ID, "Invalid item id",
                    "Result id '" + id + "' is not a safe file name", 400);
        }
        String url = item.outUrl();
        if (url == null || url.isBlank()) {
            throw itemProblem(ProblemTypes.BATCH_ITEM_MISSING, "Missing image",
                    "Result " + id + " has no image payload", 404);
        }
        if (!url.startsWith("data:")) {
            throw itemProblem(ProblemTypes.BATCH_ITEM_REMOTE_URL, "Remote image URLs not supported",
                    "Result " + id + " points at a remote URL; only data: URLs are supported", 501);
        }

        byte[] bytes;
        try {
            int comma = url.indexOf(',');
            bytes = Base64.getDecoder().decode(url.substring(comma + 1));
        } catch (IllegalArgumentException e) {
            throw itemProblem(ProblemTypes.BATCH_ITEM_FAILED, "Invalid image payload",
                    "Result " + id + " is not valid base64: " + e.getMessage(), 502);
        }

        if (!styleRefs.isEmpty() && !styleGuard.passesStyleGuard(bytes, styleRefs)) {
            meterRegistry.counter("nn.batch.style_rejections").increment();
            throw itemProblem(ProblemTypes.STYLE_GUARD_REJECTED, "Style copy detected",
                    "Result " + id + " is too similar to a style reference", 422);
        }

        Path target = outDir.resolve(id + ".png");
        try {
            AtomicFiles.write(target, bytes);
        } catch (IOException e) {
            throw itemProblem(ProblemTypes.BATCH_ITEM_FAILED, "Write failed",
                    "Could not write " + target + ": " + e.getMessage(), 500);
        }
        log.debug("Saved {} ({} bytes)", target, bytes.length);
        return new SavedImage(id, item.prompt(), target);
    }

    private List<byte[]> loadStyleRefs(JobManifest manifest) {
        if (!settings.styleGuardEnabled() || manifest.getStyleRefs().isEmpty()) {
            return List.of();
        }
        List<byte[]> refs = styleGuard.loadReferences(manifest.getStyleRefs().stream().map(Path::of).toList());
        if (refs.isEmpty()) {
            log.warn("None of the {} style references for job {} are readable; skipping style guard",
                    manifest.getStyleRefs().size(), manifest.getJobId());
        }
        return refs;
    }

    // ------------------------------------------------------------------
    // cancel / resume
    // ------------------------------------------------------------------

    /**
     * Ask the relay to cancel. A local manifest that is not already in a
     * terminal state gets a {@code canceled} entry. Calling twice is harmless.
     */
    public CancelResult cancel(String jobId) {
        return withJobContext(jobId, OP_CANCEL, () -> {
            CancelResponse resp;
            try {
                resp = retry.withRetry("cancel", () -> client.cancel(jobId));
            } catch (RemoteCallException e) {
                Problem problem = remoteProblem("Batch cancel failed", e);
                ledger.recordProblem(OP_CANCEL, jobId, problem, Map.of());
                throw new ProblemException(problem, e);
            }

            boolean updated = false;
            JobManifest manifest = store.load(jobId).orElse(null);
            if (manifest != null && manifest.currentStatus().map(s -> !s.isTerminal()).orElse(true)) {
                updated = manifest.recordStatus(clock.instant(), JobStatus.CANCELED, null, null);
                if (updated) store.save(manifest);
            }
            ledger.recordSuccess(OP_CANCEL, jobId, resp.status(), Map.of("manifestUpdated", updated));
            log.info("Cancel {}: relay says {}, manifest {}", jobId, resp.status(), updated ? "updated" : "unchanged");
            return new CancelResult(jobId, resp.status(), updated);
        });
    }

    /** Poll once; fetch if the job succeeded, otherwise say how to wait for it. */
    public ResumeResult resume(String jobId, Path outDir) {
        PollSnapshot snap = pollOnce(jobId, 1);
        if (snap.status() == JobStatus.SUCCEEDED) {
            return new ResumeResult(jobId, snap.status(), fetch(jobId, outDir), null);
        }
        String hint = snap.status().isTerminal()
                ? "Job ended as " + snap.status().wireName() + "; check the manifest problems"
                : "Job is " + snap.status().wireName() + "; poll with watch enabled to wait for completion";
        return new ResumeResult(jobId, snap.status(), null, hint);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private JobManifest loadOrCreate(String jobId) {
        return store.load(jobId).orElseGet(() -> {
            log.warn("No manifest for job {}; creating a minimal one", jobId);
            JobManifest m = new JobManifest(jobId, ProviderName.BATCH.manifestName(), clock.instant(), 0);
            store.save(m);
            return m;
        });
    }

    /**
     * @throws ProblemException 400 when variants is outside 1..3, rows is empty,
     *         or a prompt is blank or too long
     */
    public static void validate(List<PromptRow> rows, int variants) {
        if (variants < 1 || variants > 3) {
            throw new ProblemException(Problem.of(ProblemTypes.REQUEST_INVALID, "Invalid variants",
                    "variants must be 1, 2 or 3, got " + variants, 400));
        }
        if (rows.isEmpty()) {
            throw new ProblemException(Problem.of(ProblemTypes.REQUEST_INVALID, "No prompts",
                    "At least one prompt row is required", 400));
        }
        for (int i = 0; i < rows.size(); i++) {
            if (!rows.get(i).isValid()) {
                throw new ProblemException(Problem.of(ProblemTypes.PROMPT_INVALID, "Invalid prompt",
                        "Row " + i + ": prompt must be 1.." + PromptRow.MAX_PROMPT_LENGTH + " characters", 400));
            }
        }
    }

    /** Remote error as a Problem; transport failures and odd statuses map to 502. */
    private static Problem remoteProblem(String title, RemoteCallException e) {
        int status = e.statusCode() >= 400 && e.statusCode() <= 599 ? e.statusCode() : 502;
        return Problem.of(ProblemTypes.BATCH_REMOTE_ERROR, title, e.getMessage(), status);
    }

    private Problem toProblem(JsonNode node) {
        int status = node.path("status").asInt(502);
        if (status < 400 || status > 599) status = 502;
        String title = node.path("title").asText("Remote batch error");
        String detail = node.has("detail") ? node.path("detail").asText() : node.toString();
        String type = node.path("type").asText(ProblemTypes.BATCH_ITEM_FAILED);
        return Problem.of(type, title, detail, status);
    }

    private static ProblemException itemProblem(String type, String title, String detail, int status) {
        return new ProblemException(Problem.of(type, title, detail, status));
    }

    private <T> T timed(String operation, Supplier<T> body) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return body.get();
        } catch (RuntimeException e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("nn.batch.operation.duration",
                    "operation", operation, "status", status));
        }
    }

    /** Runs {@code body} with jobId/operation in the MDC, restoring the previous values. */
    private static <T> T withJobContext(String jobId, String operation, Supplier<T> body) {
        String prevJob = MDC.get("jobId");
        String prevOp  = MDC.get("operation");
        MDC.put("jobId", jobId);
        MDC.put("operation", operation);
        try {
            return body.get();
        } finally {
            restore("jobId", prevJob);
            restore("operation", prevOp);
        }
    }

    private static void restore(String key, String value) {
        if (value == null) MDC.remove(key);
        else MDC.put(key, value);
    }
}
