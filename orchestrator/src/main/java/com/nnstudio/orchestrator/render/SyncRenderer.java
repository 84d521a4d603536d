package com.nnstudio.orchestrator.render;

import com.nnstudio.orchestrator.client.ImageGenerationClient;
import com.nnstudio.orchestrator.client.RemoteCallException;
import com.nnstudio.orchestrator.model.PromptRow;
import com.nnstudio.orchestrator.problem.Problem;
import com.nnstudio.orchestrator.problem.ProblemTypes;
import com.nnstudio.orchestrator.retry.RetryPolicy;
import com.nnstudio.orchestrator.retry.Sleeper;
import com.nnstudio.orchestrator.styleguard.StyleGuard;
import com.nnstudio.orchestrator.util.AtomicFiles;
import com.nnstudio.orchestrator.util.CancellationToken;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * Renders prompt rows × variants through a synchronous client on a small
 * fixed pool.
 *
 * Each generation goes through {@link RetryPolicy}. When style references
 * are present every output is checked by {@link StyleGuard}; a rejected
 * output is regenerated up to {@code styleRetries} more times after a
 * random pause, then dropped. Style drops are counted separately from API
 * failures.
 */
@Service
public class SyncRenderer {

    private static final Logger log = LoggerFactory.getLogger(SyncRenderer.class);

    public static final int HARD_CONCURRENCY_CAP = 4;

    enum Outcome { SAVED, STYLE_REJECTED, FAILED, SKIPPED }

    private record WorkItem(String id, PromptRow row) {}

    private record ItemResult(Outcome outcome, RenderedImage image, Problem problem) {

        ItemResult(Outcome outcome, RenderedImage image) {
            this(outcome, image, null);
        }
    }

    private final RetryPolicy       retry;
    private final StyleGuard        styleGuard;
    private final RenderSettings    settings;
    private final Sleeper           sleeper;
    private final Clock             clock;
    private final MeterRegistry     meterRegistry;
    private final LongUnaryOperator jitter;

    @Autowired
    public SyncRenderer(RetryPolicy retry, StyleGuard styleGuard, RenderSettings settings,
                        Sleeper sleeper, Clock clock, MeterRegistry meterRegistry) {
        this(retry, styleGuard, settings, sleeper, clock, meterRegistry,
                bound -> bound <= 0 ? 0 : ThreadLocalRandom.current().nextLong(bound));
    }

    SyncRenderer(RetryPolicy retry, StyleGuard styleGuard, RenderSettings settings,
                 Sleeper sleeper, Clock clock, MeterRegistry meterRegistry, LongUnaryOperator jitter) {
        this.retry         = retry;
        this.styleGuard    = styleGuard;
        this.settings      = settings;
        this.sleeper       = sleeper;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
        this.jitter        = jitter;
    }

    /** min(configured cap, 4, ceil(total / 3)), at least 1. */
    public static int concurrencyFor(int totalImages, int configuredCap) {
        int byWorkload = (totalImages + 2) / 3;
        return Math.max(1, Math.min(Math.min(configuredCap, HARD_CONCURRENCY_CAP), byWorkload));
    }

    /**
     * Render every (row, variant) pair into {@code outDir}, blocking until all
     * items finished or were skipped after cancellation.
     *
     * @param concurrencyCap overrides the configured worker cap when non-null
     */
    public RenderResult render(ImageGenerationClient client, List<PromptRow> rows, int variants,
                               List<Path> styleRefs, Path outDir, Integer concurrencyCap,
                               CancellationToken token) {
        List<WorkItem> items = new ArrayList<>();
        long stamp = clock.millis();
        for (int i = 0; i < rows.size(); i++) {
            for (int v = 0; v < variants; v++) {
                items.add(new WorkItem(i + "-" + v + "-" + stamp, rows.get(i)));
            }
        }
        int concurrency = concurrencyFor(items.size(),
                concurrencyCap != null ? concurrencyCap : settings.maxConcurrency());
        List<byte[]> refBytes = settings.styleGuardEnabled() ? styleGuard.loadReferences(styleRefs) : List.of();
        if (!refBytes.isEmpty()) {
            styleGuard.flagCopyWording(rows);
        }
        log.info("Starting sync render: {} images, concurrency {}, {} style refs", items.size(), concurrency, refBytes.size());

        List<Callable<ItemResult>> tasks = items.stream()
                .<Callable<ItemResult>>map(item -> () -> process(client, item, styleRefs, refBytes, outDir, token))
                .toList();

        List<RenderedImage> saved    = new ArrayList<>();
        List<Problem>       problems = new ArrayList<>();
        int rejected = 0, failed = 0, skipped = 0;

        ExecutorService pool = Executors.newFixedThreadPool(concurrency);
        try {
            for (Future<ItemResult> f : pool.invokeAll(tasks)) {
                ItemResult r = f.get();
                switch (r.outcome()) {
                    case SAVED          -> saved.add(r.image());
                    case STYLE_REJECTED -> rejected++;
                    case FAILED         -> {
                        failed++;
                        problems.add(r.problem());
                    }
                    case SKIPPED        -> skipped++;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            log.warn("Render interrupted; remaining items cancelled");
        } catch (ExecutionException e) {
            // process() catches everything; reaching here is a bug
            throw new IllegalStateException("Render task failed unexpectedly", e.getCause());
        } finally {
            pool.shutdownNow();
        }

        log.info("Sync render complete: {}/{} saved, {} style-rejected, {} failed, {} skipped",
                saved.size(), items.size(), rejected, failed, skipped);
        return new RenderResult(saved, items.size(), rejected, failed, skipped, problems);
    }

    private ItemResult process(ImageGenerationClient client, WorkItem item, List<Path> styleRefs,
                               List<byte[]> refBytes, Path outDir, CancellationToken token) {
        if (token.isCancelled()) {
            return count(new ItemResult(Outcome.SKIPPED, null));
        }
        MDC.put("itemId", item.id());
        try {
            String prompt = item.row().prompt();
            byte[] image = retry.withRetry("generate-" + item.id(), () -> client.generate(prompt, styleRefs));

            if (!refBytes.isEmpty() && !styleGuard.passesStyleGuard(image, refBytes)) {
                log.warn("Style copy detected for {}, regenerating", item.id());
                image = regenerateUntilStyleSafe(client, item, styleRefs, refBytes, token);
                if (image == null) {
                    meterRegistry.counter("nn.render.style_rejections").increment();
                    log.error("Style validation failed for {} after {} retries; dropping item",
                            item.id(), settings.styleRetries());
                    return count(new ItemResult(Outcome.STYLE_REJECTED, null));
                }
            }

            Path target = outDir.resolve(item.id() + ".png");
            AtomicFiles.write(target, image);
            log.debug("Saved {} ({} bytes)", target, image.length);
            return count(new ItemResult(Outcome.SAVED, new RenderedImage(item.id(), prompt, target)));

        } catch (IOException e) {
            log.error("Could not save {}: {}", item.id(), e.getMessage());
            return count(failed(item, "Could not save image", 500, e));
        } catch (RemoteCallException e) {
            log.error("Generation failed for {}: {}", item.id(), e.getMessage());
            int status = e.statusCode() >= 400 && e.statusCode() <= 599 ? e.statusCode() : 502;
            return count(failed(item, "Generation failed", status, e));
        } catch (RuntimeException e) {
            log.error("Generation failed for {}: {}", item.id(), e.getMessage());
            return count(failed(item, "Generation failed", 500, e));
        } finally {
            MDC.remove("itemId");
        }
    }

    /** @return a style-safe image, or null when every extra attempt also copied a reference */
    private byte[] regenerateUntilStyleSafe(ImageGenerationClient client, WorkItem item, List<Path> styleRefs,
                                            List<byte[]> refBytes, CancellationToken token) {
        for (int attempt = 0; attempt < settings.styleRetries(); attempt++) {
            if (token.isCancelled()) {
                return null;
            }
            try {
                sleeper.sleep(jitter.applyAsLong(settings.styleRetryJitterMs()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
            byte[] candidate = retry.withRetry("generate-" + item.id(),
                    () -> client.generate(item.row().prompt(), styleRefs));
            if (styleGuard.passesStyleGuard(candidate, refBytes)) {
                return candidate;
            }
        }
        return null;
    }

    private static ItemResult failed(WorkItem item, String title, int status, Exception e) {
        Problem problem = Problem.of(ProblemTypes.RENDER_ITEM_FAILED, title, item.id() + ": " + e.getMessage(), status);
        return new ItemResult(Outcome.FAILED, null, problem);
    }

    private ItemResult count(ItemResult r) {
        meterRegistry.counter("nn.render.items", "outcome", r.outcome().name().toLowerCase(Locale.ROOT)).increment();
        return r;
    }
}
