package com.nnstudio.orchestrator.preflight;

import com.nnstudio.orchestrator.model.PromptRow;
import com.nnstudio.orchestrator.model.ReferencePack;
import com.nnstudio.orchestrator.problem.Problem;
import com.nnstudio.orchestrator.problem.ProblemTypes;
import com.nnstudio.orchestrator.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Preflight pass over a job's reference images.
 *
 * <ol>
 *   <li>Hash every referenced file and keep one entry per distinct content.</li>
 *   <li>Optionally re-encode each distinct image smaller (see {@link ImageCompressor}).</li>
 *   <li>Check image, item and job budgets; decide how many chunks the job needs.</li>
 * </ol>
 *
 * Nothing here talks to the network.
 */
@Service
public class ReferenceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ReferenceRegistry.class);

    // Files hashed/compressed concurrently per preflight call.
    static final int POOL_SIZE = 5;

    /** Fixed per-item request overhead on top of prompt and references. */
    static final long ITEM_OVERHEAD_BYTES = 1024;

    private final ImageCompressor compressor;

    public ReferenceRegistry(ImageCompressor compressor) {
        this.compressor = compressor;
    }

    /**
     * Never throws: unexpected failures come back as a rejected result
     * with a 500 {@code preflight/error} problem.
     */
    public PreflightResult preflight(List<PromptRow> rows, ReferencePack pack, PreflightBudgets budgets) {
        if (pack == null) {
            return PreflightResult.accepted(1, RefRegistry.empty());
        }
        try {
            RefRegistry registry = buildRegistry(pack.allPaths(), budgets.compress());

            if (registry.uniqueCount() > budgets.maxRefsPerItem()) {
                log.warn("Reference pack has {} unique images, above the per-item limit of {}",
                        registry.uniqueCount(), budgets.maxRefsPerItem());
            }

            BudgetDecision decision = checkBudgets(rows, registry, budgets);
            if (!decision.problems().isEmpty()) {
                return PreflightResult.rejected(decision.problems(), registry);
            }
            log.info("Preflight ok: {} unique refs, {} -> {} bytes, {} chunk(s)",
                    registry.uniqueCount(), registry.totalSize(), registry.compressedSize(), decision.chunks());
            return PreflightResult.accepted(decision.chunks(), registry);

        } catch (Exception e) {
            log.error("Preflight failed: {}", e.getMessage(), e);
            return PreflightResult.rejected(
                    List.of(Problem.of(ProblemTypes.PREFLIGHT_ERROR, "Preflight failed", e.getMessage(), 500)),
                    RefRegistry.empty());
        }
    }

    // ------------------------------------------------------------------
    // Registry
    // ------------------------------------------------------------------

    /**
     * Hash and (optionally) compress each path. Paths whose content was
     * already claimed by another task are skipped, so each hash is
     * registered exactly once even when duplicates are processed together.
     */
    RefRegistry buildRegistry(List<String> paths, boolean compress) throws IOException, InterruptedException {
        Map<String, RefRegistryEntry> claimed = new ConcurrentHashMap<>();
        Map<String, Integer> order = new ConcurrentHashMap<>();
        AtomicLong totalSize      = new AtomicLong();
        AtomicLong compressedSize = new AtomicLong();

        List<Callable<Void>> tasks = new ArrayList<>();
        for (int i = 0; i < paths.size(); i++) {
            int index = i;
            String path = paths.get(i);
            tasks.add(() -> {
                Path file = Path.of(path);
                String hash = Hashing.sha256Hex(file);
                long size = Files.size(file);
                RefRegistryEntry placeholder = new RefRegistryEntry(
                        RefRegistryEntry.idFor(hash), hash, path, size, false, null,
                        RefRegistryEntry.mimeTypeFor(path));
                if (claimed.putIfAbsent(hash, placeholder) != null) {
                    return null;   // duplicate content
                }
                order.put(hash, index);

                RefRegistryEntry entry = compress ? compressEntry(placeholder, file) : placeholder;
                claimed.put(hash, entry);
                totalSize.addAndGet(size);
                compressedSize.addAndGet(entry.effectiveSize());
                return null;
            });
        }

        ExecutorService pool = Executors.newFixedThreadPool(POOL_SIZE);
        try {
            for (Future<Void> f : pool.invokeAll(tasks)) {
                f.get();
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) throw io;
            if (cause instanceof RuntimeException re) throw re;
            throw new IOException(cause);
        } finally {
            pool.shutdownNow();
        }

        // Insertion order follows first appearance in the pack.
        Map<String, RefRegistryEntry> ordered = new LinkedHashMap<>();
        order.entrySet().stream()
                .sorted(Map.Entry.comparingByValue())
                .forEach(e -> ordered.put(e.getKey(), claimed.get(e.getKey())));
        return new RefRegistry(ordered, totalSize.get(), compressedSize.get());
    }

    private RefRegistryEntry compressEntry(RefRegistryEntry entry, Path file) {
        if (!ImageCompressor.isCompressible(file)) {
            return entry;
        }
        try {
            byte[] out = compressor.compress(file);
            log.debug("Compressed {}: {} -> {} bytes ({}%)", file.getFileName(), entry.size(), out.length,
                    entry.size() == 0 ? 100 : Math.round(out.length * 100.0 / entry.size()));
            return new RefRegistryEntry(entry.id(), entry.hash(), entry.path(), entry.size(),
                    true, (long) out.length, entry.mimeType());
        } catch (IOException e) {
            log.warn("Could not compress {}, keeping original size: {}", file, e.getMessage());
            return entry;
        }
    }

    // ------------------------------------------------------------------
    // Budgets
    // ------------------------------------------------------------------

    record BudgetDecision(int chunks, List<Problem> problems) {}

    BudgetDecision checkBudgets(List<PromptRow> rows, RefRegistry registry, PreflightBudgets budgets) {
        int imageChunks = 1;
        long totalImages = (long) rows.size() * PreflightBudgets.IMAGES_PER_ROW;
        if (totalImages > budgets.maxImagesPerJob()) {
            if (!budgets.split()) {
                return reject(ProblemTypes.PREFLIGHT_BUDGET_EXCEEDED, "Budget exceeded",
                        "Total images (" + totalImages + ") exceeds limit (" + budgets.maxImagesPerJob() + ")");
            }
            imageChunks = (int) ceilDiv(totalImages, budgets.maxImagesPerJob());
        }

        long refBytesPerItem = registry.uniqueCount() * registry.averageCompressedSize();
        long largestItem = rows.stream()
                .mapToLong(r -> r.prompt().getBytes(StandardCharsets.UTF_8).length + ITEM_OVERHEAD_BYTES + refBytesPerItem)
                .max()
                .orElse(0);
        if (largestItem > budgets.itemMaxBytes()) {
            return reject(ProblemTypes.PREFLIGHT_ITEM_TOO_LARGE, "Item too large",
                    "Largest item (" + largestItem + " bytes) exceeds limit (" + budgets.itemMaxBytes() + " bytes)");
        }

        long totalJobSize = rows.size() * registry.averageCompressedSize() + registry.compressedSize();
        int byteChunks = 1;
        if (totalJobSize > budgets.jobMaxBytes()) {
            if (!budgets.split()) {
                return reject(ProblemTypes.PREFLIGHT_JOB_TOO_LARGE, "Job too large",
                        "Job size (" + totalJobSize + " bytes) exceeds limit (" + budgets.jobMaxBytes() + " bytes)");
            }
            byteChunks = (int) ceilDiv(totalJobSize, budgets.jobMaxBytes());
            log.info("Job of {} bytes will be split into {} chunks", totalJobSize, byteChunks);
        }
        return new BudgetDecision(Math.max(imageChunks, byteChunks), List.of());
    }

    private static BudgetDecision reject(String type, String title, String detail) {
        return new BudgetDecision(0, List.of(Problem.of(type, title, detail, 413)));
    }

    private static long ceilDiv(long a, long b) {
        return (a + b - 1) / b;
    }
}
