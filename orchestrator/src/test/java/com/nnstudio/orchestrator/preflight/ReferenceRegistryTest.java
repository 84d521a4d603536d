package com.nnstudio.orchestrator.preflight;

import com.nnstudio.orchestrator.model.PromptRow;
import com.nnstudio.orchestrator.model.ReferencePack;
import com.nnstudio.orchestrator.problem.Problem;
import com.nnstudio.orchestrator.problem.ProblemTypes;
import com.nnstudio.orchestrator.support.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the preflight pass: dedup, compression, budgets, chunking.
 * Reference images are generated into a temp directory.
 */
class ReferenceRegistryTest {

    @TempDir Path dir;

    ReferenceRegistry registry;
    Path a, aCopy, b;

    @BeforeEach
    void setUp() {
        registry = new ReferenceRegistry(new ImageCompressor());
        a     = TestImages.write(dir.resolve("a.png"),      TestImages.splitVertical(64));
        aCopy = TestImages.write(dir.resolve("a-copy.png"), TestImages.splitVertical(64));
        b     = TestImages.write(dir.resolve("b.png"),      TestImages.splitHorizontal(64));
    }

    // ------------------------------------------------------------------
    // Dedup
    // ------------------------------------------------------------------

    @Test
    void preflight_duplicateContent_registeredOnce() throws Exception {
        ReferencePack pack = ReferencePack.ofStyle(List.of(a.toString(), aCopy.toString(), b.toString(), a.toString()));

        PreflightResult result = registry.preflight(rows(2), pack, budgets(false, true));

        assertThat(result.ok()).isTrue();
        assertThat(result.uniqueRefs()).isEqualTo(2);
        assertThat(result.registry().entries()).hasSize(2);
        assertThat(result.bytes().before()).isEqualTo(Files.size(a) + Files.size(b));
        assertThat(result.registry().entries().values())
                .allSatisfy(e -> {
                    assertThat(e.id()).isEqualTo("ref_" + e.hash().substring(0, 12));
                    assertThat(e.mimeType()).isEqualTo("image/png");
                });
        // first appearance wins the path
        assertThat(result.registry().entries().values().iterator().next().path()).isEqualTo(a.toString());
    }

    @Test
    void preflight_manyCopiesProcessedConcurrently_stillOneEntryPerHash() {
        List<String> paths = Collections.nCopies(25, a.toString());

        PreflightResult result = registry.preflight(rows(1), ReferencePack.ofStyle(paths), budgets(false, true));

        assertThat(result.uniqueRefs()).isEqualTo(1);
    }

    @Test
    void preflight_noPack_isSingleChunkWithNoRefs() {
        PreflightResult result = registry.preflight(rows(3), null, PreflightBudgets.defaults());

        assertThat(result.ok()).isTrue();
        assertThat(result.chunks()).isEqualTo(1);
        assertThat(result.uniqueRefs()).isZero();
        assertThat(result.bytes().before()).isZero();
    }

    // ------------------------------------------------------------------
    // Compression
    // ------------------------------------------------------------------

    @Test
    void preflight_compressEnabled_recordsCompressedSize() {
        Path big = TestImages.write(dir.resolve("big.png"), TestImages.splitVertical(1600));

        PreflightResult result = registry.preflight(rows(1), ReferencePack.ofStyle(List.of(big.toString())),
                budgets(true, true));

        RefRegistryEntry entry = result.registry().entries().values().iterator().next();
        assertThat(entry.compressed()).isTrue();
        assertThat(entry.compressedSize()).isPositive();
        assertThat(result.bytes().after()).isEqualTo(entry.compressedSize());
    }

    @Test
    void preflight_undecodableImage_keepsOriginalSize() throws Exception {
        Path webp = Files.write(dir.resolve("odd.webp"), new byte[]{1, 2, 3, 4, 5, 6, 7, 8});

        PreflightResult result = registry.preflight(rows(1), ReferencePack.ofStyle(List.of(webp.toString())),
                budgets(true, true));

        assertThat(result.ok()).isTrue();
        RefRegistryEntry entry = result.registry().entries().values().iterator().next();
        assertThat(entry.compressed()).isFalse();
        assertThat(result.bytes().after()).isEqualTo(8);
        assertThat(entry.mimeType()).isEqualTo("image/jpeg");
    }

    // ------------------------------------------------------------------
    // Budgets
    // ------------------------------------------------------------------

    @Test
    void preflight_tooManyImagesWithoutSplit_rejected413() {
        PreflightBudgets tight = new PreflightBudgets(PreflightBudgets.MIB * 200, PreflightBudgets.MIB * 8,
                8, 20, false, false);

        PreflightResult result = registry.preflight(rows(10), ReferencePack.ofStyle(List.of(a.toString())), tight);

        assertRejected(result, ProblemTypes.PREFLIGHT_BUDGET_EXCEEDED);
    }

    @Test
    void preflight_tooManyImagesWithSplit_chunksByImageCount() {
        PreflightBudgets tight = new PreflightBudgets(PreflightBudgets.MIB * 200, PreflightBudgets.MIB * 8,
                8, 20, false, true);

        PreflightResult result = registry.preflight(rows(10), ReferencePack.ofStyle(List.of(a.toString())), tight);

        // 30 images / 20 per job
        assertThat(result.ok()).isTrue();
        assertThat(result.chunks()).isEqualTo(2);
    }

    @Test
    void preflight_itemLargerThanItemBudget_rejectedEvenWithSplit() throws Exception {
        long refs = Files.size(a) + Files.size(b);
        PreflightBudgets tight = new PreflightBudgets(PreflightBudgets.MIB * 200, refs + 100,
                8, 2000, false, true);

        PreflightResult result = registry.preflight(rows(1),
                ReferencePack.ofStyle(List.of(a.toString(), b.toString())), tight);

        assertRejected(result, ProblemTypes.PREFLIGHT_ITEM_TOO_LARGE);
    }

    @Test
    void preflight_jobLargerThanJobBudgetWithSplit_computesChunks() throws Exception {
        long total = Files.size(a) + Files.size(b);
        long jobSize = 4 * (total / 2) + total;
        long jobMax = jobSize / 3 + 1;   // forces exactly 3 chunks
        PreflightBudgets budgets = new PreflightBudgets(jobMax, PreflightBudgets.MIB * 8, 8, 2000, false, true);

        PreflightResult result = registry.preflight(rows(4),
                ReferencePack.ofStyle(List.of(a.toString(), b.toString())), budgets);

        assertThat(result.ok()).isTrue();
        assertThat(result.chunks()).isEqualTo((int) ((jobSize + jobMax - 1) / jobMax)).isEqualTo(3);
    }

    @Test
    void preflight_jobLargerThanJobBudgetWithoutSplit_rejected413() {
        PreflightBudgets budgets = new PreflightBudgets(100, PreflightBudgets.MIB * 8, 8, 2000, false, false);

        PreflightResult result = registry.preflight(rows(4),
                ReferencePack.ofStyle(List.of(a.toString(), b.toString())), budgets);

        assertRejected(result, ProblemTypes.PREFLIGHT_JOB_TOO_LARGE);
    }

    @Test
    void preflight_compressedJob_sizedByCompressedReferences() throws Exception {
        Path noisy = TestImages.write(dir.resolve("noisy.png"), TestImages.noise(1600, 7));
        ReferencePack pack = ReferencePack.ofStyle(List.of(noisy.toString()));
        long compressed = registry.preflight(rows(1), pack, budgets(true, true)).bytes().after();
        assertThat(compressed).isLessThan(Files.size(noisy) / 4);

        // 10 rows + the registry itself = 11 compressed refs; just fits
        PreflightBudgets budgets = new PreflightBudgets(11 * compressed + 1, PreflightBudgets.MIB * 8,
                8, 2000, true, false);

        PreflightResult result = registry.preflight(rows(10), pack, budgets);

        assertThat(result.ok()).isTrue();
        assertThat(result.chunks()).isEqualTo(1);
        assertThat(result.problems()).isEmpty();
    }

    @Test
    void preflight_compressedJobWithSplit_chunksByCompressedSize() throws Exception {
        Path noisy = TestImages.write(dir.resolve("noisy.png"), TestImages.noise(1600, 7));
        ReferencePack pack = ReferencePack.ofStyle(List.of(noisy.toString()));
        long compressed = registry.preflight(rows(1), pack, budgets(true, true)).bytes().after();

        PreflightBudgets budgets = new PreflightBudgets(6 * compressed, PreflightBudgets.MIB * 8,
                8, 2000, true, true);

        PreflightResult result = registry.preflight(rows(10), pack, budgets);

        assertThat(result.ok()).isTrue();
        assertThat(result.chunks()).isEqualTo(2);
    }

    @Test
    void preflight_missingReference_rejectedWith500() {
        PreflightResult result = registry.preflight(rows(1),
                ReferencePack.ofStyle(List.of(dir.resolve("missing.png").toString())), PreflightBudgets.defaults());

        assertThat(result.ok()).isFalse();
        assertThat(result.chunks()).isZero();
        assertThat(result.problems()).singleElement()
                .satisfies(p -> {
                    assertThat(p.type()).isEqualTo(ProblemTypes.PREFLIGHT_ERROR);
                    assertThat(p.status()).isEqualTo(500);
                });
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<PromptRow> rows(int n) {
        return IntStream.range(0, n).mapToObj(i -> PromptRow.of("prompt " + i)).toList();
    }

    private static PreflightBudgets budgets(boolean compress, boolean split) {
        return PreflightBudgets.defaults().withOverrides(compress, split);
    }

    private static void assertRejected(PreflightResult result, String type) {
        assertThat(result.ok()).isFalse();
        assertThat(result.chunks()).isZero();
        assertThat(result.problems()).extracting(Problem::type).containsExactly(type);
        assertThat(result.problems()).extracting(Problem::status).containsExactly(413);
    }
}
