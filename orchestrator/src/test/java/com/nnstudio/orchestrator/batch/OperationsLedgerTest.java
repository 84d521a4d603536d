package com.nnstudio.orchestrator.batch;

import com.nnstudio.orchestrator.model.LedgerEntry;
import com.nnstudio.orchestrator.problem.Problem;
import com.nnstudio.orchestrator.support.MutableClock;
import com.nnstudio.orchestrator.support.TestJson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OperationsLedgerTest {

    @TempDir Path dir;

    MutableClock clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));

    @Test
    void append_oneLinePerEntry_inOrder() throws Exception {
        OperationsLedger ledger = new OperationsLedger(dir.resolve("nested/manifest.jsonl"), TestJson.mapper(), clock);

        ledger.recordSuccess("batch-submit", "rows=2", "job-1", Map.of("estCount", 2));
        ledger.recordSuccess("batch-fetch", "job-1", "/out/a.png", Map.of());

        assertThat(Files.readAllLines(ledger.file())).hasSize(2);
        assertThat(ledger.readAll()).extracting(LedgerEntry::operation)
                .containsExactly("batch-submit", "batch-fetch");
    }

    @Test
    void recordProblem_usesProblemInstanceAsId() {
        OperationsLedger ledger = new OperationsLedger(dir.resolve("manifest.jsonl"), TestJson.mapper(), clock);
        Problem problem = Problem.of("batch/item-missing-image", "Missing image", "no payload", 404);

        LedgerEntry entry = ledger.recordProblem("batch-fetch", "job-1", problem, Map.of("jobId", "job-1"));

        assertThat(entry.id()).isEqualTo(problem.instance());
        assertThat(entry.status()).isEqualTo(LedgerEntry.FAILED);
        assertThat(entry.output()).isEqualTo("no payload");
        assertThat(entry.metadata()).containsEntry("jobId", "job-1").containsKey("problem");
        assertThat(ledger.readAll()).singleElement().satisfies(e -> {
            assertThat(e.timestamp()).isEqualTo(clock.instant());
            assertThat(e.metadata().get("problem")).isInstanceOf(Map.class);
        });
    }

    @Test
    void readAll_skipsMalformedLines() throws Exception {
        OperationsLedger ledger = new OperationsLedger(dir.resolve("manifest.jsonl"), TestJson.mapper(), clock);
        ledger.recordSuccess("render", "1", "out", Map.of());
        Files.writeString(ledger.file(), "{ broken\n\n", StandardOpenOption.APPEND);
        ledger.recordSuccess("render", "2", "out", Map.of());

        assertThat(ledger.readAll()).extracting(LedgerEntry::input).containsExactly("1", "2");
    }

    @Test
    void readAll_noFile_empty() {
        assertThat(new OperationsLedger(dir.resolve("none.jsonl"), TestJson.mapper(), clock).readAll()).isEmpty();
    }
}
