package com.nnstudio.orchestrator.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nnstudio.orchestrator.model.LedgerEntry;
import com.nnstudio.orchestrator.problem.Problem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only JSON-lines record of every operation ({@code {outDir}/manifest.jsonl}).
 */
@Component
public class OperationsLedger {

    private static final Logger log = LoggerFactory.getLogger(OperationsLedger.class);

    private final Path         file;
    private final ObjectMapper json;
    private final Clock        clock;

    public OperationsLedger(Path file, ObjectMapper objectMapper, Clock clock) {
        this.file  = file;
        this.json  = objectMapper;
        this.clock = clock;
    }

    @Autowired
    public OperationsLedger(@Value("${nn.out-dir}") String outDir, ObjectMapper objectMapper, Clock clock) {
        this(Path.of(outDir).resolve("manifest.jsonl"), objectMapper, clock);
    }

    public LedgerEntry recordSuccess(String operation, String input, String output, Map<String, Object> metadata) {
        return append(new LedgerEntry(UUID.randomUUID().toString(), clock.instant(), operation,
                input, output, LedgerEntry.SUCCESS, metadata));
    }

    public LedgerEntry recordProblem(String operation, String input, Problem problem, Map<String, Object> metadata) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata == null ? Map.of() : metadata);
        meta.put("problem", problem);
        return append(new LedgerEntry(problem.instance(), clock.instant(), operation, input,
                problem.detail() != null ? problem.detail() : problem.title(), LedgerEntry.FAILED, meta));
    }

    public synchronized LedgerEntry append(LedgerEntry entry) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String line = json.writeValueAsString(entry) + "\n";
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            return entry;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Ledger entry not serializable", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not append to ledger " + file, e);
        }
    }

    /** All entries in file order; malformed lines are skipped with a warning. */
    public synchronized List<LedgerEntry> readAll() {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<LedgerEntry> entries = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (line.isBlank()) continue;
                try {
                    entries.add(json.readValue(line, LedgerEntry.class));
                } catch (JsonProcessingException e) {
                    log.warn("Skipping malformed ledger line in {}: {}", file, e.getOriginalMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read ledger " + file, e);
        }
        return entries;
    }

    public Path file() { return file; }
}
