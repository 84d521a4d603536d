package com.nnstudio.orchestrator.probe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Read side of the publisher probe snapshot.
 *
 * Fail-open: no snapshot, an unreadable snapshot, or a model missing from
 * the snapshot all count as healthy. Only an explicit degraded/error entry
 * marks a model unhealthy, and it stays so until the file is rewritten.
 * The file is re-read whenever its modification time changes.
 */
@Component
public class PublisherHealthCache {

    private static final Logger log = LoggerFactory.getLogger(PublisherHealthCache.class);

    public static final Duration STALE_AFTER = Duration.ofHours(24);

    private final Path         snapshotFile;
    private final ObjectMapper json;
    private final Clock        clock;

    private ProbeSnapshot cached;
    private FileTime      cachedMtime;

    public PublisherHealthCache(Path snapshotFile, ObjectMapper objectMapper, Clock clock) {
        this.snapshotFile = snapshotFile;
        this.json         = objectMapper;
        this.clock        = clock;
    }

    @Autowired
    public PublisherHealthCache(@Value("${nn.out-dir}") String outDir, ObjectMapper objectMapper, Clock clock) {
        this(Path.of(outDir).resolve("artifacts").resolve("probe").resolve("publishers.json"), objectMapper, clock);
    }

    public synchronized ModelHealth check(String model) {
        ProbeSnapshot snapshot = currentSnapshot();
        if (snapshot == null) {
            return ModelHealth.assumedHealthy();
        }
        if (snapshot.timestamp() != null && isStale(snapshot.timestamp(), clock.instant())) {
            log.warn("Probe snapshot {} is older than {}h; consider re-running the probe",
                    snapshotFile, STALE_AFTER.toHours());
        }
        return snapshot.find(model)
                .map(ModelHealth::from)
                .orElseGet(ModelHealth::assumedHealthy);
    }

    public Path snapshotFile() { return snapshotFile; }

    /** Drops the in-memory copy; the next check re-reads the file. */
    public synchronized void invalidate() {
        cached      = null;
        cachedMtime = null;
    }

    private ProbeSnapshot currentSnapshot() {
        try {
            FileTime mtime = Files.getLastModifiedTime(snapshotFile);
            if (cached != null && mtime.equals(cachedMtime)) {
                return cached;
            }
            cached      = json.readValue(snapshotFile.toFile(), ProbeSnapshot.class);
            cachedMtime = mtime;
            log.debug("Loaded probe snapshot {} taken at {}", snapshotFile, cached.timestamp());
            return cached;
        } catch (NoSuchFileException e) {
            invalidate();
            return null;
        } catch (IOException e) {
            log.warn("Probe snapshot {} unreadable, assuming healthy: {}", snapshotFile, e.getMessage());
            invalidate();
            return null;
        }
    }

    static boolean isStale(Instant taken, Instant now) {
        return Duration.between(taken, now).compareTo(STALE_AFTER) > 0;
    }
}
