package com.nnstudio.orchestrator.probe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nnstudio.orchestrator.support.MutableClock;
import com.nnstudio.orchestrator.support.TestJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PublisherHealthCacheTest {

    static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    @TempDir Path dir;

    ObjectMapper json = TestJson.mapper();
    MutableClock clock = new MutableClock(T0);
    Path file;
    PublisherHealthCache cache;

    @BeforeEach
    void setUp() {
        file  = dir.resolve("probe/publishers.json");
        cache = new PublisherHealthCache(file, json, clock);
    }

    @Test
    void check_noSnapshot_assumedHealthy() {
        ModelHealth health = cache.check("gemini-1.5-flash");

        assertThat(health.healthy()).isTrue();
        assertThat(health.status()).isNull();
        assertThat(health.http()).isNull();
    }

    @Test
    void check_degradedEntry_unhealthy() throws Exception {
        writeSnapshot(result("gemini-1.5-flash", ProbeStatus.DEGRADED, 404));

        ModelHealth health = cache.check("gemini-1.5-flash");

        assertThat(health.healthy()).isFalse();
        assertThat(health.status()).isEqualTo(ProbeStatus.DEGRADED);
        assertThat(health.http()).isEqualTo(404);
    }

    @Test
    void check_modelNotProbed_assumedHealthy() throws Exception {
        writeSnapshot(result("gemini-1.5-pro", ProbeStatus.ERROR, 500));

        assertThat(cache.check("gemini-1.5-flash").healthy()).isTrue();
    }

    @Test
    void check_corruptSnapshot_assumedHealthy() throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{ not json");

        assertThat(cache.check("gemini-1.5-flash").healthy()).isTrue();
    }

    @Test
    void check_staleSnapshot_stillUsed() throws Exception {
        writeSnapshot(result("gemini-1.5-flash", ProbeStatus.ERROR, 0));
        clock.advance(Duration.ofDays(3));

        assertThat(cache.check("gemini-1.5-flash").healthy()).isFalse();
    }

    @Test
    void check_rewrittenSnapshot_reloaded() throws Exception {
        writeSnapshot(result("gemini-1.5-flash", ProbeStatus.DEGRADED, 404));
        Files.setLastModifiedTime(file, FileTime.from(T0));
        assertThat(cache.check("gemini-1.5-flash").healthy()).isFalse();

        writeSnapshot(result("gemini-1.5-flash", ProbeStatus.HEALTHY, 200));
        Files.setLastModifiedTime(file, FileTime.from(T0.plusSeconds(60)));

        assertThat(cache.check("gemini-1.5-flash").healthy()).isTrue();
    }

    @Test
    void check_snapshotDeleted_assumedHealthyAgain() throws Exception {
        writeSnapshot(result("gemini-1.5-flash", ProbeStatus.DEGRADED, 404));
        assertThat(cache.check("gemini-1.5-flash").healthy()).isFalse();

        Files.delete(file);

        assertThat(cache.check("gemini-1.5-flash").healthy()).isTrue();
    }

    @Test
    void isStale_afterOneDay() {
        assertThat(PublisherHealthCache.isStale(T0, T0.plus(Duration.ofHours(23)))).isFalse();
        assertThat(PublisherHealthCache.isStale(T0, T0.plus(Duration.ofHours(25)))).isTrue();
    }

    // ------------------------------------------------------------------

    private ModelProbeResult result(String model, ProbeStatus status, int http) {
        return new ModelProbeResult(model, status, http, null, T0, "https://example.invalid/" + model);
    }

    private void writeSnapshot(ModelProbeResult... results) throws Exception {
        Files.createDirectories(file.getParent());
        json.writeValue(file.toFile(), new ProbeSnapshot(T0, "proj", "us-central1", List.of(results)));
    }
}
