package com.nnstudio.orchestrator.probe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nnstudio.orchestrator.problem.ProblemException;
import com.nnstudio.orchestrator.support.MutableClock;
import com.nnstudio.orchestrator.support.TestJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PublisherProbeTest {

    @TempDir Path dir;

    ObjectMapper json = TestJson.mapper();
    MutableClock clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
    HttpClient http;
    PublisherProbe probe;

    @BeforeEach
    void setUp() {
        http  = mock(HttpClient.class);
        probe = new PublisherProbe(http, json, AccessTokenProvider.fixed("tok"), clock);
    }

    @Test
    void run_classifiesEachTarget_andWritesSnapshot() throws Exception {
        doAnswer(inv -> {
            HttpRequest req = inv.getArgument(0);
            assertThat(req.headers().firstValue("Authorization")).hasValue("Bearer tok");
            String uri = req.uri().toString();
            if (uri.contains("/models/ok:"))        return response(200, "application/json");
            if (uri.contains("/models/missing:"))   return response(404, "application/json");
            if (uri.contains("/models/broken:"))    return response(500, "application/json; charset=UTF-8");
            if (uri.contains("/models/html:"))      return response(502, "text/html");
            if (uri.contains("/models/slow:"))      throw new HttpTimeoutException("timed out");
            throw new ConnectException("refused");
        }).when(http).send(any(), any());

        Path out = dir.resolve("probe/publishers.json");
        ProbeSnapshot snapshot = probe.run("proj", "us-central1",
                List.of(target("ok"), target("missing"), target("broken"), target("html"), target("slow"), target("down")),
                out);

        assertThat(snapshot.results()).extracting(ModelProbeResult::status).containsExactly(
                ProbeStatus.HEALTHY, ProbeStatus.DEGRADED, ProbeStatus.ERROR,
                ProbeStatus.ERROR, ProbeStatus.ERROR, ProbeStatus.ERROR);
        assertThat(snapshot.results()).extracting(ModelProbeResult::http)
                .containsExactly(200, 404, 500, 502, 0, 0);
        assertThat(snapshot.results()).extracting(ModelProbeResult::code)
                .containsExactly(null, "model-not-entitled", "error-json", "non-json", "timeout", "network-error");

        assertThat(out).exists();
        ProbeSnapshot reread = json.readValue(out.toFile(), ProbeSnapshot.class);
        assertThat(reread.project()).isEqualTo("proj");
        assertThat(reread.timestamp()).isEqualTo(clock.instant());
        assertThat(reread.find("missing")).get()
                .satisfies(r -> assertThat(r.isHealthy()).isFalse());
    }

    @Test
    void run_snapshotFeedsHealthCache() throws Exception {
        doAnswer(inv -> response(404, "application/json")).when(http).send(any(), any());
        Path out = dir.resolve("publishers.json");

        probe.run("proj", "us-central1", List.of(target("gemini-1.5-flash")), out);

        PublisherHealthCache cache = new PublisherHealthCache(out, json, clock);
        assertThat(cache.check("gemini-1.5-flash").healthy()).isFalse();
        assertThat(cache.check("gemini-1.5-pro").healthy()).isTrue();
    }

    @Test
    void run_blankProject_isConfigProblem() throws Exception {
        assertThatThrownBy(() -> probe.run(" ", "us-central1", PublisherProbe.DEFAULT_TARGETS, dir.resolve("x.json")))
                .isInstanceOf(ProblemException.class)
                .satisfies(e -> assertThat(((ProblemException) e).status()).isEqualTo(400));

        verify(http, never()).send(any(), any());
        assertThat(Files.exists(dir.resolve("x.json"))).isFalse();
    }

    @Test
    void endpoint_buildsRegionalPublisherUrl() {
        assertThat(PublisherProbe.endpoint(target("gemini-1.5-pro"), "proj", "europe-west4"))
                .isEqualTo("https://europe-west4-aiplatform.googleapis.com/v1/projects/proj/locations/europe-west4"
                        + "/publishers/google/models/gemini-1.5-pro:generateContent");
    }

    @Test
    void defaultTargets_coverSixModels() {
        assertThat(PublisherProbe.DEFAULT_TARGETS).hasSize(6)
                .extracting(PublisherProbe.Target::model)
                .contains("gemini-1.5-flash", "imagegeneration@005");
    }

    // ------------------------------------------------------------------

    private static PublisherProbe.Target target(String model) {
        return new PublisherProbe.Target(model, "generateContent", Map.of("contents", List.of()));
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String contentType) {
        HttpResponse<String> resp = mock(HttpResponse.class);
        when(resp.statusCode()).thenReturn(status);
        when(resp.headers()).thenReturn(HttpHeaders.of(Map.of("content-type", List.of(contentType)), (a, b) -> true));
        when(resp.body()).thenReturn("{}");
        return resp;
    }
}
