package com.nnstudio.orchestrator.probe;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nnstudio.orchestrator.problem.Problem;
import com.nnstudio.orchestrator.problem.ProblemException;
import com.nnstudio.orchestrator.problem.ProblemTypes;
import com.nnstudio.orchestrator.util.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Sweeps publisher models with a minimal request each and records which
 * ones this project is entitled to. The snapshot it writes is what
 * {@link PublisherHealthCache} reads.
 *
 * Classification:
 * <pre>
 *   200        → healthy
 *   404        → degraded (model-not-entitled)
 *   other HTTP → error (error-json | non-json)
 *   no answer  → error, http 0 (timeout | network-error)
 * </pre>
 */
@Component
public class PublisherProbe {

    private static final Logger log = LoggerFactory.getLogger(PublisherProbe.class);

    static final Duration PROBE_TIMEOUT = Duration.ofSeconds(2);

    public record Target(String model, String method, Map<String, Object> body) {}

    private static final Map<String, Object> TEXT_PROBE =
            Map.of("contents", List.of(Map.of("role", "user", "parts", List.of(Map.of("text", "probe")))));

    public static final List<Target> DEFAULT_TARGETS = List.of(
            new Target("gemini-2.5-flash-image-preview", "generateContent", TEXT_PROBE),
            new Target("gemini-1.5-pro",                 "generateContent", TEXT_PROBE),
            new Target("gemini-1.5-flash",               "generateContent", TEXT_PROBE),
            new Target("textembedding-gecko@003", "predict",
                    Map.of("instances", List.of(Map.of("content", "probe")))),
            new Target("text-bison@002", "predict",
                    Map.of("instances", List.of(Map.of("prompt", "probe")),
                           "parameters", Map.of("temperature", 0.2))),
            new Target("imagegeneration@005", "predict",
                    Map.of("instances", List.of(Map.of("prompt", "simple icon")),
                           "parameters", Map.of("sampleCount", 1, "size", "64x64"))));

    private final HttpClient          http;
    private final ObjectMapper        json;
    private final AccessTokenProvider tokens;
    private final Clock               clock;

    public PublisherProbe(HttpClient http, ObjectMapper objectMapper, AccessTokenProvider tokens, Clock clock) {
        this.http   = http;
        this.json   = objectMapper;
        this.tokens = tokens;
        this.clock  = clock;
    }

    /**
     * Probe every target in order and write the snapshot atomically to {@code output}.
     *
     * @throws ProblemException 400 when no project is configured
     */
    public ProbeSnapshot run(String project, String location, List<Target> targets, Path output) {
        if (project == null || project.isBlank()) {
            throw new ProblemException(Problem.of(ProblemTypes.PROVIDER_CONFIG_MISSING,
                    "Missing configuration", "GOOGLE_CLOUD_PROJECT is required for publisher probe", 400));
        }
        log.info("Starting publisher model probe for {}/{}", project, location);
        String token = tokens.accessToken();

        List<ModelProbeResult> results = new ArrayList<>();
        for (Target target : targets) {
            ModelProbeResult r = probe(target, token, project, location);
            log.info("Probe {} → {} (http {}{})", r.model(), r.status().wireName(), r.http(),
                    r.code() == null ? "" : ", " + r.code());
            results.add(r);
        }

        ProbeSnapshot snapshot = new ProbeSnapshot(clock.instant(), project, location, results);
        try {
            AtomicFiles.write(output, json.writerWithDefaultPrettyPrinter().writeValueAsBytes(snapshot));
        } catch (IOException e) {
            throw new ProblemException(Problem.of(ProblemTypes.PROBE_ERROR,
                    "Probe snapshot not written", e.getMessage(), 500), e);
        }
        long healthy = results.stream().filter(ModelProbeResult::isHealthy).count();
        log.info("Publisher probe complete: {}/{} healthy, snapshot at {}", healthy, results.size(), output);
        return snapshot;
    }

    static String endpoint(Target target, String project, String location) {
        return "https://" + location + "-aiplatform.googleapis.com/v1/projects/" + project
                + "/locations/" + location + "/publishers/google/models/" + target.model() + ":" + target.method();
    }

    ModelProbeResult probe(Target target, String token, String project, String location) {
        String endpoint = endpoint(target, project, location);
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint))
                    .timeout(PROBE_TIMEOUT)
                    .header("Authorization", "Bearer " + token)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(toJson(target.body())))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            int status = resp.statusCode();
            if (status == 200) {
                return result(target, ProbeStatus.HEALTHY, 200, null, endpoint);
            }
            if (status == 404) {
                return result(target, ProbeStatus.DEGRADED, 404, "model-not-entitled", endpoint);
            }
            boolean isJson = resp.headers().firstValue("content-type")
                    .map(ct -> ct.contains("application/json"))
                    .orElse(false);
            return result(target, ProbeStatus.ERROR, status, isJson ? "error-json" : "non-json", endpoint);

        } catch (HttpTimeoutException e) {
            return result(target, ProbeStatus.ERROR, 0, "timeout", endpoint);
        } catch (IOException e) {
            log.warn("Probe of {} failed: {}", target.model(), e.getMessage());
            return result(target, ProbeStatus.ERROR, 0, "network-error", endpoint);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return result(target, ProbeStatus.ERROR, 0, "network-error", endpoint);
        }
    }

    private ModelProbeResult result(Target target, ProbeStatus status, int httpStatus, String code, String endpoint) {
        return new ModelProbeResult(target.model(), status, httpStatus, code, clock.instant(), endpoint);
    }

    private String toJson(Object body) {
        try {
            return json.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Probe body not serializable", e);
        }
    }
}
