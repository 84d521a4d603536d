package com.nnstudio.orchestrator.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nnstudio.orchestrator.client.dto.BatchSubmitRequest;
import com.nnstudio.orchestrator.client.dto.CancelResponse;
import com.nnstudio.orchestrator.client.dto.HealthResponse;
import com.nnstudio.orchestrator.client.dto.PollResponse;
import com.nnstudio.orchestrator.client.dto.ResultsResponse;
import com.nnstudio.orchestrator.client.dto.SubmitResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.function.Predicate;

/**
 * HTTP client for the batch relay, the local service that keeps provider
 * API keys server-side and fronts the batch generation API.
 *
 * Endpoints:
 * <pre>
 *   POST /batch/submit        → {jobId, estCount}
 *   GET  /batch/{id}          → {status, completed?, total?, errors?}
 *   GET  /batch/{id}/results  → {results[], problems[]}
 *   POST /batch/{id}/cancel   → {status: canceled | not_found}
 *   GET  /healthz
 * </pre>
 *
 * Blocking I/O; callers run it from worker threads or the caller's thread.
 */
public class BatchRelayClient implements BatchClient {

    private static final Logger log = LoggerFactory.getLogger(BatchRelayClient.class);

    public static final String DEFAULT_BASE_URL = "http://127.0.0.1:8787";

    static final Duration CALL_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public BatchRelayClient(String baseUrl, ObjectMapper objectMapper) {
        this(baseUrl, objectMapper, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    BatchRelayClient(String baseUrl, ObjectMapper objectMapper, HttpClient http) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.json    = objectMapper;
        this.http    = http;
    }

    // ------------------------------------------------------------------
    // BatchClient
    // ------------------------------------------------------------------

    @Override
    public SubmitResponse submit(BatchSubmitRequest request) {
        log.debug("Submitting batch job: {} rows x {} variants", request.rows().size(), request.variants());
        SubmitResponse resp = send("submit", post("/batch/submit", toJson(request)), SubmitResponse.class,
                r -> r.jobId() != null && !r.jobId().isBlank()).orThrow();
        log.info("Batch job {} submitted ({} images)", resp.jobId(), resp.estCount());
        return resp;
    }

    @Override
    public PollResponse poll(String jobId) {
        PollResponse resp = send("poll", get("/batch/" + encode(jobId)), PollResponse.class,
                r -> r.status() != null).orThrow();
        log.debug("Poll {}: {} ({}/{})", jobId, resp.status().wireName(), resp.completed(), resp.total());
        return resp;
    }

    @Override
    public ResultsResponse results(String jobId) {
        ResultsResponse resp = send("fetch", get("/batch/" + encode(jobId) + "/results"), ResultsResponse.class,
                r -> true).orThrow();
        log.info("Fetched results for {}: {} results, {} problems", jobId, resp.results().size(), resp.problems().size());
        return resp;
    }

    @Override
    public CancelResponse cancel(String jobId) {
        HttpRequest req = base("/batch/" + encode(jobId) + "/cancel")
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        CancelResponse resp = send("cancel", req, CancelResponse.class,
                r -> CancelResponse.CANCELED.equals(r.status()) || CancelResponse.NOT_FOUND.equals(r.status()))
                .orThrow();
        log.info("Cancel {}: {}", jobId, resp.status());
        return resp;
    }

    @Override
    public HealthResponse health() {
        return send("health", get("/healthz"), HealthResponse.class, r -> true).orThrow();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /**
     * Send and validate. Transport failures are thrown (status 0, retryable);
     * HTTP errors and contract violations come back as failures.
     */
    <T> RemoteResponse<T> send(String op, HttpRequest req, Class<T> type, Predicate<T> valid) {
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new RemoteCallException(0, "relay " + op + " timed out", e);
        } catch (IOException e) {
            throw new RemoteCallException(0, "relay " + op + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteCallException(0, "relay " + op + " interrupted", e);
        }

        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            log.error("Relay {} failed: HTTP {}: {}", op, status, resp.body());
            return RemoteResponse.failure(status, "relay " + op + " " + status + ": " + resp.body());
        }
        try {
            T value = json.readValue(resp.body(), type);
            if (value == null || !valid.test(value)) {
                return RemoteResponse.failure(502, "relay " + op + " returned an invalid payload");
            }
            return RemoteResponse.success(status, value);
        } catch (JsonProcessingException e) {
            return RemoteResponse.failure(502, "relay " + op + " returned malformed JSON: " + e.getOriginalMessage());
        }
    }

    private HttpRequest.Builder base(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(CALL_TIMEOUT)
                .header("Accept", "application/json");
    }

    private HttpRequest get(String path) {
        return base(path).GET().build();
    }

    private HttpRequest post(String path, String body) {
        return base(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private static String encode(String jobId) {
        return URLEncoder.encode(jobId, StandardCharsets.UTF_8);
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }
}
