package com.nnstudio.orchestrator.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nnstudio.orchestrator.probe.AccessTokenProvider;
import com.nnstudio.orchestrator.styleguard.StyleGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Vertex AI generateContent client for image models.
 *
 * Each request carries the style-only instruction as the system
 * instruction, the prompt text, and every style reference inline.
 * Authentication is a bearer token from {@link AccessTokenProvider}.
 */
public class VertexImageClient implements ImageGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(VertexImageClient.class);

    public static final String DEFAULT_MODEL = "gemini-2.5-flash-image-preview";

    static final Duration GENERATE_TIMEOUT = Duration.ofSeconds(60);
    static final Duration PROBE_TIMEOUT    = Duration.ofSeconds(5);

    // inline data shorter than this is not a real image
    private static final int MIN_IMAGE_B64_LENGTH = 64;

    private final HttpClient          http;
    private final ObjectMapper        json;
    private final AccessTokenProvider tokens;
    private final String              project;
    private final String              location;
    private final String              model;

    public VertexImageClient(HttpClient http, ObjectMapper objectMapper, AccessTokenProvider tokens,
                             String project, String location, String model) {
        this.http     = http;
        this.json     = objectMapper;
        this.tokens   = tokens;
        this.project  = project;
        this.location = location;
        this.model    = model;
    }

    @Override
    public String key() {
        return project + "/" + location + "/" + model;
    }

    @Override
    public byte[] generate(String prompt, List<Path> styleRefs) {
        List<Object> userParts = new ArrayList<>();
        userParts.add(Map.of("text", prompt));
        for (Path ref : styleRefs) {
            try {
                userParts.add(Map.of("inlineData", Map.of(
                        "mimeType", ref.toString().toLowerCase(Locale.ROOT).endsWith(".png") ? "image/png" : "image/jpeg",
                        "data",     Base64.getEncoder().encodeToString(Files.readAllBytes(ref)))));
            } catch (IOException e) {
                // a missing reference is a caller error, not a transient one
                throw new RemoteCallException(400, "Style reference not readable: " + ref, e);
            }
        }
        Map<String, Object> body = Map.of(
                "systemInstruction", Map.of("parts", List.of(Map.of("text", StyleGuard.STYLE_ONLY_PREFIX))),
                "contents",          List.of(Map.of("role", "user", "parts", userParts)),
                "generationConfig",  Map.of("temperature", 0.8, "responseModalities", List.of("IMAGE")));

        HttpResponse<String> resp = post(body, GENERATE_TIMEOUT);
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new RemoteCallException(resp.statusCode(),
                    "generateContent failed: HTTP " + resp.statusCode() + ": " + truncate(resp.body()));
        }
        return extractImage(resp.body());
    }

    @Override
    public boolean probe() {
        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of("role", "user", "parts", List.of(Map.of("text", "probe")))));
        try {
            HttpResponse<String> resp = post(body, PROBE_TIMEOUT);
            boolean ok = resp.statusCode() == 200;
            if (!ok) {
                log.warn("Vertex probe for {} answered HTTP {}", key(), resp.statusCode());
            }
            return ok;
        } catch (RemoteCallException e) {
            log.warn("Vertex probe for {} failed: {}", key(), e.getMessage());
            return false;
        }
    }

    // ------------------------------------------------------------------
    // Response parsing
    // ------------------------------------------------------------------

    /**
     * First inline image across all candidates. Safety blocks are reported
     * as 422 so they are never retried.
     */
    byte[] extractImage(String responseBody) {
        JsonNode root;
        try {
            root = json.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new RemoteCallException(502, "generateContent returned malformed JSON", e);
        }
        String blockReason = blockReason(root);
        if (blockReason != null) {
            throw new RemoteCallException(422, "Generation blocked: " + blockReason);
        }
        for (JsonNode candidate : root.path("candidates")) {
            for (JsonNode part : candidate.path("content").path("parts")) {
                JsonNode inline = part.path("inlineData");
                String data = inline.path("data").asText("");
                String mime = inline.path("mimeType").asText("");
                if (data.length() > MIN_IMAGE_B64_LENGTH
                        && (mime.startsWith("image/") || mime.equals("application/octet-stream"))) {
                    return Base64.getDecoder().decode(data.replaceFirst("^data:image/[a-z]+;base64,", ""));
                }
            }
        }
        throw new RemoteCallException(502, "No image data in response");
    }

    private static String blockReason(JsonNode root) {
        String promptBlock = root.path("promptFeedback").path("blockReason").asText(null);
        if (promptBlock != null) {
            return "prompt filter: " + promptBlock;
        }
        JsonNode candidates = root.path("candidates");
        if (candidates.isEmpty() && root.has("promptFeedback")) {
            return "all candidates filtered";
        }
        for (JsonNode c : candidates) {
            String finish = c.path("finishReason").asText("");
            if (finish.equals("SAFETY") || finish.equals("BLOCKED")) {
                return "finish reason " + finish;
            }
        }
        return null;
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpResponse<String> post(Map<String, Object> body, Duration timeout) {
        String endpoint = "https://" + location + "-aiplatform.googleapis.com/v1/projects/" + project
                + "/locations/" + location + "/publishers/google/models/" + model + ":generateContent";
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint))
                    .timeout(timeout)
                    .header("Authorization", "Bearer " + tokens.accessToken())
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                    .build();
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new RemoteCallException(0, "generateContent timed out after " + timeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new RemoteCallException(0, "generateContent failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteCallException(0, "generateContent interrupted", e);
        }
    }

    private static String truncate(String s) {
        return s == null || s.length() <= 300 ? s : s.substring(0, 300) + "...";
    }
}
