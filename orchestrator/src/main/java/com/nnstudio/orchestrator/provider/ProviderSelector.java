package com.nnstudio.orchestrator.provider;

import com.nnstudio.orchestrator.client.ImageGenerationClient;
import com.nnstudio.orchestrator.model.ProviderName;
import com.nnstudio.orchestrator.probe.ModelHealth;
import com.nnstudio.orchestrator.problem.Problem;
import com.nnstudio.orchestrator.problem.ProblemException;
import com.nnstudio.orchestrator.problem.ProblemTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Picks the backend for a job.
 *
 * <pre>
 *   desired = override ?? configured default
 *   batch  → batch, no gating
 *   vertex → project configured?           no → 400 | fall back
 *            primary model healthy (probe)? no → 403 | fall back
 *            sync client reachable?         no → 503 | fall back
 *            → sync
 * </pre>
 * With {@code noFallback} each gate raises its Problem instead of falling
 * back to batch. For the same inputs and cache state the result is always
 * the same.
 */
@Service
public class ProviderSelector {

    private static final Logger log = LoggerFactory.getLogger(ProviderSelector.class);

    private final ProviderContext context;

    public ProviderSelector(ProviderContext context) {
        this.context = context;
    }

    /**
     * @param override   per-job provider, or null for the configured default
     * @param noFallback raise instead of silently using batch
     * @throws ProblemException 400, 403 or 503 when {@code noFallback} and a gate fails
     */
    public ImageProvider selectProvider(ProviderName override, boolean noFallback) {
        ProviderSettings settings = context.settings();
        ProviderName desired = override != null ? override : settings.defaultProvider();
        log.info("Selecting provider: desired={} (default={}, override={}, noFallback={})",
                desired.id(), settings.defaultProvider().id(), override == null ? "-" : override.id(), noFallback);

        if (desired == ProviderName.BATCH) {
            return batch();
        }

        // 1. configuration
        if (!settings.hasProject()) {
            if (noFallback) {
                throw new ProblemException(Problem.of(ProblemTypes.PROVIDER_CONFIG_MISSING,
                        "Vertex AI configuration missing",
                        "GOOGLE_CLOUD_PROJECT is required for Vertex AI provider", 400));
            }
            return fallback("missing_project_config");
        }

        // 2. cached publisher health
        ModelHealth health = context.publisherHealth().check(settings.primaryModel());
        if (!health.healthy()) {
            log.warn("Primary model {} marked unhealthy in probe cache (status {}, http {})",
                    settings.primaryModel(), health.status(), health.http());
            if (noFallback) {
                throw new ProblemException(Problem.of(ProblemTypes.PROVIDER_MODEL_UNHEALTHY,
                        "Model entitlement missing",
                        "Publisher Model " + settings.primaryModel() + " is not available (status: "
                                + (health.status() == null ? "unknown" : health.status().wireName())
                                + ", HTTP: " + health.http() + ")", 403));
            }
            return fallback("model_unhealthy");
        }

        // 3. live reachability
        ImageGenerationClient client = context.syncClientFactory().create(settings.project(), settings.location());
        boolean reachable = context.reachability().isReachable(client.key(), client::probe);
        if (!reachable) {
            if (noFallback) {
                throw new ProblemException(Problem.of(ProblemTypes.PROVIDER_UNAVAILABLE,
                        "Vertex AI unavailable",
                        "Vertex AI probe failed - entitlement or authentication issue", 503));
            }
            return fallback("vertex_probe_failed");
        }

        log.info("Using Vertex AI (sync) provider for {}", client.key());
        return new SyncImageProvider(client);
    }

    /**
     * Strict parse of a per-job provider name; null or blank means "use the default".
     *
     * @throws ProblemException 400 {@code provider/unknown}
     */
    public static ProviderName parseOverride(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ProviderName.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ProblemException(Problem.of(ProblemTypes.PROVIDER_UNKNOWN, "Unknown provider", e.getMessage(), 400));
        }
    }

    private ImageProvider batch() {
        log.info("Using batch (async) provider");
        return new BatchImageProvider(context.batchClient());
    }

    private ImageProvider fallback(String reason) {
        log.warn("Vertex AI not usable ({}), falling back to batch provider", reason);
        return new BatchImageProvider(context.batchClient());
    }
}
