package com.nnstudio.orchestrator.service;

import com.nnstudio.orchestrator.model.ProviderName;

/**
 * Dry-run estimate. {@code estimatedCostUsd} is null when no per-image
 * price is configured.
 */
public record CostEstimate(
        ProviderName provider,
        int          imageCount,
        int          concurrency,
        long         estimatedSeconds,
        Double       estimatedCostUsd
) {
    static final int SECONDS_PER_IMAGE = 3;

    public static CostEstimate of(ProviderName provider, int imageCount, Double pricePerImageUsd) {
        int concurrency = Math.max(1, Math.min(4, (imageCount + 2) / 3));
        long seconds = (long) Math.ceil((double) imageCount / concurrency) * SECONDS_PER_IMAGE;
        Double cost = pricePerImageUsd == null ? null : imageCount * pricePerImageUsd;
        return new CostEstimate(provider, imageCount, concurrency, seconds, cost);
    }
}
