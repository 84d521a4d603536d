package com.nnstudio.orchestrator.provider;

import com.nnstudio.orchestrator.model.ProviderName;

/**
 * Process-wide provider configuration.
 *
 * @param defaultProvider provider used when a job names none
 * @param project         Google Cloud project; sync generation is impossible without it
 * @param location        Google Cloud region
 * @param primaryModel    model whose probe health gates the sync provider
 */
public record ProviderSettings(
        ProviderName defaultProvider,
        String       project,
        String       location,
        String       primaryModel
) {
    public static final String DEFAULT_LOCATION      = "us-central1";
    public static final String DEFAULT_PRIMARY_MODEL = "gemini-1.5-flash";

    public ProviderSettings {
        if (defaultProvider == null) defaultProvider = ProviderName.BATCH;
        if (location == null || location.isBlank()) location = DEFAULT_LOCATION;
        if (primaryModel == null || primaryModel.isBlank()) primaryModel = DEFAULT_PRIMARY_MODEL;
    }

    public boolean hasProject() {
        return project != null && !project.isBlank();
    }
}
