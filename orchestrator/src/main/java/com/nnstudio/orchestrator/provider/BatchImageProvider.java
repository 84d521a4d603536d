package com.nnstudio.orchestrator.provider;

import com.nnstudio.orchestrator.client.BatchClient;
import com.nnstudio.orchestrator.model.ProviderName;

/** Asynchronous path: jobs are submitted and tracked by the batch manager. */
public record BatchImageProvider(BatchClient client) implements ImageProvider {

    @Override
    public ProviderName name() {
        return ProviderName.BATCH;
    }
}
