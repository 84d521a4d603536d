package com.nnstudio.orchestrator.provider;

import com.nnstudio.orchestrator.client.ImageGenerationClient;
import com.nnstudio.orchestrator.model.ProviderName;

/** Synchronous path: images are rendered in-process, one call per image. */
public record SyncImageProvider(ImageGenerationClient client) implements ImageProvider {

    @Override
    public ProviderName name() {
        return ProviderName.VERTEX;
    }
}
