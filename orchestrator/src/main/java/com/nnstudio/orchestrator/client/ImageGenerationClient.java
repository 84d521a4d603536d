package com.nnstudio.orchestrator.client;

import java.nio.file.Path;
import java.util.List;

/**
 * Synchronous, one-image-per-call generation backend.
 */
public interface ImageGenerationClient {

    /**
     * Generate one image conditioned on the prompt and style references.
     *
     * @return encoded image bytes (PNG in practice)
     * @throws RemoteCallException on HTTP, transport or content-policy failure
     */
    byte[] generate(String prompt, List<Path> styleRefs);

    /** Cheap liveness/entitlement check; false rather than throwing. */
    boolean probe();

    /** Identity used as the reachability cache key. */
    String key();
}
