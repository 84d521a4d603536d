package com.nnstudio.orchestrator.client;

/**
 * Builds the synchronous client for a project/location. Provider selection
 * only constructs one after configuration and health gates pass.
 */
@FunctionalInterface
public interface SyncClientFactory {

    ImageGenerationClient create(String project, String location);
}
