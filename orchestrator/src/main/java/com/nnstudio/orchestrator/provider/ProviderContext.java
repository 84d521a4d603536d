package com.nnstudio.orchestrator.provider;

import com.nnstudio.orchestrator.client.BatchClient;
import com.nnstudio.orchestrator.client.SyncClientFactory;
import com.nnstudio.orchestrator.probe.PublisherHealthCache;
import com.nnstudio.orchestrator.probe.ReachabilityCache;

/**
 * Everything provider selection and the batch manager share: settings,
 * the batch client, the sync client factory, and both health caches.
 * One instance per process, created by configuration and passed in.
 */
public record ProviderContext(
        ProviderSettings     settings,
        BatchClient          batchClient,
        SyncClientFactory    syncClientFactory,
        PublisherHealthCache publisherHealth,
        ReachabilityCache    reachability
) {}
