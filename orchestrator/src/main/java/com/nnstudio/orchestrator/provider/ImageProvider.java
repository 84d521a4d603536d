package com.nnstudio.orchestrator.provider;

import com.nnstudio.orchestrator.model.ProviderName;

/**
 * A generation backend chosen for one job.
 *
 * @see BatchImageProvider
 * @see SyncImageProvider
 */
public interface ImageProvider {

    ProviderName name();
}
