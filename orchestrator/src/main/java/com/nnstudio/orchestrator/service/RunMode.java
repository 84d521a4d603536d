package com.nnstudio.orchestrator.service;

public enum RunMode {
    /** Estimate only: no network calls, no manifests. */
    DRY_RUN,
    LIVE
}
