package com.nnstudio.orchestrator.util;

/**
 * Cooperative cancellation flag. Work checks it at item boundaries; an
 * item already running is allowed to finish.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
