package com.nnstudio.orchestrator.retry;

import com.nnstudio.orchestrator.client.RemoteCallException;

/**
 * The last failure of an operation after every attempt was used up.
 * Keeps the status of the last error so callers can still classify it.
 */
public class RetryExhaustedException extends RemoteCallException {

    private final String operation;
    private final int    attempts;

    public RetryExhaustedException(String operation, int attempts, int lastStatus, Throwable lastError) {
        super(lastStatus,
              "%s failed after %d attempts: %s".formatted(operation, attempts, lastError.getMessage()),
              lastError);
        this.operation = operation;
        this.attempts  = attempts;
    }

    public String operation() { return operation; }
    public int    attempts()  { return attempts; }
}
