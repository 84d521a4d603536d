package com.nnstudio.orchestrator.client;

/**
 * Thrown when a remote generation endpoint (batch relay, Vertex, probe target)
 * answers with an error or cannot be reached.
 *
 * {@code statusCode} is the HTTP status when the server answered, or 0 for
 * transport-level failures (timeouts, refused connections).
 */
public class RemoteCallException extends RuntimeException {

    private final int statusCode;

    public RemoteCallException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public RemoteCallException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() { return statusCode; }

    /** True for 4xx answers other than 429; these are never retried. */
    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500 && statusCode != 429;
    }
}
