package com.nnstudio.orchestrator.client;

/**
 * A remote answer after boundary validation: either a parsed payload or a
 * structured failure, never both.
 */
public record RemoteResponse<T>(T value, int status, String error) {

    public static <T> RemoteResponse<T> success(int status, T value) {
        return new RemoteResponse<>(value, status, null);
    }

    public static <T> RemoteResponse<T> failure(int status, String error) {
        return new RemoteResponse<>(null, status, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws RemoteCallException carrying the failure status
     */
    public T orThrow() {
        if (!isSuccess()) {
            throw new RemoteCallException(status, error);
        }
        return value;
    }
}
