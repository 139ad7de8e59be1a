package com.streamfirst.olap.cooldown.ports.exception;

import java.io.IOException;

/**
 * Failure reported by a {@link com.streamfirst.olap.cooldown.ports.RemoteBackend}.
 * Backends flag whether repeating the same call later can succeed.
 */
public class RemoteStorageException extends IOException {

    private final boolean retryable;

    public RemoteStorageException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public RemoteStorageException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
