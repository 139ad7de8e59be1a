package com.streamfirst.olap.cooldown.ports.exception;

/**
 * The backend could not be reached. Always retryable.
 */
public class RemoteStorageUnavailableException extends RemoteStorageException {

    public RemoteStorageUnavailableException(String message) {
        super(message, true);
    }

    public RemoteStorageUnavailableException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
