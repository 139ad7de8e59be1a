package com.streamfirst.olap.cooldown.ports.exception;

public class RemoteFileNotFoundException extends RemoteStorageException {

    public RemoteFileNotFoundException(String path) {
        super("Remote file not found: " + path, false);
    }
}
