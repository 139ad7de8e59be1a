package com.streamfirst.olap.cooldown.ports.codec;

import java.io.IOException;

/**
 * A stored document was read completely but does not decode to valid metadata.
 */
public class MalformedMetaException extends IOException {

    public MalformedMetaException(String message, Throwable cause) {
        super(message, cause);
    }
}
