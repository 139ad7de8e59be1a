package com.streamfirst.olap.cooldown.ports;

import lombok.NonNull;

/**
 * A registered remote store.
 *
 * @param backend handle used to read and write the store
 * @param version addressing-scheme version of the data written through this resource
 */
public record StorageResource(@NonNull RemoteBackend backend, long version) {
}
