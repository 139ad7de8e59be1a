package com.streamfirst.olap.cooldown.application;

import com.streamfirst.olap.cooldown.domain.RowsetMeta;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runtime handle on one rowset of a tablet, reference counted. The tablet holds one
 * reference for as long as the rowset is in its index; every open {@link RowsetHandle}
 * holds another. When a cooldown replaces a local rowset with its remote copy the
 * tablet drops its reference, and the local files are deleted once the last reader
 * closes its handle.
 */
@Slf4j
final class Rowset {

    private final RowsetMeta meta;
    private final RowsetFiles files;
    private final AtomicInteger refs = new AtomicInteger(1);

    Rowset(RowsetMeta meta, RowsetFiles files) {
        this.meta = meta;
        this.files = files;
    }

    RowsetMeta meta() {
        return meta;
    }

    boolean isLocal() {
        return meta.isLocal();
    }

    int refCount() {
        return refs.get();
    }

    /**
     * Takes a reader reference, unless the rowset was already fully released.
     */
    Optional<RowsetHandle> tryAcquire() {
        while (true) {
            int current = refs.get();
            if (current == 0) {
                return Optional.empty();
            }
            if (refs.compareAndSet(current, current + 1)) {
                return Optional.of(new RowsetHandle(this, files));
            }
        }
    }

    /**
     * Drops one reference; the last one reclaims local files.
     */
    void release() {
        int remaining = refs.decrementAndGet();
        if (remaining < 0) {
            throw new IllegalStateException("Rowset " + meta.rowsetId() + " released more often than acquired");
        }
        if (remaining == 0 && meta.isLocal()) {
            files.deleteLocalFiles(meta);
        } else if (remaining == 0) {
            log.debug("Remote rowset {} of tablet {} is no longer referenced", meta.rowsetId(), meta.tabletId());
        }
    }
}
