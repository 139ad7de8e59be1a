package com.streamfirst.olap.cooldown.application;

import com.streamfirst.olap.cooldown.domain.RowsetMeta;
import com.streamfirst.olap.cooldown.domain.Version;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reader's view of a rowset. The handle pins the location the rowset had when it was
 * acquired: a handle taken before a cooldown commit keeps reading the local files,
 * which stay on disk until the handle is closed.
 */
public final class RowsetHandle implements AutoCloseable {

    private final Rowset rowset;
    private final RowsetFiles files;
    private final AtomicBoolean closed = new AtomicBoolean();

    RowsetHandle(Rowset rowset, RowsetFiles files) {
        this.rowset = rowset;
        this.files = files;
    }

    public RowsetMeta meta() {
        return rowset.meta();
    }

    public Version version() {
        return rowset.meta().version();
    }

    public boolean isLocal() {
        return rowset.isLocal();
    }

    public int numSegments() {
        return rowset.meta().numSegments();
    }

    public List<Segment> loadSegments() throws IOException {
        ensureOpen();
        return files.loadSegments(rowset.meta());
    }

    public InputStream openSegment(int index) throws IOException {
        ensureOpen();
        return files.openSegment(rowset.meta(), index);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            rowset.release();
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Handle on rowset " + rowset.meta().rowsetId() + " is closed");
        }
    }
}
