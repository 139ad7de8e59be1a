package com.streamfirst.olap.cooldown.ports;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Stream returned by {@link RemoteBackend#createFile}. The file appears under its name
 * only when the stream is closed after every write succeeded. A write that throws, or
 * a call to {@link #abort()}, discards what was written and leaves any previous file
 * of that name untouched.
 */
public abstract class RemoteOutputStream extends OutputStream {

    private boolean failed;
    private boolean closed;

    @Override
    public final void write(int b) throws IOException {
        write(new byte[] {(byte) b}, 0, 1);
    }

    @Override
    public final void write(byte[] b, int off, int len) throws IOException {
        if (closed) {
            throw new IOException("Stream is closed");
        }
        try {
            writeBytes(b, off, len);
        } catch (IOException | RuntimeException e) {
            failed = true;
            throw e;
        }
    }

    /**
     * Drops the content written so far without publishing it. No-op once closed.
     */
    public final void abort() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        discard();
    }

    /**
     * Publishes the file, or discards it if a write failed.
     *
     * @throws IOException if a write failed earlier or publishing did not complete
     */
    @Override
    public final void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (failed) {
            discard();
            throw new IOException("Not publishing " + describe() + " after a failed write");
        }
        try {
            publish();
        } catch (IOException | RuntimeException e) {
            try {
                discard();
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
    }

    protected abstract void writeBytes(byte[] b, int off, int len) throws IOException;

    /**
     * Makes the written content durable and visible under the final name.
     */
    protected abstract void publish() throws IOException;

    /**
     * Releases resources and removes any staged content.
     */
    protected abstract void discard() throws IOException;

    protected abstract String describe();
}
