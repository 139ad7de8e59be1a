package com.streamfirst.olap.cooldown.adapters;

import com.streamfirst.olap.cooldown.ports.RemoteBackend;
import com.streamfirst.olap.cooldown.ports.RemoteOutputStream;
import com.streamfirst.olap.cooldown.ports.exception.RemoteFileNotFoundException;
import com.streamfirst.olap.cooldown.ports.exception.RemoteStorageException;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of RemoteBackend for testing and development.
 * File contents are immutable byte arrays, so a linked name keeps its content when
 * the other name is rewritten. Data is lost when the process stops.
 */
@Slf4j
public class InMemoryRemoteBackend implements RemoteBackend {

    private final String id;

    // Path relative to the backend root to file content
    private final Map<String, byte[]> files = new ConcurrentHashMap<>();

    private final Set<String> directories = ConcurrentHashMap.newKeySet();

    private final AtomicLong uploadCount = new AtomicLong();

    public InMemoryRemoteBackend(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void connect() {
        log.debug("In-memory backend {} is always connected", id);
    }

    @Override
    public RemoteOutputStream createFile(String path) {
        log.debug("Creating file {} in backend {}", path, id);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        return new RemoteOutputStream() {
            @Override
            protected void writeBytes(byte[] b, int off, int len) {
                buffer.write(b, off, len);
            }

            @Override
            protected void publish() {
                files.put(path, buffer.toByteArray());
                log.debug("Wrote file {} to backend {} ({} bytes)", path, id, buffer.size());
            }

            @Override
            protected void discard() {
                buffer.reset();
                log.debug("Discarded unfinished file {} in backend {}", path, id);
            }

            @Override
            protected String describe() {
                return path + " in backend " + id;
            }
        };
    }

    @Override
    public InputStream openFile(String path) throws RemoteStorageException {
        return new ByteArrayInputStream(content(path));
    }

    @Override
    public void deleteFile(String path) {
        if (files.remove(path) != null) {
            log.debug("Deleted file {} from backend {}", path, id);
        }
    }

    @Override
    public void createDirectory(String path) {
        directories.add(path);
    }

    @Override
    public void deleteDirectory(String path) {
        String prefix = path.endsWith("/") ? path : path + "/";
        files.keySet().removeIf(file -> file.startsWith(prefix));
        directories.removeIf(dir -> dir.equals(path) || dir.startsWith(prefix));
        log.debug("Deleted directory {} from backend {}", path, id);
    }

    @Override
    public void linkFile(String src, String dest) throws RemoteStorageException {
        files.put(dest, content(src));
        log.debug("Linked {} to {} in backend {}", src, dest, id);
    }

    @Override
    public boolean exists(String path) {
        return files.containsKey(path);
    }

    @Override
    public long fileSize(String path) throws RemoteStorageException {
        return content(path).length;
    }

    @Override
    public List<String> list(String path) {
        String prefix = path.endsWith("/") ? path : path + "/";
        return files.keySet().stream()
            .filter(file -> file.startsWith(prefix))
            .sorted()
            .toList();
    }

    @Override
    public void upload(Path localPath, String remotePath) throws RemoteStorageException {
        try {
            files.put(remotePath, Files.readAllBytes(localPath));
            uploadCount.incrementAndGet();
            log.debug("Uploaded {} to {} in backend {}", localPath, remotePath, id);
        } catch (IOException e) {
            throw new RemoteStorageException("Failed to read local file " + localPath, e, true);
        }
    }

    /**
     * Number of successful {@link #upload} calls so far, batch items included.
     */
    public long getUploadCount() {
        return uploadCount.get();
    }

    /**
     * Gets the total number of files stored.
     */
    public int getTotalFileCount() {
        return files.size();
    }

    private byte[] content(String path) throws RemoteFileNotFoundException {
        byte[] content = files.get(path);
        if (content == null) {
            throw new RemoteFileNotFoundException(path);
        }
        return content;
    }
}
