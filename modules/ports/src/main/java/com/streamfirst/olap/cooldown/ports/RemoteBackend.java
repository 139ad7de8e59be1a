package com.streamfirst.olap.cooldown.ports;

import com.streamfirst.olap.cooldown.ports.exception.RemoteStorageException;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Port for a remote object or file store that cooled-down rowsets are written to.
 * Abstracts object storage, distributed filesystems and test stores behind one
 * interface; the implementation is chosen when the storage resource is registered.
 *
 * <p>All paths are relative to the backend's root and use {@code /} as separator.
 * Writes are content-durable once {@link #upload} returns or the stream returned by
 * {@link #createFile} is closed; an aborted or failed stream publishes nothing. A file that was shared through {@link #linkFile}
 * must never be changed by a later write to either name.
 */
public interface RemoteBackend {

    /**
     * Identifier of this backend, usually the id of the resource it serves.
     */
    String id();

    /**
     * Checks that the backend is reachable. Idempotent.
     *
     * @throws RemoteStorageException if the backend cannot be used right now
     */
    void connect() throws RemoteStorageException;

    /**
     * Opens a stream that writes a new file, replacing any file of the same name when
     * closed. Call {@link RemoteOutputStream#abort()} to give up on the file.
     */
    RemoteOutputStream createFile(String path) throws RemoteStorageException;

    /**
     * Opens a stream reading the whole file.
     *
     * @throws com.streamfirst.olap.cooldown.ports.exception.RemoteFileNotFoundException if the file does not exist
     */
    InputStream openFile(String path) throws RemoteStorageException;

    /**
     * Deletes a file. Deleting a missing file succeeds.
     */
    void deleteFile(String path) throws RemoteStorageException;

    void createDirectory(String path) throws RemoteStorageException;

    /**
     * Deletes a directory and everything below it.
     */
    void deleteDirectory(String path) throws RemoteStorageException;

    /**
     * Makes {@code dest} refer to the content of {@code src} without copying it through the client.
     */
    void linkFile(String src, String dest) throws RemoteStorageException;

    boolean exists(String path) throws RemoteStorageException;

    long fileSize(String path) throws RemoteStorageException;

    /**
     * Lists files below a directory.
     *
     * @return file paths relative to the backend root; empty if the directory does not exist
     */
    List<String> list(String path) throws RemoteStorageException;

    /**
     * Uploads a local file.
     */
    void upload(Path localPath, String remotePath) throws RemoteStorageException;

    /**
     * Uploads several local files. The default implementation uploads one by one and
     * keeps going after a failure so every item gets an outcome.
     */
    default BatchResult batchUpload(List<Path> localPaths, List<String> remotePaths) {
        if (localPaths.size() != remotePaths.size()) {
            throw new IllegalArgumentException("Got " + localPaths.size() + " local paths for "
                + remotePaths.size() + " remote paths");
        }
        List<String> succeeded = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (int i = 0; i < localPaths.size(); i++) {
            try {
                upload(localPaths.get(i), remotePaths.get(i));
                succeeded.add(remotePaths.get(i));
            } catch (RemoteStorageException e) {
                failed.put(remotePaths.get(i), e.getMessage());
            }
        }
        return new BatchResult(succeeded, failed);
    }

    /**
     * Deletes several files, reporting each one.
     */
    default BatchResult batchDelete(List<String> paths) {
        List<String> succeeded = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (String path : paths) {
            try {
                deleteFile(path);
                succeeded.add(path);
            } catch (RemoteStorageException e) {
                failed.put(path, e.getMessage());
            }
        }
        return new BatchResult(succeeded, failed);
    }
}
