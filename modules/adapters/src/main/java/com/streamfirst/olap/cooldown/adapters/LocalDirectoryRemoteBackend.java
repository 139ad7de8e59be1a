package com.streamfirst.olap.cooldown.adapters;

import com.streamfirst.olap.cooldown.ports.RemoteBackend;
import com.streamfirst.olap.cooldown.ports.RemoteOutputStream;
import com.streamfirst.olap.cooldown.ports.exception.RemoteFileNotFoundException;
import com.streamfirst.olap.cooldown.ports.exception.RemoteStorageException;
import com.streamfirst.olap.cooldown.ports.exception.RemoteStorageUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * RemoteBackend that keeps the remote namespace under a directory, for mounted
 * distributed filesystems and for tests that need real files. Every write lands in a
 * hidden temporary file first, is synced, and is then moved into place, so readers
 * never see partial content and a rewrite never touches the inode of a hard-linked name.
 */
@Slf4j
public class LocalDirectoryRemoteBackend implements RemoteBackend {

    private static final String TEMP_PREFIX = ".";
    private static final String TEMP_SUFFIX = ".tmp";

    private final String id;
    private final Path root;

    public LocalDirectoryRemoteBackend(String id, Path root) {
        this.id = id;
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public String id() {
        return id;
    }

    public Path root() {
        return root;
    }

    @Override
    public void connect() throws RemoteStorageException {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new RemoteStorageUnavailableException("Backend " + id + " root " + root + " is not usable", e);
        }
        if (!Files.isWritable(root)) {
            throw new RemoteStorageUnavailableException("Backend " + id + " root " + root + " is not writable");
        }
    }

    @Override
    public RemoteOutputStream createFile(String path) throws RemoteStorageException {
        Path target = resolve(path);
        Path temp = tempFileFor(target);
        try {
            Files.createDirectories(target.getParent());
            FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return new RemoteOutputStream() {
                @Override
                protected void writeBytes(byte[] b, int off, int len) throws IOException {
                    ByteBuffer buffer = ByteBuffer.wrap(b, off, len);
                    while (buffer.hasRemaining()) {
                        channel.write(buffer);
                    }
                }

                @Override
                protected void publish() throws IOException {
                    channel.force(true);
                    channel.close();
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                    log.debug("Wrote file {} in backend {}", path, id);
                }

                @Override
                protected void discard() throws IOException {
                    channel.close();
                    Files.deleteIfExists(temp);
                    log.debug("Discarded unfinished file {} in backend {}", path, id);
                }

                @Override
                protected String describe() {
                    return path + " in backend " + id;
                }
            };
        } catch (IOException e) {
            throw new RemoteStorageException("Failed to create " + path + " in backend " + id, e, true);
        }
    }

    @Override
    public InputStream openFile(String path) throws RemoteStorageException {
        try {
            return Files.newInputStream(resolve(path));
        } catch (NoSuchFileException e) {
            throw new RemoteFileNotFoundException(path);
        } catch (IOException e) {
            throw new RemoteStorageException("Failed to open " + path + " in backend " + id, e, true);
        }
    }

    @Override
    public void deleteFile(String path) throws RemoteStorageException {
        try {
            Files.deleteIfExists(resolve(path));
        } catch (IOException e) {
            throw new RemoteStorageException("Failed to delete " + path + " in backend " + id, e, true);
        }
    }

    @Override
    public void createDirectory(String path) throws RemoteStorageException {
        try {
            Files.createDirectories(resolve(path));
        } catch (IOException e) {
            throw new RemoteStorageException("Failed to create directory " + path + " in backend " + id, e, true);
        }
    }

    @Override
    public void deleteDirectory(String path) throws RemoteStorageException {
        Path dir = resolve(path);
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        } catch (DirectoryNotEmptyException e) {
            throw new RemoteStorageException("Directory " + path + " changed while being deleted", e, true);
        } catch (IOException e) {
            throw new RemoteStorageException("Failed to delete directory " + path + " in backend " + id, e, true);
        }
    }

    @Override
    public void linkFile(String src, String dest) throws RemoteStorageException {
        Path source = resolve(src);
        Path target = resolve(dest);
        if (!Files.exists(source)) {
            throw new RemoteFileNotFoundException(src);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.deleteIfExists(target);
            try {
                Files.createLink(target, source);
            } catch (UnsupportedOperationException | FileSystemException e) {
                log.debug("Hard links unavailable in backend {}, copying {} to {}", id, src, dest);
                copyDurably(source, target);
            }
            log.debug("Linked {} to {} in backend {}", src, dest, id);
        } catch (IOException e) {
            throw new RemoteStorageException("Failed to link " + src + " to " + dest + " in backend " + id, e, true);
        }
    }

    @Override
    public boolean exists(String path) throws RemoteStorageException {
        return Files.exists(resolve(path));
    }

    @Override
    public long fileSize(String path) throws RemoteStorageException {
        try {
            return Files.size(resolve(path));
        } catch (NoSuchFileException e) {
            throw new RemoteFileNotFoundException(path);
        } catch (IOException e) {
            throw new RemoteStorageException("Failed to stat " + path + " in backend " + id, e, true);
        }
    }

    @Override
    public List<String> list(String path) throws RemoteStorageException {
        Path dir = resolve(path);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                .filter(p -> !p.getFileName().toString().startsWith(TEMP_PREFIX))
                .map(p -> root.relativize(p).toString().replace('\\', '/'))
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new RemoteStorageException("Failed to list " + path + " in backend " + id, e, true);
        }
    }

    @Override
    public void upload(Path localPath, String remotePath) throws RemoteStorageException {
        Path target = resolve(remotePath);
        try {
            Files.createDirectories(target.getParent());
            copyDurably(localPath, target);
            log.debug("Uploaded {} to {} in backend {}", localPath, remotePath, id);
        } catch (NoSuchFileException e) {
            throw new RemoteStorageException("Local file " + localPath + " does not exist", e, false);
        } catch (IOException e) {
            throw new RemoteStorageException("Failed to upload " + localPath + " to " + remotePath, e, true);
        }
    }

    private Path resolve(String path) throws RemoteStorageException {
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new RemoteStorageException("Path " + path + " escapes the root of backend " + id, false);
        }
        return resolved;
    }

    /**
     * Copies into a synced temporary sibling of {@code target}, then renames it into place.
     */
    private static void copyDurably(Path source, Path target) throws IOException {
        Path temp = tempFileFor(target);
        try {
            try (FileChannel in = FileChannel.open(source, StandardOpenOption.READ);
                 FileChannel out = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                long size = in.size();
                long copied = 0;
                while (copied < size) {
                    copied += in.transferTo(copied, size - copied, out);
                }
                out.force(true);
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }

    private static Path tempFileFor(Path target) {
        return target.resolveSibling(TEMP_PREFIX + target.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
    }
}
