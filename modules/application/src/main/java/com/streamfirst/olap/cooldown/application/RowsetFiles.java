package com.streamfirst.olap.cooldown.application;

import com.streamfirst.olap.cooldown.domain.RowsetMeta;
import com.streamfirst.olap.cooldown.domain.StorageLayout;
import com.streamfirst.olap.cooldown.ports.RemoteBackend;
import com.streamfirst.olap.cooldown.ports.StorageRegistryPort;
import com.streamfirst.olap.cooldown.ports.exception.RemoteStorageException;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Finds the segment files of a rowset wherever they live: under the local data root
 * while the rowset is local, on the storage resource named in its meta once cooled.
 */
@Slf4j
public class RowsetFiles {

    @Getter
    private final Path localRoot;
    private final StorageRegistryPort registry;

    public RowsetFiles(@NonNull Path localRoot, @NonNull StorageRegistryPort registry) {
        this.localRoot = localRoot;
        this.registry = registry;
    }

    public List<Path> localSegmentPaths(RowsetMeta rowset) {
        return IntStream.range(0, rowset.numSegments())
            .mapToObj(i -> StorageLayout.localSegmentPath(localRoot, rowset.tabletId(), rowset.rowsetId(), i))
            .toList();
    }

    /**
     * Checks every segment of the rowset and reports its actual size.
     *
     * @throws IOException if a segment is missing or unreadable
     */
    public List<Segment> loadSegments(RowsetMeta rowset) throws IOException {
        List<Segment> segments = new ArrayList<>(rowset.numSegments());
        if (rowset.isLocal()) {
            List<Path> paths = localSegmentPaths(rowset);
            for (int i = 0; i < paths.size(); i++) {
                segments.add(new Segment(i, paths.get(i).toString(), Files.size(paths.get(i)), true));
            }
        } else {
            RemoteBackend backend = backendOf(rowset);
            for (int i = 0; i < rowset.numSegments(); i++) {
                String path = rowset.remoteSegmentPaths().get(i);
                segments.add(new Segment(i, path, backend.fileSize(path), false));
            }
        }
        for (Segment segment : segments) {
            long expected = rowset.segmentSizes().get(segment.index());
            if (segment.size() != expected) {
                throw new IOException("Segment " + segment.path() + " of rowset " + rowset.rowsetId()
                    + " has " + segment.size() + " bytes, expected " + expected);
            }
        }
        return segments;
    }

    public InputStream openSegment(RowsetMeta rowset, int index) throws IOException {
        if (index < 0 || index >= rowset.numSegments()) {
            throw new IndexOutOfBoundsException("Rowset " + rowset.rowsetId() + " has no segment " + index);
        }
        if (rowset.isLocal()) {
            return Files.newInputStream(localSegmentPaths(rowset).get(index));
        }
        return backendOf(rowset).openFile(rowset.remoteSegmentPaths().get(index));
    }

    /**
     * Deletes the local segment files of a rowset that is no longer referenced.
     * Failures are logged; the files are left for the next disk sweep.
     */
    public void deleteLocalFiles(RowsetMeta rowset) {
        for (Path path : localSegmentPaths(rowset)) {
            try {
                Files.delete(path);
            } catch (NoSuchFileException e) {
                log.debug("Local segment {} was already gone", path);
            } catch (IOException e) {
                log.warn("Failed to delete local segment {} of rowset {}", path, rowset.rowsetId(), e);
            }
        }
        log.info("Reclaimed local files of rowset {} {} of tablet {}",
            rowset.rowsetId(), rowset.version(), rowset.tabletId());
    }

    private RemoteBackend backendOf(RowsetMeta rowset) throws RemoteStorageException {
        return registry.getStorageResource(rowset.resourceId())
            .orElseThrow(() -> new RemoteStorageException("Storage resource " + rowset.resourceId()
                + " of rowset " + rowset.rowsetId() + " is not registered", false))
            .backend();
    }
}
