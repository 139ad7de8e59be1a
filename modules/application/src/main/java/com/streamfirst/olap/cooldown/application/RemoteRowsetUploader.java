package com.streamfirst.olap.cooldown.application;

import com.streamfirst.olap.cooldown.domain.CooldownError;
import com.streamfirst.olap.cooldown.domain.CooldownMeta;
import com.streamfirst.olap.cooldown.domain.Result;
import com.streamfirst.olap.cooldown.domain.RowsetMeta;
import com.streamfirst.olap.cooldown.domain.StorageLayout;
import com.streamfirst.olap.cooldown.ports.BatchResult;
import com.streamfirst.olap.cooldown.ports.RemoteBackend;
import com.streamfirst.olap.cooldown.ports.RemoteOutputStream;
import com.streamfirst.olap.cooldown.ports.codec.MetaCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Copies one local rowset to a remote backend: all segments first, then the tablet's
 * cooldown descriptor listing the new remote rowset next to the ones already cooled.
 * Nothing local changes here; a failure leaves at most unreferenced remote files.
 */
@Slf4j
@RequiredArgsConstructor
public class RemoteRowsetUploader {

    private final RowsetFiles rowsetFiles;
    private final MetaCodec codec;

    /**
     * Uploads {@code rowset} and writes the descriptor for lease {@code term}.
     *
     * @param alreadyRemote rowsets of the tablet that are remote already, carried into the descriptor
     * @return the remote version of the rowset, or an {@link CooldownError#UPLOAD_FAILURE}
     */
    public Result<RowsetMeta> upload(RemoteBackend backend, String resourceId, long replicaId, long term,
                                     RowsetMeta rowset, List<RowsetMeta> alreadyRemote) {
        long tabletId = rowset.tabletId();
        List<Path> localPaths = rowsetFiles.localSegmentPaths(rowset);
        List<String> remotePaths = IntStream.range(0, rowset.numSegments())
            .mapToObj(i -> StorageLayout.remoteSegmentPath(tabletId, rowset.rowsetId(), i))
            .toList();

        if (!localPaths.isEmpty()) {
            log.debug("Uploading {} segments ({} bytes) of rowset {} {} to backend {}",
                localPaths.size(), rowset.totalDiskSize(), rowset.rowsetId(), rowset.version(), backend.id());
            BatchResult batch = backend.batchUpload(localPaths, remotePaths);
            if (!batch.isComplete()) {
                String message = "Failed to upload " + batch.failed().size() + " of " + remotePaths.size()
                    + " segments of rowset " + rowset.rowsetId() + ": " + batch.failed();
                log.warn(message);
                return Result.failure(message, CooldownError.UPLOAD_FAILURE);
            }
        }

        RowsetMeta remote = rowset.toRemote(resourceId, remotePaths);
        List<RowsetMeta> described = new ArrayList<>(alreadyRemote);
        described.add(remote);
        CooldownMeta descriptor = new CooldownMeta(tabletId, replicaId, term, described);
        String metaPath = StorageLayout.cooldownMetaPath(tabletId, replicaId, term);
        try {
            byte[] encoded = codec.encodeCooldownMeta(descriptor);
            RemoteOutputStream out = backend.createFile(metaPath);
            try {
                out.write(encoded);
            } catch (IOException | RuntimeException e) {
                out.abort();
                throw e;
            }
            out.close();
        } catch (IOException e) {
            log.warn("Failed to write cooldown meta {} of tablet {}", metaPath, tabletId, e);
            return Result.failure("Failed to write cooldown meta " + metaPath + ": " + e.getMessage(),
                CooldownError.UPLOAD_FAILURE);
        }
        log.debug("Wrote cooldown meta {} listing {} rowsets", metaPath, described.size());
        return Result.success(remote);
    }
}
