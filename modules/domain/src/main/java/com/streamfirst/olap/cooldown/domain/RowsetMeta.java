package com.streamfirst.olap.cooldown.domain;

import lombok.NonNull;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable description of a rowset: its version range, its segments and where
 * they live. A rowset is local while {@code resourceId} is null; once cooled it
 * names the storage resource and the remote path of every segment. Cooldown only
 * ever changes the location fields, never the data description.
 *
 * @param tabletId owning tablet
 * @param rowsetId id of the rowset within the tablet
 * @param version version range covered by the rowset
 * @param numRows number of rows over all segments
 * @param segmentSizes byte size of each segment, in segment order
 * @param newestWriteTimestamp time of the newest write that landed in this rowset
 * @param resourceId storage resource holding the segments, null while local
 * @param remoteSegmentPaths remote path of each segment, empty while local
 */
public record RowsetMeta(
    long tabletId,
    @NonNull RowsetId rowsetId,
    @NonNull Version version,
    long numRows,
    @NonNull List<Long> segmentSizes,
    @NonNull Instant newestWriteTimestamp,
    String resourceId,
    @NonNull List<String> remoteSegmentPaths
) {
    public RowsetMeta {
        if (numRows < 0) {
            throw new IllegalArgumentException("Row count cannot be negative: " + numRows);
        }
        segmentSizes = List.copyOf(segmentSizes);
        remoteSegmentPaths = List.copyOf(remoteSegmentPaths);
        if (resourceId != null && resourceId.isEmpty()) {
            resourceId = null;
        }
        if (resourceId == null && !remoteSegmentPaths.isEmpty()) {
            throw new IllegalArgumentException("Local rowset " + rowsetId + " cannot carry remote segment paths");
        }
        if (resourceId != null && remoteSegmentPaths.size() != segmentSizes.size()) {
            throw new IllegalArgumentException("Remote rowset " + rowsetId + " has " + remoteSegmentPaths.size()
                + " segment paths for " + segmentSizes.size() + " segments");
        }
    }

    /**
     * Creates the description of a freshly published, local rowset.
     */
    public static RowsetMeta local(long tabletId, RowsetId rowsetId, Version version, long numRows,
                                   List<Long> segmentSizes, Instant newestWriteTimestamp) {
        return new RowsetMeta(tabletId, rowsetId, version, numRows, segmentSizes, newestWriteTimestamp,
            null, List.of());
    }

    /**
     * Returns a copy of this rowset located on the given resource at the given paths.
     */
    public RowsetMeta toRemote(@NonNull String resourceId, @NonNull List<String> segmentPaths) {
        return new RowsetMeta(tabletId, rowsetId, version, numRows, segmentSizes, newestWriteTimestamp,
            resourceId, segmentPaths);
    }

    public boolean isLocal() {
        return resourceId == null;
    }

    public Optional<String> resource() {
        return Optional.ofNullable(resourceId);
    }

    public int numSegments() {
        return segmentSizes.size();
    }

    public long totalDiskSize() {
        return segmentSizes.stream().mapToLong(Long::longValue).sum();
    }

    /**
     * Returns true if {@code other} describes the same data: same version range,
     * row count and segment sizes. Location and ids are not compared.
     */
    public boolean hasSameDataAs(RowsetMeta other) {
        return version.equals(other.version)
            && numRows == other.numRows
            && segmentSizes.equals(other.segmentSizes);
    }
}
