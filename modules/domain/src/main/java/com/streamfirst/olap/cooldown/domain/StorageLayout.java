package com.streamfirst.olap.cooldown.domain;

import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File naming shared by every replica. Remote paths are relative to the root of a
 * storage resource; local paths are resolved against the replica's data root.
 * Replicas locate each other's descriptors through this layout, so it must not change.
 */
public final class StorageLayout {

    private static final String DATA_DIR = "data";
    private static final String SEGMENT_SUFFIX = ".dat";
    private static final String META_SUFFIX = ".meta";
    private static final Pattern META_NAME = Pattern.compile("(\\d+)\\.(\\d+)\\.meta");

    private StorageLayout() {
    }

    /**
     * Directory holding every remote file of a tablet: {@code data/<tablet_id>}.
     */
    public static String remoteTabletDir(long tabletId) {
        return DATA_DIR + "/" + tabletId;
    }

    /**
     * Remote path of one segment: {@code data/<tablet_id>/<rowset_id>_<segment>.dat}.
     */
    public static String remoteSegmentPath(long tabletId, RowsetId rowsetId, int segment) {
        return remoteTabletDir(tabletId) + "/" + segmentFileName(rowsetId, segment);
    }

    /**
     * Remote descriptor path: {@code data/<tablet_id>/<replica_id>.<term>.meta}.
     */
    public static String cooldownMetaPath(long tabletId, long replicaId, long term) {
        return remoteTabletDir(tabletId) + "/" + replicaId + "." + term + META_SUFFIX;
    }

    /**
     * Local path of one segment: {@code <root>/data/<tablet_id>/<rowset_id>_<segment>.dat}.
     */
    public static Path localSegmentPath(Path root, long tabletId, RowsetId rowsetId, int segment) {
        return root.resolve(DATA_DIR).resolve(Long.toString(tabletId)).resolve(segmentFileName(rowsetId, segment));
    }

    /**
     * Parses a descriptor file name or path. Returns empty for anything that is not a descriptor.
     */
    public static Optional<MetaFileName> parseCooldownMetaName(String path) {
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        Matcher matcher = META_NAME.matcher(fileName);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new MetaFileName(path, Long.parseLong(matcher.group(1)), Long.parseLong(matcher.group(2))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static String segmentFileName(RowsetId rowsetId, int segment) {
        return rowsetId.value() + "_" + segment + SEGMENT_SUFFIX;
    }

    /**
     * A descriptor found in a remote listing.
     *
     * @param path path as listed
     * @param replicaId replica encoded in the name
     * @param term term encoded in the name
     */
    public record MetaFileName(String path, long replicaId, long term) {
    }
}
