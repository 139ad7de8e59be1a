package com.streamfirst.olap.cooldown.domain;

import lombok.NonNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persisted state of one tablet replica: identity, storage policy, cooled-down
 * lease and the rowset index. Instances are immutable; every change produces a new
 * meta that is written to the meta store as a whole.
 *
 * @param tabletId tablet id
 * @param schemaHash schema hash of the tablet
 * @param replicaId id of the replica this meta belongs to
 * @param storagePolicyId storage policy, {@link StoragePolicy#NO_POLICY} for local-only tablets
 * @param cooldownConf last accepted cooldown lease
 * @param rowsets rowsets ordered by version; ranges are disjoint and contiguous
 */
public record TabletMeta(
    long tabletId,
    int schemaHash,
    long replicaId,
    long storagePolicyId,
    @NonNull CooldownConf cooldownConf,
    @NonNull List<RowsetMeta> rowsets
) {
    public TabletMeta {
        List<RowsetMeta> sorted = new ArrayList<>(rowsets);
        sorted.sort(Comparator.comparing(RowsetMeta::version));
        for (int i = 1; i < sorted.size(); i++) {
            Version previous = sorted.get(i - 1).version();
            Version current = sorted.get(i).version();
            if (!previous.isFollowedBy(current)) {
                throw new IllegalArgumentException("Tablet " + tabletId + " has a version gap or overlap between "
                    + previous + " and " + current);
            }
        }
        rowsets = List.copyOf(sorted);
    }

    /**
     * Creates the meta of a new, empty tablet replica.
     */
    public static TabletMeta create(long tabletId, int schemaHash, long replicaId) {
        return new TabletMeta(tabletId, schemaHash, replicaId, StoragePolicy.NO_POLICY, CooldownConf.NONE, List.of());
    }

    public TabletMeta withCooldownConf(CooldownConf conf) {
        return new TabletMeta(tabletId, schemaHash, replicaId, storagePolicyId, conf, rowsets);
    }

    public TabletMeta withStoragePolicyId(long policyId) {
        return new TabletMeta(tabletId, schemaHash, replicaId, policyId, cooldownConf, rowsets);
    }

    /**
     * Returns a meta with one more rowset appended after the current max version.
     */
    public TabletMeta addRowset(RowsetMeta rowset) {
        if (rowset.tabletId() != tabletId) {
            throw new IllegalArgumentException("Rowset " + rowset.rowsetId() + " belongs to tablet "
                + rowset.tabletId() + ", not " + tabletId);
        }
        List<RowsetMeta> updated = new ArrayList<>(rowsets);
        updated.add(rowset);
        return new TabletMeta(tabletId, schemaHash, replicaId, storagePolicyId, cooldownConf, updated);
    }

    /**
     * Returns a meta where every rowset with the same id as one of {@code replacements}
     * is replaced by it.
     *
     * @throws IllegalArgumentException if a replacement matches no rowset or changes its version
     */
    public TabletMeta replaceRowsets(List<RowsetMeta> replacements) {
        Map<RowsetId, RowsetMeta> byId = new HashMap<>();
        for (RowsetMeta replacement : replacements) {
            byId.put(replacement.rowsetId(), replacement);
        }
        List<RowsetMeta> updated = new ArrayList<>(rowsets.size());
        for (RowsetMeta rowset : rowsets) {
            RowsetMeta replacement = byId.remove(rowset.rowsetId());
            if (replacement == null) {
                updated.add(rowset);
            } else if (!replacement.version().equals(rowset.version())) {
                throw new IllegalArgumentException("Replacement for rowset " + rowset.rowsetId()
                    + " changes its version from " + rowset.version() + " to " + replacement.version());
            } else {
                updated.add(replacement);
            }
        }
        if (!byId.isEmpty()) {
            throw new IllegalArgumentException("Tablet " + tabletId + " has no rowsets " + byId.keySet());
        }
        return new TabletMeta(tabletId, schemaHash, replicaId, storagePolicyId, cooldownConf, updated);
    }

    /**
     * Returns the highest version covered by any rowset, or -1 for an empty tablet.
     */
    public long maxVersion() {
        return rowsets.isEmpty() ? -1 : rowsets.get(rowsets.size() - 1).version().end();
    }

    public Optional<RowsetMeta> findRowset(Version version) {
        return rowsets.stream().filter(r -> r.version().equals(version)).findFirst();
    }

    public List<RowsetMeta> remoteRowsets() {
        return rowsets.stream().filter(r -> !r.isLocal()).toList();
    }
}
