package com.streamfirst.olap.cooldown.domain;

import lombok.NonNull;

import java.util.List;
import java.util.Optional;

/**
 * Remote descriptor of a tablet's cooled-down rowsets, written next to the segment
 * files by the replica that held the lease. Its presence is the only signal that an
 * upload completed: segments are always written before the descriptor.
 *
 * @param tabletId tablet the descriptor was written for
 * @param replicaId replica that wrote it
 * @param term lease term it was written under
 * @param rowsets every remote rowset of the tablet at the time of writing
 */
public record CooldownMeta(long tabletId, long replicaId, long term, @NonNull List<RowsetMeta> rowsets) {
    public CooldownMeta {
        rowsets = List.copyOf(rowsets);
        for (RowsetMeta rowset : rowsets) {
            if (rowset.isLocal()) {
                throw new IllegalArgumentException("Cooldown meta cannot list local rowset " + rowset.rowsetId());
            }
        }
    }

    public Optional<RowsetMeta> findByVersion(Version version) {
        return rowsets.stream().filter(r -> r.version().equals(version)).findFirst();
    }
}
