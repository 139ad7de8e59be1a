package com.streamfirst.olap.cooldown.application;

import com.streamfirst.olap.cooldown.domain.CooldownConf;
import com.streamfirst.olap.cooldown.domain.CooldownError;
import com.streamfirst.olap.cooldown.domain.CooldownOutcome;
import com.streamfirst.olap.cooldown.domain.CooldownState;
import com.streamfirst.olap.cooldown.domain.Result;
import com.streamfirst.olap.cooldown.domain.RowsetId;
import com.streamfirst.olap.cooldown.domain.RowsetMeta;
import com.streamfirst.olap.cooldown.domain.TabletMeta;
import com.streamfirst.olap.cooldown.domain.Version;
import com.streamfirst.olap.cooldown.ports.TabletMetaStorePort;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One replica of a tablet: its persisted meta, its live rowsets and its cooldown lease.
 *
 * <p>Every change to the meta is a read-modify-write under the tablet's write lock that
 * is first made durable in the meta store and only then applied in memory. The lock is
 * never held while talking to remote storage; cooldown attempts coordinate through the
 * set of migrating rowsets instead.
 */
@Slf4j
public class Tablet {

    private final long tabletId;
    private final long replicaId;
    private final TabletMetaStorePort metaStore;
    private final RowsetFiles rowsetFiles;
    private final TabletCooldownHandler cooldownHandler;
    private final CooldownConflictResolver conflictResolver;

    private final ReentrantReadWriteLock metaLock = new ReentrantReadWriteLock();
    // guarded by metaLock
    private TabletMeta meta;
    // guarded by metaLock
    private final NavigableMap<Version, Rowset> rowsets = new TreeMap<>();

    private final Set<RowsetId> migrating = ConcurrentHashMap.newKeySet();
    private final AtomicReference<CooldownState> cooldownState = new AtomicReference<>(CooldownState.IDLE);

    Tablet(@NonNull TabletMeta meta, @NonNull TabletMetaStorePort metaStore, @NonNull RowsetFiles rowsetFiles,
           @NonNull TabletCooldownHandler cooldownHandler) {
        this.tabletId = meta.tabletId();
        this.replicaId = meta.replicaId();
        this.meta = meta;
        this.metaStore = metaStore;
        this.rowsetFiles = rowsetFiles;
        this.cooldownHandler = cooldownHandler;
        this.conflictResolver = new CooldownConflictResolver(tabletId, meta.cooldownConf());
        for (RowsetMeta rowset : meta.rowsets()) {
            rowsets.put(rowset.version(), new Rowset(rowset, rowsetFiles));
        }
    }

    public long tabletId() {
        return tabletId;
    }

    public long replicaId() {
        return replicaId;
    }

    public int schemaHash() {
        return meta().schemaHash();
    }

    /**
     * Snapshot of the current meta.
     */
    public TabletMeta meta() {
        metaLock.readLock().lock();
        try {
            return meta;
        } finally {
            metaLock.readLock().unlock();
        }
    }

    public long storagePolicyId() {
        return meta().storagePolicyId();
    }

    public CooldownConf cooldownConf() {
        return conflictResolver.current();
    }

    public CooldownState cooldownState() {
        return cooldownState.get();
    }

    /**
     * Returns true if this replica currently holds the cooldown lease.
     */
    public boolean isCooldownOwner() {
        return conflictResolver.isAuthorized(replicaId);
    }

    /**
     * Migrates the next eligible rowset to remote storage, or adopts remote copies that
     * already exist. Expected failures come back as {@link Result} failures.
     */
    public Result<CooldownOutcome> cooldown() {
        return cooldownHandler.cooldown(this);
    }

    /**
     * Applies a lease update from the coordinator. An accepted lease is persisted with
     * the tablet meta before it takes effect.
     *
     * @return true if the lease changed; failure on conflicting or unpersistable updates
     */
    public Result<Boolean> updateCooldownConf(long term, long cooldownReplicaId) {
        metaLock.writeLock().lock();
        try {
            if (conflictResolver.evaluate(term, cooldownReplicaId) != CooldownConflictResolver.Decision.ACCEPT) {
                return conflictResolver.update(term, cooldownReplicaId);
            }
            Result<Void> persisted = persist(meta.withCooldownConf(new CooldownConf(term, cooldownReplicaId)));
            if (persisted.isFailure()) {
                return persisted.propagate();
            }
            return conflictResolver.update(term, cooldownReplicaId);
        } finally {
            metaLock.writeLock().unlock();
        }
    }

    /**
     * Points the tablet at another storage policy, or at none with
     * {@link com.streamfirst.olap.cooldown.domain.StoragePolicy#NO_POLICY}.
     */
    public Result<Void> setStoragePolicyId(long storagePolicyId) {
        metaLock.writeLock().lock();
        try {
            if (meta.storagePolicyId() == storagePolicyId) {
                return Result.success();
            }
            Result<Void> persisted = persist(meta.withStoragePolicyId(storagePolicyId));
            if (persisted.isSuccess()) {
                log.info("Tablet {} now uses storage policy {}", tabletId, storagePolicyId);
            }
            return persisted;
        } finally {
            metaLock.writeLock().unlock();
        }
    }

    /**
     * Adds a newly published local rowset. Its version must start right after the
     * tablet's current max version.
     *
     * @throws IllegalArgumentException if the rowset does not extend the version chain
     * @throws IOException if the meta store rejects the update
     */
    public void addIncRowset(@NonNull RowsetMeta rowset) throws IOException {
        if (!rowset.isLocal()) {
            throw new IllegalArgumentException("Published rowset " + rowset.rowsetId() + " must be local");
        }
        metaLock.writeLock().lock();
        try {
            long expectedStart = meta.maxVersion() + 1;
            if (rowset.version().start() != expectedStart) {
                throw new IllegalArgumentException("Rowset " + rowset.rowsetId() + " " + rowset.version()
                    + " does not start at version " + expectedStart + " of tablet " + tabletId);
            }
            TabletMeta updated = meta.addRowset(rowset);
            metaStore.save(updated);
            meta = updated;
            rowsets.put(rowset.version(), new Rowset(rowset, rowsetFiles));
            log.debug("Tablet {} published rowset {} {}", tabletId, rowset.rowsetId(), rowset.version());
        } finally {
            metaLock.writeLock().unlock();
        }
    }

    /**
     * Acquires the rowset covering exactly {@code version}. The returned handle must be
     * closed; until then the files it reads from are kept.
     */
    public Optional<RowsetHandle> getRowsetByVersion(Version version) {
        metaLock.readLock().lock();
        try {
            Rowset rowset = rowsets.get(version);
            return rowset == null ? Optional.empty() : rowset.tryAcquire();
        } finally {
            metaLock.readLock().unlock();
        }
    }

    public List<RowsetMeta> rowsetMetas() {
        return meta().rowsets();
    }

    /**
     * Picks the oldest local rowset as the next cooldown candidate and marks it migrating.
     * Returns empty if there is no local rowset, if it was written after {@code cutoff}, or
     * if another attempt is already migrating it; a younger rowset is never picked instead,
     * so rowsets go remote in version order.
     */
    Optional<RowsetMeta> beginMigration(Instant cutoff) {
        metaLock.readLock().lock();
        try {
            Optional<Rowset> oldestLocal = rowsets.values().stream().filter(Rowset::isLocal).findFirst();
            if (oldestLocal.isEmpty()) {
                return Optional.empty();
            }
            RowsetMeta candidate = oldestLocal.get().meta();
            if (candidate.newestWriteTimestamp().isAfter(cutoff)) {
                log.debug("Rowset {} {} of tablet {} is too young to cool down", candidate.rowsetId(),
                    candidate.version(), tabletId);
                return Optional.empty();
            }
            if (!migrating.add(candidate.rowsetId())) {
                log.debug("Rowset {} of tablet {} is already migrating", candidate.rowsetId(), tabletId);
                return Optional.empty();
            }
            return Optional.of(candidate);
        } finally {
            metaLock.readLock().unlock();
        }
    }

    /**
     * Marks one more rowset migrating, if it is local and nobody else is moving it.
     */
    boolean tryMarkMigrating(RowsetMeta rowset) {
        metaLock.readLock().lock();
        try {
            Rowset current = rowsets.get(rowset.version());
            return current != null
                && current.isLocal()
                && current.meta().rowsetId().equals(rowset.rowsetId())
                && migrating.add(rowset.rowsetId());
        } finally {
            metaLock.readLock().unlock();
        }
    }

    void endMigration(RowsetId rowsetId) {
        migrating.remove(rowsetId);
    }

    void transitionTo(CooldownState state) {
        CooldownState previous = cooldownState.getAndSet(state);
        if (previous != state) {
            log.trace("Tablet {} cooldown {} -> {}", tabletId, previous, state);
        }
    }

    /**
     * Switches rowsets to their remote location. Re-checks the lease, persists the new
     * meta, then swaps the in-memory rowsets in version order; the replaced local rowsets
     * are released and reclaimed once no reader holds them.
     */
    Result<Void> commitCooldown(List<RowsetMeta> remoteRowsets) {
        metaLock.writeLock().lock();
        try {
            if (!conflictResolver.isAuthorized(replicaId)) {
                String message = "Replica " + replicaId + " lost the cooldown lease of tablet " + tabletId
                    + " before commit, now " + conflictResolver.current();
                log.warn(message);
                return Result.failure(message, CooldownError.LEASE_EXPIRED);
            }
            for (RowsetMeta remote : remoteRowsets) {
                Rowset current = rowsets.get(remote.version());
                if (current == null || !current.isLocal() || !current.meta().rowsetId().equals(remote.rowsetId())) {
                    throw new IllegalStateException("Rowset " + remote.rowsetId() + " " + remote.version()
                        + " of tablet " + tabletId + " changed while it was migrating");
                }
            }
            Result<Void> persisted = persist(meta.replaceRowsets(remoteRowsets));
            if (persisted.isFailure()) {
                return persisted;
            }
            remoteRowsets.stream()
                .sorted(Comparator.comparing(RowsetMeta::version))
                .forEach(remote -> rowsets.put(remote.version(), new Rowset(remote, rowsetFiles)).release());
            return Result.success();
        } finally {
            metaLock.writeLock().unlock();
        }
    }

    /**
     * Number of references on the rowset covering {@code version}, the tablet's own included.
     */
    int refCount(Version version) {
        metaLock.readLock().lock();
        try {
            Rowset rowset = rowsets.get(version);
            return rowset == null ? 0 : rowset.refCount();
        } finally {
            metaLock.readLock().unlock();
        }
    }

    // caller holds the write lock
    private Result<Void> persist(TabletMeta updated) {
        try {
            metaStore.save(updated);
        } catch (IOException e) {
            log.error("Failed to persist meta of tablet {}", tabletId, e);
            return Result.failure("Failed to persist meta of tablet " + tabletId + ": " + e.getMessage(),
                CooldownError.METADATA_PERSIST_ERROR);
        }
        meta = updated;
        return Result.success();
    }

    @Override
    public String toString() {
        return "Tablet{" + tabletId + ", replica " + replicaId + "}";
    }
}
