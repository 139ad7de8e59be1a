package com.streamfirst.olap.cooldown.application;

import com.streamfirst.olap.cooldown.application.CooldownMetaFinder.LocatedCooldownMeta;
import com.streamfirst.olap.cooldown.domain.CooldownConf;
import com.streamfirst.olap.cooldown.domain.CooldownError;
import com.streamfirst.olap.cooldown.domain.CooldownMeta;
import com.streamfirst.olap.cooldown.domain.CooldownOutcome;
import com.streamfirst.olap.cooldown.domain.CooldownState;
import com.streamfirst.olap.cooldown.domain.Result;
import com.streamfirst.olap.cooldown.domain.RowsetId;
import com.streamfirst.olap.cooldown.domain.RowsetMeta;
import com.streamfirst.olap.cooldown.domain.StorageLayout;
import com.streamfirst.olap.cooldown.domain.StoragePolicy;
import com.streamfirst.olap.cooldown.ports.RemoteBackend;
import com.streamfirst.olap.cooldown.ports.StorageRegistryPort;
import com.streamfirst.olap.cooldown.ports.StorageResource;
import com.streamfirst.olap.cooldown.ports.exception.RemoteStorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Runs the cooldown protocol for a tablet:
 * <ol>
 * <li>lease check,</li>
 * <li>candidate selection (oldest local rowset old enough),</li>
 * <li>resolution of the tablet's policy to a backend,</li>
 * <li>adoption of a descriptor another replica already uploaded, if it covers the candidate,</li>
 * <li>otherwise upload of segments and descriptor,</li>
 * <li>lease re-check and atomic meta commit.</li>
 * </ol>
 * Shared by all tablets; holds no per-tablet state.
 */
@Slf4j
@RequiredArgsConstructor
public class TabletCooldownHandler {

    private final StorageRegistryPort registry;
    private final RemoteRowsetUploader uploader;
    private final CooldownMetaFinder metaFinder;
    private final CooldownOptions options;
    private final Clock clock;

    private record ResolvedResource(String resourceId, RemoteBackend backend) {
    }

    public Result<CooldownOutcome> cooldown(Tablet tablet) {
        if (!tablet.isCooldownOwner()) {
            String message = "Replica " + tablet.replicaId() + " does not hold the cooldown lease of tablet "
                + tablet.tabletId() + " " + tablet.cooldownConf();
            log.debug(message);
            return Result.failure(message, CooldownError.NOT_COOLDOWN_OWNER);
        }
        long policyId = tablet.storagePolicyId();
        if (policyId == StoragePolicy.NO_POLICY) {
            return Result.success(CooldownOutcome.LOCAL_ONLY);
        }
        // the term that names the descriptor; the commit re-checks the live lease
        CooldownConf conf = tablet.cooldownConf();

        Instant cutoff = clock.instant().minus(options.cooldownDelay());
        Optional<RowsetMeta> candidate = tablet.beginMigration(cutoff);
        if (candidate.isEmpty()) {
            return Result.success(CooldownOutcome.NO_CANDIDATE);
        }
        // only the attempt holding a candidate drives the tablet's state
        tablet.transitionTo(CooldownState.SELECTING_CANDIDATE);

        Set<RowsetId> marked = new LinkedHashSet<>();
        marked.add(candidate.get().rowsetId());
        try {
            return cooldownCandidate(tablet, policyId, conf, candidate.get(), marked);
        } finally {
            marked.forEach(tablet::endMigration);
            tablet.transitionTo(CooldownState.IDLE);
        }
    }

    private Result<CooldownOutcome> cooldownCandidate(Tablet tablet, long policyId, CooldownConf conf,
                                                      RowsetMeta candidate, Set<RowsetId> marked) {
        Result<ResolvedResource> resolved = resolveResource(tablet, policyId);
        if (resolved.isFailure()) {
            return resolved.propagate();
        }
        String resourceId = resolved.getData().orElseThrow().resourceId();
        RemoteBackend backend = resolved.getData().orElseThrow().backend();

        Optional<LocatedCooldownMeta> existing;
        try {
            backend.connect();
            existing = metaFinder.findLatest(backend, tablet.tabletId(), conf.term());
        } catch (IOException e) {
            log.warn("Failed to look up cooldown meta of tablet {} on backend {}", tablet.tabletId(), backend.id(), e);
            return Result.failure("Backend " + backend.id() + " unusable for tablet " + tablet.tabletId() + ": "
                + e.getMessage(), CooldownError.UPLOAD_FAILURE);
        }

        if (existing.isPresent()) {
            List<RowsetMeta> adopted = planAdoption(tablet, candidate, existing.get().meta(), resourceId, marked);
            if (!adopted.isEmpty()) {
                return adopt(tablet, backend, conf, existing.get(), adopted);
            }
        }

        tablet.transitionTo(CooldownState.UPLOADING);
        Result<RowsetMeta> uploaded = uploader.upload(backend, resourceId, tablet.replicaId(), conf.term(),
            candidate, tablet.meta().remoteRowsets());
        if (uploaded.isFailure()) {
            return uploaded.propagate();
        }

        tablet.transitionTo(CooldownState.COMMITTING);
        Result<Void> committed = tablet.commitCooldown(List.of(uploaded.getData().orElseThrow()));
        if (committed.isFailure()) {
            return committed.propagate();
        }
        log.info("Tablet {} cooled down rowset {} {} to resource {} (term {})", tablet.tabletId(),
            candidate.rowsetId(), candidate.version(), resourceId, conf.term());
        return Result.success(CooldownOutcome.UPLOADED);
    }

    private Result<ResolvedResource> resolveResource(Tablet tablet, long policyId) {
        Optional<StoragePolicy> policy = registry.getStoragePolicy(policyId);
        if (policy.isEmpty()) {
            String message = "Storage policy " + policyId + " of tablet " + tablet.tabletId() + " is not registered";
            log.warn(message);
            return Result.failure(message, CooldownError.CONFIGURATION_ERROR);
        }
        String resourceId = policy.get().resourceId();
        Optional<StorageResource> resource = registry.getStorageResource(resourceId);
        if (resource.isEmpty()) {
            String message = "Storage resource " + resourceId + " of policy '" + policy.get().name()
                + "' is not registered";
            log.warn(message);
            return Result.failure(message, CooldownError.CONFIGURATION_ERROR);
        }
        return Result.success(new ResolvedResource(resourceId, resource.get().backend()));
    }

    /**
     * Matches the descriptor against the tablet's local rowsets, starting at the
     * candidate and stopping at the first rowset the descriptor does not cover with the
     * same data. Every adopted rowset is marked migrating.
     */
    private List<RowsetMeta> planAdoption(Tablet tablet, RowsetMeta candidate, CooldownMeta descriptor,
                                          String resourceId, Set<RowsetId> marked) {
        List<RowsetMeta> adopted = new ArrayList<>();
        for (RowsetMeta local : tablet.rowsetMetas()) {
            if (local.version().compareTo(candidate.version()) < 0) {
                continue;
            }
            Optional<RowsetMeta> remote = descriptor.findByVersion(local.version());
            if (remote.isEmpty() || !remote.get().hasSameDataAs(local)) {
                if (remote.isPresent()) {
                    log.warn("Cooldown meta of tablet {} describes {} differently than the local rowset {}",
                        tablet.tabletId(), local.version(), local.rowsetId());
                }
                break;
            }
            boolean isCandidate = local.rowsetId().equals(candidate.rowsetId());
            if (!isCandidate && !tablet.tryMarkMigrating(local)) {
                break;
            }
            if (!isCandidate) {
                marked.add(local.rowsetId());
            }
            adopted.add(local.toRemote(resourceId, remote.get().remoteSegmentPaths()));
        }
        return adopted;
    }

    private Result<CooldownOutcome> adopt(Tablet tablet, RemoteBackend backend, CooldownConf conf,
                                          LocatedCooldownMeta existing, List<RowsetMeta> adopted) {
        String ownPath = StorageLayout.cooldownMetaPath(tablet.tabletId(), tablet.replicaId(), conf.term());
        try {
            if (!existing.path().equals(ownPath) && !backend.exists(ownPath)) {
                backend.linkFile(existing.path(), ownPath);
            }
        } catch (RemoteStorageException e) {
            log.warn("Failed to link cooldown meta {} to {}", existing.path(), ownPath, e);
            return Result.failure("Failed to link cooldown meta " + existing.path() + ": " + e.getMessage(),
                CooldownError.UPLOAD_FAILURE);
        }

        tablet.transitionTo(CooldownState.COMMITTING);
        Result<Void> committed = tablet.commitCooldown(adopted);
        if (committed.isFailure()) {
            return committed.propagate();
        }
        log.info("Tablet {} adopted {} remote rowsets from {} ({} to {})", tablet.tabletId(), adopted.size(),
            existing.path(), adopted.get(0).version(), adopted.get(adopted.size() - 1).version());
        return Result.success(CooldownOutcome.ADOPTED);
    }
}
