package com.streamfirst.olap.cooldown.application;

import com.streamfirst.olap.cooldown.domain.CooldownConf;
import com.streamfirst.olap.cooldown.domain.CooldownError;
import com.streamfirst.olap.cooldown.domain.Result;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides which replica of a tablet may cool it down, from the locally cached lease.
 * The term is a fencing token: a higher term always wins, a lower one is a stale
 * message, and two different replicas for the same term mean the coordinator is broken.
 * Thread-safe.
 */
@Slf4j
public class CooldownConflictResolver {

    /**
     * How a lease update relates to the cached lease.
     */
    public enum Decision {
        /** Higher term: the update replaces the cached lease. */
        ACCEPT,
        /** Same term and replica: nothing to do. */
        UNCHANGED,
        /** Lower term: an out-of-order message, ignored. */
        STALE,
        /** Same term, different replica. */
        CONFLICT
    }

    private final long tabletId;
    private CooldownConf conf;

    public CooldownConflictResolver(long tabletId, @NonNull CooldownConf initial) {
        this.tabletId = tabletId;
        this.conf = initial;
    }

    /**
     * Classifies an update without applying it.
     */
    public synchronized Decision evaluate(long newTerm, long newReplicaId) {
        if (newTerm > conf.term()) {
            return Decision.ACCEPT;
        }
        if (newTerm < conf.term()) {
            return Decision.STALE;
        }
        return newReplicaId == conf.cooldownReplicaId() ? Decision.UNCHANGED : Decision.CONFLICT;
    }

    /**
     * Applies a lease update.
     *
     * @return true if the cached lease changed, false for stale or repeated updates;
     *         a {@link CooldownError#CONFLICTING_LEASE} failure if the same term names another replica
     */
    public synchronized Result<Boolean> update(long newTerm, long newReplicaId) {
        switch (evaluate(newTerm, newReplicaId)) {
            case ACCEPT -> {
                log.info("Tablet {} cooldown lease moves from {} to term {} replica {}",
                    tabletId, conf, newTerm, newReplicaId);
                conf = new CooldownConf(newTerm, newReplicaId);
                return Result.success(true);
            }
            case STALE -> {
                log.debug("Ignoring stale cooldown lease term {} for tablet {}, current {}", newTerm, tabletId, conf);
                return Result.success(false);
            }
            case UNCHANGED -> {
                return Result.success(false);
            }
            default -> {
                String message = "Tablet " + tabletId + " got replica " + newReplicaId + " for cooldown term "
                    + newTerm + " which already belongs to replica " + conf.cooldownReplicaId();
                log.error(message);
                return Result.failure(message, CooldownError.CONFLICTING_LEASE);
            }
        }
    }

    /**
     * Returns true if {@code selfReplicaId} holds an established lease.
     */
    public synchronized boolean isAuthorized(long selfReplicaId) {
        return conf.isEstablished() && conf.cooldownReplicaId() == selfReplicaId;
    }

    public synchronized CooldownConf current() {
        return conf;
    }
}
