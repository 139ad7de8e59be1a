package com.streamfirst.olap.cooldown.domain;

import lombok.NonNull;

/**
 * Named storage policy. Tablets reference a policy by id; the policy points at the
 * storage resource that cooled data is written to, so a policy can be repointed
 * without touching tablet metadata.
 *
 * @param name policy name, for logs and operators
 * @param version policy revision, bumped by the administrator on every change
 * @param resourceId id of the storage resource backing this policy
 */
public record StoragePolicy(@NonNull String name, long version, @NonNull String resourceId) {

    /** Policy id meaning "no policy": the tablet stays on local disk. */
    public static final long NO_POLICY = 0L;
}
