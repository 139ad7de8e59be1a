package com.streamfirst.olap.cooldown.ports;

import com.streamfirst.olap.cooldown.domain.StoragePolicy;

import java.util.Optional;

/**
 * Port for the process-wide registry of storage resources and storage policies.
 * Filled by configuration and administrative calls; read on every cooldown attempt.
 * Implementations must never expose a half-applied update to concurrent readers.
 */
public interface StorageRegistryPort {

    /**
     * Registers or replaces a storage resource.
     */
    void putStorageResource(String resourceId, StorageResource resource);

    /**
     * Registers or replaces a storage policy.
     */
    void putStoragePolicy(long policyId, StoragePolicy policy);

    Optional<StorageResource> getStorageResource(String resourceId);

    Optional<StoragePolicy> getStoragePolicy(long policyId);

    /**
     * Resolves a policy id all the way to its resource.
     *
     * @return the resource, or empty if the policy or its resource is not registered
     */
    default Optional<StorageResource> resolvePolicy(long policyId) {
        return getStoragePolicy(policyId).flatMap(policy -> getStorageResource(policy.resourceId()));
    }
}
