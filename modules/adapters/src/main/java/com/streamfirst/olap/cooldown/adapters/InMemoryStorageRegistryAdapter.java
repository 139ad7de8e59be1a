package com.streamfirst.olap.cooldown.adapters;

import com.streamfirst.olap.cooldown.domain.StoragePolicy;
import com.streamfirst.olap.cooldown.ports.StorageRegistryPort;
import com.streamfirst.olap.cooldown.ports.StorageResource;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of StorageRegistryPort.
 * Registrations replace an immutable snapshot of each map (copy-on-write), so
 * concurrent cooldown attempts read either the old or the new registration, never a
 * partial one. Writers are serialized on the adapter's monitor.
 */
@Slf4j
public class InMemoryStorageRegistryAdapter implements StorageRegistryPort {

    private volatile Map<String, StorageResource> resources = Map.of();

    private volatile Map<Long, StoragePolicy> policies = Map.of();

    @Override
    public synchronized void putStorageResource(@NonNull String resourceId, @NonNull StorageResource resource) {
        Map<String, StorageResource> updated = new HashMap<>(resources);
        StorageResource previous = updated.put(resourceId, resource);
        resources = Map.copyOf(updated);

        if (previous == null) {
            log.info("Registered storage resource {} (backend {}, version {})",
                resourceId, resource.backend().id(), resource.version());
        } else {
            log.info("Replaced storage resource {}: version {} -> {}",
                resourceId, previous.version(), resource.version());
        }
    }

    @Override
    public synchronized void putStoragePolicy(long policyId, @NonNull StoragePolicy policy) {
        if (policyId == StoragePolicy.NO_POLICY) {
            throw new IllegalArgumentException("Policy id " + StoragePolicy.NO_POLICY + " is reserved for local-only tablets");
        }
        StoragePolicy previous = policies.get(policyId);
        if (previous != null && previous.version() > policy.version()) {
            log.warn("Ignoring storage policy {} version {}: version {} is already registered",
                policyId, policy.version(), previous.version());
            return;
        }
        Map<Long, StoragePolicy> updated = new HashMap<>(policies);
        updated.put(policyId, policy);
        policies = Map.copyOf(updated);

        log.info("Registered storage policy {} '{}' version {} on resource {}",
            policyId, policy.name(), policy.version(), policy.resourceId());
    }

    @Override
    public Optional<StorageResource> getStorageResource(String resourceId) {
        return Optional.ofNullable(resources.get(resourceId));
    }

    @Override
    public Optional<StoragePolicy> getStoragePolicy(long policyId) {
        return Optional.ofNullable(policies.get(policyId));
    }
}
