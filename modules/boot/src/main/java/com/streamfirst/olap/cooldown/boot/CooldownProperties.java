package com.streamfirst.olap.cooldown.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * {@code cooldown.*} settings: local layout, engine tuning, and the storage resources
 * and policies registered at startup.
 */
@ConfigurationProperties(prefix = "cooldown")
public record CooldownProperties(
    @DefaultValue("data") String localRoot,
    @DefaultValue("meta") String metaDir,
    @DefaultValue("0s") Duration delay,
    @DefaultValue("4") int workerThreads,
    @DefaultValue Backoff backoff,
    List<Resource> resources,
    List<Policy> policies
) {
    public CooldownProperties {
        resources = resources == null ? List.of() : List.copyOf(resources);
        policies = policies == null ? List.of() : List.copyOf(policies);
    }

    public record Backoff(@DefaultValue("10s") Duration initial, @DefaultValue("10m") Duration max) {
    }

    /**
     * A storage resource. {@code type} is {@code directory} (needs {@code root}) or {@code memory}.
     */
    public record Resource(String id, @DefaultValue("directory") String type, String root,
                           @DefaultValue("1") long version) {
    }

    public record Policy(long id, String name, @DefaultValue("1") long version, String resourceId) {
    }
}
