package com.streamfirst.olap.cooldown.boot;

import com.streamfirst.olap.cooldown.adapters.FileTabletMetaStore;
import com.streamfirst.olap.cooldown.adapters.InMemoryRemoteBackend;
import com.streamfirst.olap.cooldown.adapters.InMemoryStorageRegistryAdapter;
import com.streamfirst.olap.cooldown.adapters.LocalDirectoryRemoteBackend;
import com.streamfirst.olap.cooldown.application.CooldownMetaFinder;
import com.streamfirst.olap.cooldown.application.CooldownOptions;
import com.streamfirst.olap.cooldown.application.CooldownService;
import com.streamfirst.olap.cooldown.application.RemoteRowsetUploader;
import com.streamfirst.olap.cooldown.application.RowsetFiles;
import com.streamfirst.olap.cooldown.application.TabletCooldownHandler;
import com.streamfirst.olap.cooldown.application.TabletManager;
import com.streamfirst.olap.cooldown.domain.StoragePolicy;
import com.streamfirst.olap.cooldown.ports.RemoteBackend;
import com.streamfirst.olap.cooldown.ports.StorageRegistryPort;
import com.streamfirst.olap.cooldown.ports.StorageResource;
import com.streamfirst.olap.cooldown.ports.TabletMetaStorePort;
import com.streamfirst.olap.cooldown.ports.codec.MetaCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the cooldown engine: adapters for the registry, the remote backends and the
 * meta store, and the application services on top of them.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(CooldownProperties.class)
public class CooldownAppConfiguration {

    // --- Adapter Beans ---

    @Bean
    public Clock cooldownClock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetaCodec metaCodec() {
        return new MetaCodec();
    }

    @Bean
    public StorageRegistryPort storageRegistry(CooldownProperties properties) {
        StorageRegistryPort registry = new InMemoryStorageRegistryAdapter();
        for (CooldownProperties.Resource resource : properties.resources()) {
            registry.putStorageResource(resource.id(), new StorageResource(createBackend(resource), resource.version()));
        }
        for (CooldownProperties.Policy policy : properties.policies()) {
            registry.putStoragePolicy(policy.id(), new StoragePolicy(policy.name(), policy.version(), policy.resourceId()));
        }
        return registry;
    }

    @Bean
    public TabletMetaStorePort tabletMetaStore(CooldownProperties properties, MetaCodec metaCodec) throws IOException {
        return new FileTabletMetaStore(Path.of(properties.metaDir()), metaCodec);
    }

    // --- Application Service Beans ---

    @Bean
    public CooldownOptions cooldownOptions(CooldownProperties properties) {
        return new CooldownOptions(properties.delay(), properties.workerThreads(),
            properties.backoff().initial(), properties.backoff().max());
    }

    @Bean
    public RowsetFiles rowsetFiles(CooldownProperties properties, StorageRegistryPort storageRegistry) {
        return new RowsetFiles(Path.of(properties.localRoot()), storageRegistry);
    }

    @Bean
    public TabletCooldownHandler tabletCooldownHandler(StorageRegistryPort storageRegistry, RowsetFiles rowsetFiles,
                                                       MetaCodec metaCodec, CooldownOptions cooldownOptions,
                                                       Clock cooldownClock) {
        return new TabletCooldownHandler(storageRegistry, new RemoteRowsetUploader(rowsetFiles, metaCodec),
            new CooldownMetaFinder(metaCodec), cooldownOptions, cooldownClock);
    }

    @Bean
    public TabletManager tabletManager(TabletMetaStorePort tabletMetaStore, RowsetFiles rowsetFiles,
                                       TabletCooldownHandler tabletCooldownHandler) throws IOException {
        TabletManager manager = new TabletManager(tabletMetaStore, rowsetFiles, tabletCooldownHandler);
        manager.loadTablets();
        return manager;
    }

    @Bean(destroyMethod = "close")
    public CooldownService cooldownService(TabletManager tabletManager, CooldownOptions cooldownOptions,
                                           Clock cooldownClock) {
        return new CooldownService(tabletManager, cooldownOptions, cooldownClock);
    }

    @Bean
    public CooldownScheduler cooldownScheduler(CooldownService cooldownService) {
        return new CooldownScheduler(cooldownService);
    }

    private static RemoteBackend createBackend(CooldownProperties.Resource resource) {
        switch (resource.type()) {
            case "directory":
                if (resource.root() == null) {
                    throw new IllegalArgumentException("Directory resource " + resource.id() + " needs a root");
                }
                return new LocalDirectoryRemoteBackend(resource.id(), Path.of(resource.root()));
            case "memory":
                log.warn("Resource {} keeps cooled data in memory; it is lost on restart", resource.id());
                return new InMemoryRemoteBackend(resource.id());
            default:
                throw new IllegalArgumentException("Unknown type '" + resource.type() + "' of resource " + resource.id());
        }
    }
}
