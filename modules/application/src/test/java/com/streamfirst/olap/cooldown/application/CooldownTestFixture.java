package com.streamfirst.olap.cooldown.application;

import com.streamfirst.olap.cooldown.adapters.InMemoryStorageRegistryAdapter;
import com.streamfirst.olap.cooldown.adapters.InMemoryTabletMetaStore;
import com.streamfirst.olap.cooldown.domain.RowsetId;
import com.streamfirst.olap.cooldown.domain.RowsetMeta;
import com.streamfirst.olap.cooldown.domain.StorageLayout;
import com.streamfirst.olap.cooldown.domain.StoragePolicy;
import com.streamfirst.olap.cooldown.domain.Version;
import com.streamfirst.olap.cooldown.ports.RemoteBackend;
import com.streamfirst.olap.cooldown.ports.StorageRegistryPort;
import com.streamfirst.olap.cooldown.ports.StorageResource;
import com.streamfirst.olap.cooldown.ports.TabletMetaStorePort;
import com.streamfirst.olap.cooldown.ports.codec.MetaCodec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One replica process: local data root, meta store and tablet manager, wired to a
 * registry that can be shared with other replicas.
 */
final class CooldownTestFixture {

    static final String RESOURCE_ID = "10000";
    static final long POLICY_ID = 10002L;
    static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    final Path localRoot;
    final StorageRegistryPort registry;
    final TabletMetaStorePort metaStore;
    final MutableClock clock;
    final RowsetFiles rowsetFiles;
    final TabletCooldownHandler handler;
    final TabletManager tabletManager;

    CooldownTestFixture(Path localRoot, StorageRegistryPort registry, TabletMetaStorePort metaStore,
                        CooldownOptions options, MutableClock clock) {
        this.localRoot = localRoot;
        this.registry = registry;
        this.metaStore = metaStore;
        this.clock = clock;
        MetaCodec codec = new MetaCodec();
        this.rowsetFiles = new RowsetFiles(localRoot, registry);
        this.handler = new TabletCooldownHandler(registry, new RemoteRowsetUploader(rowsetFiles, codec),
            new CooldownMetaFinder(codec), options, clock);
        this.tabletManager = new TabletManager(metaStore, rowsetFiles, handler);
    }

    /**
     * Fixture with its own in-memory registry holding {@code backend} under
     * {@link #RESOURCE_ID} and policy {@link #POLICY_ID}.
     */
    static CooldownTestFixture withBackend(Path localRoot, RemoteBackend backend) {
        return new CooldownTestFixture(localRoot, registryWith(backend), new InMemoryTabletMetaStore(),
            CooldownOptions.defaults(), new MutableClock(START));
    }

    static StorageRegistryPort registryWith(RemoteBackend backend) {
        StorageRegistryPort registry = new InMemoryStorageRegistryAdapter();
        registry.putStorageResource(RESOURCE_ID, new StorageResource(backend, 1));
        registry.putStoragePolicy(POLICY_ID, new StoragePolicy("TabletCooldownTest", 1, RESOURCE_ID));
        return registry;
    }

    /**
     * Writes the given segment contents under the local root and publishes them as the
     * next rowset of the tablet, with one row per segment.
     */
    RowsetMeta publish(Tablet tablet, long start, long end, byte[]... segments) throws IOException {
        RowsetId rowsetId = RowsetId.generate();
        List<Long> sizes = new ArrayList<>();
        for (int i = 0; i < segments.length; i++) {
            Path path = StorageLayout.localSegmentPath(localRoot, tablet.tabletId(), rowsetId, i);
            Files.createDirectories(path.getParent());
            Files.write(path, segments[i]);
            sizes.add((long) segments[i].length);
        }
        RowsetMeta rowset = RowsetMeta.local(tablet.tabletId(), rowsetId, Version.of(start, end), segments.length,
            sizes, clock.instant());
        tablet.addIncRowset(rowset);
        return rowset;
    }

    /**
     * Creates a tablet holding the rowsets every test starts from: an empty {@code [0-1]}
     * and a one-segment {@code [2-2]}.
     */
    Tablet createTabletWithData(long tabletId, long replicaId, byte[] segment) throws IOException {
        Tablet tablet = tabletManager.createTablet(tabletId, 270068377, replicaId);
        publish(tablet, 0, 1);
        publish(tablet, 2, 2, segment);
        return tablet;
    }
}
