package com.streamfirst.olap.cooldown.application;

import com.streamfirst.olap.cooldown.domain.TabletMeta;
import com.streamfirst.olap.cooldown.ports.TabletMetaStorePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the tablets of this replica process: creates new ones, reopens persisted ones
 * and hands them out to the cooldown scheduler and to operators.
 */
@Slf4j
@RequiredArgsConstructor
public class TabletManager {

    private final TabletMetaStorePort metaStore;
    private final RowsetFiles rowsetFiles;
    private final TabletCooldownHandler cooldownHandler;

    private final Map<Long, Tablet> tablets = new ConcurrentHashMap<>();

    /**
     * Creates an empty tablet replica and persists its initial meta.
     *
     * @throws IllegalStateException if the tablet already exists
     * @throws IOException if the initial meta cannot be persisted
     */
    public synchronized Tablet createTablet(long tabletId, int schemaHash, long replicaId) throws IOException {
        if (tablets.containsKey(tabletId) || metaStore.load(tabletId).isPresent()) {
            throw new IllegalStateException("Tablet " + tabletId + " already exists");
        }
        TabletMeta meta = TabletMeta.create(tabletId, schemaHash, replicaId);
        metaStore.save(meta);
        Tablet tablet = open(meta);
        log.info("Created tablet {} (schema hash {}, replica {})", tabletId, schemaHash, replicaId);
        return tablet;
    }

    /**
     * Opens every tablet found in the meta store that is not open yet.
     *
     * @return number of tablets opened
     */
    public synchronized int loadTablets() throws IOException {
        List<TabletMeta> metas = metaStore.loadAll();
        int opened = 0;
        for (TabletMeta meta : metas) {
            if (!tablets.containsKey(meta.tabletId())) {
                open(meta);
                opened++;
            }
        }
        log.info("Loaded {} tablets from the meta store", opened);
        return opened;
    }

    public Optional<Tablet> getTablet(long tabletId) {
        return Optional.ofNullable(tablets.get(tabletId));
    }

    public Collection<Tablet> tablets() {
        return List.copyOf(tablets.values());
    }

    private Tablet open(TabletMeta meta) {
        Tablet tablet = new Tablet(meta, metaStore, rowsetFiles, cooldownHandler);
        tablets.put(meta.tabletId(), tablet);
        return tablet;
    }
}
