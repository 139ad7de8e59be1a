package com.streamfirst.olap.cooldown.adapters;

import com.streamfirst.olap.cooldown.domain.TabletMeta;
import com.streamfirst.olap.cooldown.ports.TabletMetaStorePort;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of TabletMetaStorePort for testing and development.
 * Data is lost when the process stops.
 */
@Slf4j
public class InMemoryTabletMetaStore implements TabletMetaStorePort {

    private final Map<Long, TabletMeta> metas = new ConcurrentHashMap<>();

    @Override
    public void save(TabletMeta meta) {
        metas.put(meta.tabletId(), meta);
        log.debug("Saved meta of tablet {} ({} rowsets)", meta.tabletId(), meta.rowsets().size());
    }

    @Override
    public Optional<TabletMeta> load(long tabletId) {
        return Optional.ofNullable(metas.get(tabletId));
    }

    @Override
    public List<TabletMeta> loadAll() {
        return metas.values().stream()
            .sorted(Comparator.comparingLong(TabletMeta::tabletId))
            .toList();
    }
}
