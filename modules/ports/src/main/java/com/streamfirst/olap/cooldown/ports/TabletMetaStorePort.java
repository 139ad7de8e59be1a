package com.streamfirst.olap.cooldown.ports;

import com.streamfirst.olap.cooldown.domain.TabletMeta;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Port for the local durable store of tablet metadata. A tablet's meta, including its
 * whole rowset index, is always written with a single atomic put.
 */
public interface TabletMetaStorePort {

    /**
     * Atomically replaces the stored meta of the tablet. After a failure the previously
     * stored meta is still the visible one.
     *
     * @throws IOException if the meta could not be made durable
     */
    void save(TabletMeta meta) throws IOException;

    Optional<TabletMeta> load(long tabletId) throws IOException;

    List<TabletMeta> loadAll() throws IOException;
}
