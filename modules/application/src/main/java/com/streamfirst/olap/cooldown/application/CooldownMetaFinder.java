package com.streamfirst.olap.cooldown.application;

import com.streamfirst.olap.cooldown.domain.CooldownMeta;
import com.streamfirst.olap.cooldown.domain.StorageLayout;
import com.streamfirst.olap.cooldown.domain.StorageLayout.MetaFileName;
import com.streamfirst.olap.cooldown.ports.RemoteBackend;
import com.streamfirst.olap.cooldown.ports.codec.MalformedMetaException;
import com.streamfirst.olap.cooldown.ports.codec.MetaCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Looks up the newest cooldown descriptor of a tablet on a backend. Only a descriptor
 * counts as evidence of a finished upload; segment files without one are ignored.
 */
@Slf4j
@RequiredArgsConstructor
public class CooldownMetaFinder {

    private final MetaCodec codec;

    /**
     * A descriptor and the path it was read from.
     */
    public record LocatedCooldownMeta(String path, CooldownMeta meta) {
    }

    /**
     * Finds the descriptor with the highest term not above {@code maxTerm} in the
     * tablet's remote directory. A descriptor that does not decode is skipped in favour
     * of the next one down; it is overwritten when this replica uploads under that term.
     *
     * @throws IOException if listing or reading a descriptor fails
     */
    public Optional<LocatedCooldownMeta> findLatest(RemoteBackend backend, long tabletId, long maxTerm)
            throws IOException {
        List<MetaFileName> names = backend.list(StorageLayout.remoteTabletDir(tabletId)).stream()
            .map(StorageLayout::parseCooldownMetaName)
            .flatMap(Optional::stream)
            .filter(name -> name.term() <= maxTerm)
            .sorted(Comparator.comparingLong(MetaFileName::term).thenComparingLong(MetaFileName::replicaId)
                .reversed())
            .toList();

        for (MetaFileName name : names) {
            String path = name.path();
            try (InputStream in = backend.openFile(path)) {
                CooldownMeta meta = codec.readCooldownMeta(in);
                if (meta.tabletId() != tabletId) {
                    log.debug("Cooldown meta {} in tablet {} was written for tablet {}",
                        path, tabletId, meta.tabletId());
                }
                return Optional.of(new LocatedCooldownMeta(path, meta));
            } catch (MalformedMetaException e) {
                log.warn("Skipping unreadable cooldown meta {} of tablet {} on backend {}: {}",
                    path, tabletId, backend.id(), e.getMessage());
            }
        }
        return Optional.empty();
    }
}
