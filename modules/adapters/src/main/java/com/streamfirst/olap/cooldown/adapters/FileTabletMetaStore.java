package com.streamfirst.olap.cooldown.adapters;

import com.streamfirst.olap.cooldown.domain.TabletMeta;
import com.streamfirst.olap.cooldown.ports.TabletMetaStorePort;
import com.streamfirst.olap.cooldown.ports.codec.MetaCodec;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * TabletMetaStorePort keeping one JSON file per tablet in a directory. A save writes
 * and syncs {@code <tablet_id>.json.txn}, then atomically renames it over
 * {@code <tablet_id>.json}; a crash in between leaves the previous meta in place.
 */
@Slf4j
public class FileTabletMetaStore implements TabletMetaStorePort {

    private static final String META_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".txn";

    private final Path directory;
    private final MetaCodec codec;

    public FileTabletMetaStore(Path directory, MetaCodec codec) throws IOException {
        this.directory = directory;
        this.codec = codec;
        Files.createDirectories(directory);
    }

    @Override
    public synchronized void save(TabletMeta meta) throws IOException {
        Path target = metaPath(meta.tabletId());
        Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            OutputStream out = Channels.newOutputStream(channel);
            codec.writeTabletMeta(meta, out);
            out.flush();
            channel.force(true);
        }
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug("Saved meta of tablet {} to {}", meta.tabletId(), target);
    }

    @Override
    public Optional<TabletMeta> load(long tabletId) throws IOException {
        Path path = metaPath(tabletId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(read(path));
    }

    @Override
    public List<TabletMeta> loadAll() throws IOException {
        List<TabletMeta> metas = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path path : files.filter(p -> p.getFileName().toString().endsWith(META_SUFFIX)).toList()) {
                metas.add(read(path));
            }
        }
        metas.sort(Comparator.comparingLong(TabletMeta::tabletId));
        return metas;
    }

    private TabletMeta read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return codec.readTabletMeta(in);
        }
    }

    private Path metaPath(long tabletId) {
        return directory.resolve(tabletId + META_SUFFIX);
    }
}
