package com.streamfirst.olap.cooldown.ports.codec;

import com.streamfirst.olap.cooldown.domain.CooldownConf;
import com.streamfirst.olap.cooldown.domain.CooldownMeta;
import com.streamfirst.olap.cooldown.domain.RowsetId;
import com.streamfirst.olap.cooldown.domain.RowsetMeta;
import com.streamfirst.olap.cooldown.domain.TabletMeta;
import com.streamfirst.olap.cooldown.domain.Version;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetaCodecTest {

    private static final Instant WRITTEN = Instant.parse("2026-02-01T08:30:00.123Z");

    private final MetaCodec codec = new MetaCodec();

    @Test
    void tabletMetaSurvivesEncoding() throws IOException {
        RowsetMeta local = RowsetMeta.local(15007L, RowsetId.of("a1"), Version.of(0, 1), 0, List.of(), WRITTEN);
        RowsetMeta remote = RowsetMeta.local(15007L, RowsetId.of("b2"), Version.of(2, 2), 4, List.of(512L), WRITTEN)
            .toRemote("10000", List.of("data/15007/b2_0.dat"));
        TabletMeta meta = new TabletMeta(15007L, 270068377, 10001L, 10002L, new CooldownConf(2, 10001L),
            List.of(local, remote));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        codec.writeTabletMeta(meta, out);
        String json = out.toString(StandardCharsets.UTF_8);

        assertThat(json).contains("\"newestWriteTimestamp\":\"2026-02-01T08:30:00.123Z\"");
        assertThat(codec.readTabletMeta(new ByteArrayInputStream(out.toByteArray()))).isEqualTo(meta);
    }

    @Test
    void descriptorFromANewerWriterIsStillReadable() throws IOException {
        String json = """
            {"tabletId":15007,"replicaId":10001,"term":3,"writer":"v2",
             "rowsets":[{"tabletId":15007,"rowsetId":"b2","startVersion":2,"endVersion":2,"numRows":4,
                         "segmentSizes":[512],"newestWriteTimestamp":"2026-02-01T08:30:00.123Z",
                         "resourceId":"10000","segmentPaths":["data/15007/b2_0.dat"],"checksum":"abc"}]}
            """;

        CooldownMeta meta = codec.readCooldownMeta(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        assertThat(meta.term()).isEqualTo(3);
        assertThat(meta.findByVersion(Version.of(2, 2))).hasValueSatisfying(rowset -> {
            assertThat(rowset.resource()).contains("10000");
            assertThat(rowset.remoteSegmentPaths()).containsExactly("data/15007/b2_0.dat");
            assertThat(rowset.newestWriteTimestamp()).isEqualTo(WRITTEN);
        });
    }

    @Test
    void encodedDescriptorIsReadBack() throws IOException {
        RowsetMeta remote = RowsetMeta.local(1L, RowsetId.of("c3"), Version.of(0, 1), 0, List.of(), WRITTEN)
            .toRemote("10000", List.of());
        CooldownMeta meta = new CooldownMeta(1L, 10001L, 1, List.of(remote));

        byte[] encoded = codec.encodeCooldownMeta(meta);

        assertThat(codec.readCooldownMeta(new ByteArrayInputStream(encoded))).isEqualTo(meta);
    }

    @Test
    void descriptorListingALocalRowsetIsRejected() {
        String json = """
            {"tabletId":1,"replicaId":10001,"term":1,
             "rowsets":[{"tabletId":1,"rowsetId":"c3","startVersion":0,"endVersion":1,"numRows":0,
                         "newestWriteTimestamp":"2026-02-01T08:30:00Z"}]}
            """;

        assertThatThrownBy(() -> codec.readCooldownMeta(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))))
            .isInstanceOf(MalformedMetaException.class)
            .hasMessageContaining("local rowset c3");
    }

    @Test
    void truncatedDescriptorIsMalformed() throws IOException {
        CooldownMeta meta = new CooldownMeta(1L, 10001L, 2L, List.of());
        byte[] encoded = codec.encodeCooldownMeta(meta);
        byte[] truncated = Arrays.copyOf(encoded, encoded.length / 2);

        assertThatThrownBy(() -> codec.readCooldownMeta(new ByteArrayInputStream(truncated)))
            .isInstanceOf(MalformedMetaException.class);
        assertThatThrownBy(() -> codec.readCooldownMeta(new ByteArrayInputStream(new byte[0])))
            .isInstanceOf(MalformedMetaException.class);
    }
}
