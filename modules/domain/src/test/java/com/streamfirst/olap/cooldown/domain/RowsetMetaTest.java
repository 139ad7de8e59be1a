package com.streamfirst.olap.cooldown.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RowsetMetaTest {

    private static final Instant WRITTEN = Instant.parse("2026-02-01T00:00:00Z");

    private final RowsetMeta local = RowsetMeta.local(7L, RowsetId.of("r1"), Version.of(2, 2), 10,
        List.of(300L, 40L), WRITTEN);

    @Test
    void localRowsetHasNoRemoteLocation() {
        assertThat(local.isLocal()).isTrue();
        assertThat(local.resource()).isEmpty();
        assertThat(local.numSegments()).isEqualTo(2);
        assertThat(local.totalDiskSize()).isEqualTo(340);
    }

    @Test
    void remoteCopyChangesOnlyTheLocation() {
        RowsetMeta remote = local.toRemote("10000", List.of("data/7/r1_0.dat", "data/7/r1_1.dat"));

        assertThat(remote.isLocal()).isFalse();
        assertThat(remote.resource()).contains("10000");
        assertThat(remote.rowsetId()).isEqualTo(local.rowsetId());
        assertThat(remote.hasSameDataAs(local)).isTrue();
        assertThat(remote.newestWriteTimestamp()).isEqualTo(WRITTEN);
    }

    @Test
    void remoteRowsetNeedsAPathPerSegment() {
        assertThatThrownBy(() -> local.toRemote("10000", List.of("data/7/r1_0.dat")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("1 segment paths for 2 segments");
    }

    @Test
    void localRowsetCannotCarryRemotePaths() {
        assertThatThrownBy(() -> new RowsetMeta(7L, RowsetId.of("r1"), Version.of(2, 2), 10, List.of(1L), WRITTEN,
            null, List.of("data/7/r1_0.dat")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void differentSizesOrRowsAreDifferentData() {
        RowsetMeta otherId = RowsetMeta.local(7L, RowsetId.of("r2"), Version.of(2, 2), 10, List.of(300L, 40L),
            WRITTEN.plusSeconds(5));
        RowsetMeta otherRows = RowsetMeta.local(7L, RowsetId.of("r3"), Version.of(2, 2), 11, List.of(300L, 40L),
            WRITTEN);
        RowsetMeta otherSizes = RowsetMeta.local(7L, RowsetId.of("r4"), Version.of(2, 2), 10, List.of(300L, 41L),
            WRITTEN);

        assertThat(local.hasSameDataAs(otherId)).isTrue();
        assertThat(local.hasSameDataAs(otherRows)).isFalse();
        assertThat(local.hasSameDataAs(otherSizes)).isFalse();
    }

    @Test
    void rowsetIdsAreAlphanumeric() {
        assertThat(RowsetId.generate().value()).matches("[A-Za-z0-9]+");
        assertThatThrownBy(() -> RowsetId.of("../etc")).isInstanceOf(IllegalArgumentException.class);
    }
}
