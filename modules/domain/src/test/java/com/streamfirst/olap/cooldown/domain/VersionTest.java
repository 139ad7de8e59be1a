package com.streamfirst.olap.cooldown.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VersionTest {

    @Test
    void rangeIsPrintedInclusive() {
        assertThat(Version.of(2, 4)).hasToString("[2-4]");
    }

    @Test
    void invalidRangesAreRejected() {
        assertThatThrownBy(() -> Version.of(-1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Version.of(3, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void contiguityAndOrder() {
        assertThat(Version.of(0, 1).isFollowedBy(Version.of(2, 2))).isTrue();
        assertThat(Version.of(0, 1).isFollowedBy(Version.of(3, 3))).isFalse();
        assertThat(Version.of(0, 1).isFollowedBy(Version.of(1, 1))).isFalse();

        List<Version> versions = new ArrayList<>(List.of(Version.of(5, 5), Version.of(0, 1), Version.of(2, 4)));
        versions.sort(null);
        assertThat(versions).containsExactly(Version.of(0, 1), Version.of(2, 4), Version.of(5, 5));
    }
}
