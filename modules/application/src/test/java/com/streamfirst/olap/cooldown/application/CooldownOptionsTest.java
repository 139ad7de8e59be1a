package com.streamfirst.olap.cooldown.application;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CooldownOptionsTest {

    @Test
    void negativeInitialBackoffIsRejected() {
        assertThatThrownBy(() -> new CooldownOptions(Duration.ZERO, 1, Duration.ofSeconds(-1), Duration.ofSeconds(30)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("back-off");
    }

    @Test
    void initialBackoffAboveMaxIsRejected() {
        assertThatThrownBy(() -> new CooldownOptions(Duration.ZERO, 1, Duration.ofMinutes(2), Duration.ofMinutes(1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void otherLimits() {
        assertThatThrownBy(() -> new CooldownOptions(Duration.ofSeconds(-5), 1, Duration.ZERO, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CooldownOptions(Duration.ZERO, 0, Duration.ZERO, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(new CooldownOptions(Duration.ZERO, 1, Duration.ZERO, Duration.ZERO).initialBackoff()).isZero();
    }
}
