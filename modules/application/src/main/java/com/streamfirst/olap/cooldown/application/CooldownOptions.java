package com.streamfirst.olap.cooldown.application;

import lombok.NonNull;

import java.time.Duration;

/**
 * Tuning of the cooldown engine.
 *
 * @param cooldownDelay minimum age of a rowset's newest write before it may be cooled down
 * @param workerThreads size of the pool running cooldown attempts
 * @param initialBackoff wait after the first retryable failure of a tablet
 * @param maxBackoff upper bound of the doubling back-off
 */
public record CooldownOptions(
    @NonNull Duration cooldownDelay,
    int workerThreads,
    @NonNull Duration initialBackoff,
    @NonNull Duration maxBackoff
) {
    public CooldownOptions {
        if (cooldownDelay.isNegative()) {
            throw new IllegalArgumentException("Cooldown delay cannot be negative: " + cooldownDelay);
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("At least one cooldown worker thread is required");
        }
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("Initial back-off cannot be negative: " + initialBackoff);
        }
        if (initialBackoff.compareTo(maxBackoff) > 0) {
            throw new IllegalArgumentException("Initial back-off " + initialBackoff + " exceeds max " + maxBackoff);
        }
    }

    public static CooldownOptions defaults() {
        return new CooldownOptions(Duration.ZERO, 4, Duration.ofSeconds(10), Duration.ofMinutes(10));
    }

    public CooldownOptions withCooldownDelay(Duration delay) {
        return new CooldownOptions(delay, workerThreads, initialBackoff, maxBackoff);
    }
}
