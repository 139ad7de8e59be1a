package com.streamfirst.olap.cooldown.domain;

/**
 * Steps of a single cooldown attempt on a tablet. A tablet is {@link #IDLE}
 * between attempts, whatever the outcome of the previous one.
 */
public enum CooldownState {
    IDLE,
    SELECTING_CANDIDATE,
    UPLOADING,
    COMMITTING
}
