package com.streamfirst.olap.cooldown.domain;

/**
 * Failure codes of the cooldown protocol. Every code is returned to the caller as a
 * {@link Result} failure; none of them is thrown.
 */
public enum CooldownError {
    /** Another replica holds the lease, or none was established yet. */
    NOT_COOLDOWN_OWNER(false),
    /** Two lease updates named different replicas for the same term. */
    CONFLICTING_LEASE(false),
    /** The tablet's storage policy or its resource is not registered. */
    CONFIGURATION_ERROR(true),
    /** Writing segments or the remote descriptor failed. */
    UPLOAD_FAILURE(true),
    /** The lease moved to another replica while the upload was running. */
    LEASE_EXPIRED(true),
    /** The tablet meta could not be written to the local meta store. */
    METADATA_PERSIST_ERROR(true);

    private final boolean retryable;

    CooldownError(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Returns true if a later attempt may succeed without operator action on the lease.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
