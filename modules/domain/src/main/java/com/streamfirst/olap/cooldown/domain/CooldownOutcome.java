package com.streamfirst.olap.cooldown.domain;

/**
 * What a successful cooldown attempt did.
 */
public enum CooldownOutcome {
    /** Nothing was eligible; no metadata changed. */
    NO_CANDIDATE,
    /** The tablet has no storage policy and stays on local disk. */
    LOCAL_ONLY,
    /** A rowset was uploaded and its location switched to remote. */
    UPLOADED,
    /** Rowsets were switched to remote copies that already existed, without uploading. */
    ADOPTED,
    /** Another cooldown of the same tablet is still running. */
    IN_PROGRESS;

    /**
     * Returns true if the attempt changed the tablet's rowset index.
     */
    public boolean changedMetadata() {
        return this == UPLOADED || this == ADOPTED;
    }
}
