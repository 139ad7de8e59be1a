package com.streamfirst.olap.cooldown.domain;

/**
 * Locally cached copy of the cooldown lease of a tablet.
 * The term is a fencing token handed out by the external coordinator; a term of
 * zero means no lease was ever established.
 *
 * @param term monotonically increasing lease epoch
 * @param cooldownReplicaId replica allowed to cool the tablet down during {@code term}
 */
public record CooldownConf(long term, long cooldownReplicaId) {

    /** Lease state of a freshly created tablet. */
    public static final CooldownConf NONE = new CooldownConf(0, -1);

    public CooldownConf {
        if (term < 0) {
            throw new IllegalArgumentException("Cooldown term cannot be negative: " + term);
        }
    }

    /**
     * Returns true if a lease has been established.
     */
    public boolean isEstablished() {
        return term > 0;
    }
}
