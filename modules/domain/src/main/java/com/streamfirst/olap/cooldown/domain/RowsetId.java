package com.streamfirst.olap.cooldown.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Identifier of a rowset, unique within its tablet.
 * Rowset ids appear in segment file names, so they are restricted to
 * characters that are safe in both local and remote paths.
 */
public record RowsetId(String value) {
    public RowsetId {
        Objects.requireNonNull(value, "Rowset id cannot be null");
        if (!value.matches("[A-Za-z0-9]+")) {
            throw new IllegalArgumentException("Rowset id must be alphanumeric: " + value);
        }
    }

    public static RowsetId of(String value) {
        return new RowsetId(value);
    }

    /**
     * Generates a new random rowset id.
     */
    public static RowsetId generate() {
        return new RowsetId(UUID.randomUUID().toString().replace("-", ""));
    }

    @Override
    public String toString() {
        return value;
    }
}
