package com.streamfirst.olap.cooldown.domain;

/**
 * Inclusive version range {@code [start, end]} covered by a rowset.
 * Ranges of one tablet are disjoint and contiguous; they are ordered by their start.
 *
 * @param start first version contained in the range
 * @param end last version contained in the range
 */
public record Version(long start, long end) implements Comparable<Version> {
    public Version {
        if (start < 0) {
            throw new IllegalArgumentException("Version start cannot be negative: " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException("Version end " + end + " is before start " + start);
        }
    }

    public static Version of(long start, long end) {
        return new Version(start, end);
    }

    /**
     * Returns true if {@code next} starts right after this range ends.
     */
    public boolean isFollowedBy(Version next) {
        return next.start == end + 1;
    }

    @Override
    public int compareTo(Version other) {
        int byStart = Long.compare(start, other.start);
        return byStart != 0 ? byStart : Long.compare(end, other.end);
    }

    @Override
    public String toString() {
        return "[" + start + "-" + end + "]";
    }
}
