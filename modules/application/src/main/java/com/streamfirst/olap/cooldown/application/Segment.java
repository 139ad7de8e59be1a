package com.streamfirst.olap.cooldown.application;

/**
 * A loaded segment of a rowset.
 *
 * @param index position of the segment in its rowset
 * @param path local file path or remote path, depending on {@code local}
 * @param size size in bytes as found in storage
 * @param local true if read from local disk
 */
public record Segment(int index, String path, long size, boolean local) {
}
