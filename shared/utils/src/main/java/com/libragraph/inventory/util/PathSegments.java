package com.libragraph.inventory.util;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Splits and truncates {@code /}-delimited object keys.
 *
 * <p>The last segment of a key is its leaf (object) name; every segment before
 * it is a directory segment. Empty segments are preserved, so a folder marker
 * like {@code a/b/} has directory segments {@code [a, b]} and an empty leaf.
 */
public final class PathSegments {

    public static final char SEPARATOR = '/';

    private static final String SEPARATOR_STRING = String.valueOf(SEPARATOR);

    private PathSegments() {
    }

    /** Splits a key into all of its segments, leaf included. */
    public static List<String> split(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        return Arrays.asList(key.split(SEPARATOR_STRING, -1));
    }

    /** Number of directory segments (all segments except the leaf). */
    public static int directoryDepth(String key) {
        int count = 0;
        for (int i = 0; i < key.length(); i++) {
            if (key.charAt(i) == SEPARATOR) count++;
        }
        return count;
    }

    /**
     * Returns the grouping path of a key at the given depth.
     *
     * <ul>
     *   <li>depth 0: the empty string (one group for the whole bucket)</li>
     *   <li>depth within the directory segments: the first {@code depth} segments</li>
     *   <li>depth beyond the directory segments: the full key</li>
     * </ul>
     *
     * @throws IllegalArgumentException if depth is negative
     */
    public static String truncate(String key, int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be >= 0, got: " + depth);
        }
        if (depth == 0) {
            return "";
        }
        int end = -1;
        for (int i = 0; i < depth; i++) {
            end = key.indexOf(SEPARATOR, end + 1);
            if (end < 0) {
                return key;
            }
        }
        return key.substring(0, end);
    }

    /** Joins the first {@code count} segments with the separator. */
    public static String join(List<String> segments, int count) {
        return String.join(SEPARATOR_STRING, segments.subList(0, count));
    }
}
