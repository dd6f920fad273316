package com.libragraph.inventory.core.query;

import com.libragraph.inventory.util.PathSegments;

import java.util.Locale;

/**
 * Compiled form of a query, applied to every key of a scan.
 *
 * <p>Segment rules look at directory segments only; the leaf name of a key is
 * never a folder.
 */
final class KeyMatcher {

    private enum Rule { SUBSTRING, PREFIX, SEGMENT_EQUALS, SEGMENT_CONTAINS }

    private final Rule rule;
    private final String needle;
    private final boolean caseSensitive;

    private KeyMatcher(Rule rule, String needle, boolean caseSensitive) {
        this.rule = rule;
        this.caseSensitive = caseSensitive;
        this.needle = caseSensitive ? needle : needle.toLowerCase(Locale.ROOT);
    }

    static KeyMatcher of(SearchQuery query) {
        Rule rule = switch (query.mode()) {
            case SUBSTRING -> Rule.SUBSTRING;
            case PREFIX -> Rule.PREFIX;
            case EXACT_FOLDER -> Rule.SEGMENT_EQUALS;
        };
        return new KeyMatcher(rule, query.text(), query.caseSensitive());
    }

    /** Matches keys having a directory segment that contains {@code text}. */
    static KeyMatcher folderContaining(String text, boolean caseSensitive) {
        return new KeyMatcher(Rule.SEGMENT_CONTAINS, text, caseSensitive);
    }

    boolean matches(String key) {
        return switch (rule) {
            case SUBSTRING -> fold(key).contains(needle);
            case PREFIX -> fold(key).startsWith(needle);
            case SEGMENT_EQUALS, SEGMENT_CONTAINS -> matchingSegmentEnd(key) >= 0;
        };
    }

    /**
     * Path up to and including the first matching directory segment, or null
     * for rules that do not match on segments or keys that do not match.
     */
    String folderPath(String key) {
        if (rule == Rule.SUBSTRING || rule == Rule.PREFIX) {
            return null;
        }
        int end = matchingSegmentEnd(key);
        return end >= 0 ? key.substring(0, end) : null;
    }

    private int matchingSegmentEnd(String key) {
        int start = 0;
        int slash;
        while ((slash = key.indexOf(PathSegments.SEPARATOR, start)) >= 0) {
            String segment = fold(key.substring(start, slash));
            boolean hit = rule == Rule.SEGMENT_EQUALS ? segment.equals(needle) : segment.contains(needle);
            if (hit) {
                return slash;
            }
            start = slash + 1;
        }
        return -1;
    }

    private String fold(String s) {
        return caseSensitive ? s : s.toLowerCase(Locale.ROOT);
    }
}
