package com.libragraph.inventory.core.query;

import com.libragraph.inventory.types.MatchMode;

import java.util.Objects;

/**
 * What to look for in object keys.
 *
 * @param text          the query string
 * @param mode          how {@code text} is compared with a key
 * @param caseSensitive false to compare case-insensitively
 */
public record SearchQuery(String text, MatchMode mode, boolean caseSensitive) {

    public SearchQuery {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(mode, "mode cannot be null");
        if (mode == MatchMode.EXACT_FOLDER && (text.isEmpty() || text.indexOf('/') >= 0)) {
            throw new IllegalArgumentException("folder name must be a single non-empty segment: '" + text + "'");
        }
    }

    public static SearchQuery substring(String text) {
        return new SearchQuery(text, MatchMode.SUBSTRING, true);
    }

    public static SearchQuery prefix(String text) {
        return new SearchQuery(text, MatchMode.PREFIX, true);
    }

    public static SearchQuery exactFolder(String name) {
        return new SearchQuery(name, MatchMode.EXACT_FOLDER, true);
    }

    public SearchQuery ignoringCase() {
        return new SearchQuery(text, mode, false);
    }
}
