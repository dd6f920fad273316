package com.libragraph.inventory.core.manifest;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A cached manifest and the time it was cached (epoch millis).
 *
 * <p>The key is written first so a cache file's identity can be read without
 * parsing the manifest.
 */
@JsonPropertyOrder({"key", "manifest", "cachedAt"})
public record CacheEntry(CacheKey key, Manifest manifest, long cachedAt) {

    public CacheEntry {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(manifest, "manifest cannot be null");
    }

    public static CacheEntry of(CacheKey key, Manifest manifest, long cachedAt) {
        return new CacheEntry(key, manifest, cachedAt);
    }
}
