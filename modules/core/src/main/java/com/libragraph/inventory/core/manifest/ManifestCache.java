package com.libragraph.inventory.core.manifest;

import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Parsed manifests keyed by destination, source bucket, inventory id and date.
 *
 * <p>Entries live in memory and, when a {@link ManifestCacheStore} is given,
 * on disk so they survive restarts. Without a TTL entries never expire; the
 * resolver evicts older dates of an inventory once a newer report is seen.
 *
 * <p>{@link #getOrLoad} runs at most one load per key at a time. Concurrent
 * callers for the same key wait for that load and share its result; a failed
 * load is not cached and the next caller retries.
 */
public class ManifestCache {

    private static final Logger log = Logger.getLogger(ManifestCache.class);

    private final ConcurrentHashMap<CacheKey, CacheEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<CacheKey, CompletableFuture<Manifest>> inFlight = new ConcurrentHashMap<>();
    private final ManifestCacheStore store;
    private final Duration ttl;
    private final Clock clock;

    /**
     * @param store optional disk store, null for memory only
     * @param ttl   optional time-to-live, null for no expiry
     */
    public ManifestCache(ManifestCacheStore store, Duration ttl, Clock clock) {
        if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
            throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
        }
        this.store = store;
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public static ManifestCache inMemory() {
        return new ManifestCache(null, null, Clock.systemUTC());
    }

    public Optional<Manifest> get(CacheKey key) {
        CacheEntry entry = entries.get(key);
        if (entry == null && store != null) {
            entry = store.load(key).orElse(null);
            if (entry != null) {
                entries.putIfAbsent(key, entry);
            }
        }
        if (entry == null) {
            return Optional.empty();
        }
        if (expired(entry)) {
            log.debugf("Cache entry expired: %s", key);
            remove(key);
            return Optional.empty();
        }
        return Optional.of(entry.manifest());
    }

    public void put(CacheKey key, Manifest manifest) {
        CacheEntry entry = CacheEntry.of(key, manifest, clock.millis());
        entries.put(key, entry);
        if (store != null) {
            store.save(entry);
        }
    }

    /**
     * Returns the cached manifest, or runs {@code loader} and caches its result.
     * Loader exceptions propagate unchanged to every waiting caller.
     */
    public Manifest getOrLoad(CacheKey key, Supplier<Manifest> loader) {
        Optional<Manifest> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        CompletableFuture<Manifest> mine = new CompletableFuture<>();
        CompletableFuture<Manifest> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.debugf("Waiting for in-flight manifest load: %s", key);
            return join(existing);
        }

        try {
            // a load that finished between our get() and putIfAbsent() already cached it
            Manifest manifest = get(key).orElse(null);
            if (manifest == null) {
                manifest = loader.get();
                put(key, manifest);
            }
            mine.complete(manifest);
            return manifest;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /** Drops every cached date of one inventory. */
    public void invalidate(InventoryConfig config) {
        entries.keySet().removeIf(k -> k.sameInventory(config));
        if (store != null) {
            for (CacheKey key : store.keys()) {
                if (key.sameInventory(config)) {
                    store.delete(key);
                }
            }
        }
        log.debugf("Invalidated cached manifests for %s/%s", config.sourceBucket(), config.inventoryId());
    }

    public void invalidateAll() {
        entries.clear();
        if (store != null) {
            store.deleteAll();
        }
        log.debug("Invalidated all cached manifests");
    }

    /**
     * Evicts entries of the same inventory as {@code current} whose date sorts
     * before it. Disk entries are found through the store's key index, so no
     * cached manifest is read.
     *
     * @return number of entries evicted
     */
    public int evictOlderThan(CacheKey current) {
        Set<CacheKey> evicted = new HashSet<>();
        for (CacheKey key : entries.keySet()) {
            if (olderDateOf(key, current) && entries.remove(key) != null) {
                evicted.add(key);
            }
        }
        if (store != null) {
            for (CacheKey key : store.keys()) {
                if (olderDateOf(key, current) && store.delete(key)) {
                    evicted.add(key);
                }
            }
        }
        if (!evicted.isEmpty()) {
            log.infof("Evicted %d superseded manifest(s) for %s/%s older than %s",
                    evicted.size(), current.sourceBucket(), current.inventoryId(), current.date());
        }
        return evicted.size();
    }

    private static boolean olderDateOf(CacheKey key, CacheKey current) {
        return key.sameInventory(current) && key.date().compareTo(current.date()) < 0;
    }

    /** Number of entries held in memory. */
    public int size() {
        return entries.size();
    }

    private void remove(CacheKey key) {
        entries.remove(key);
        if (store != null) {
            store.delete(key);
        }
    }

    private boolean expired(CacheEntry entry) {
        return ttl != null && clock.millis() - entry.cachedAt() >= ttl.toMillis();
    }

    private static Manifest join(CompletableFuture<Manifest> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            if (e.getCause() instanceof Error err) throw err;
            throw e;
        }
    }
}
