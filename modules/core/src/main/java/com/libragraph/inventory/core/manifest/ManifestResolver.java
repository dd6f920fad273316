package com.libragraph.inventory.core.manifest;

import com.libragraph.inventory.core.source.SourceFetcher;
import com.libragraph.inventory.core.storage.ObjectNotFoundException;
import com.libragraph.inventory.util.ByteSizes;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds and loads the manifest of an inventory report.
 *
 * <p>Without a date the newest valid report wins: candidates are tried in
 * descending date order and corrupt ones are skipped. Every load goes through
 * the {@link ManifestCache}.
 */
public class ManifestResolver {

    private static final Logger log = Logger.getLogger(ManifestResolver.class);

    private final SourceFetcher fetcher;
    private final ManifestParser parser;
    private final ManifestCache cache;

    public ManifestResolver(SourceFetcher fetcher, ManifestParser parser, ManifestCache cache) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher cannot be null");
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
    }

    public ManifestCache cache() {
        return cache;
    }

    /**
     * Resolves the report for {@code date}, or the newest valid report when
     * the date is empty.
     *
     * @throws ManifestNotFoundException when no (matching) manifest exists
     * @throws ManifestCorruptException  when the requested manifest, or every candidate, is corrupt
     */
    public Manifest resolve(InventoryConfig config, Optional<String> date) {
        return date.isPresent() ? resolveDate(config, date.get()) : resolveLatest(config);
    }

    public Manifest resolveLatest(InventoryConfig config) {
        List<String> dates = candidateDates(config);
        if (dates.isEmpty()) {
            throw new ManifestNotFoundException(config, null);
        }

        ManifestCorruptException newestCorrupt = null;
        for (String date : dates) {
            try {
                Manifest manifest = resolveDate(config, date);
                cache.evictOlderThan(CacheKey.of(config, date));
                if (newestCorrupt != null) {
                    log.infof("Using manifest %s for %s/%s, newer report(s) unreadable",
                            date, config.sourceBucket(), config.inventoryId());
                }
                return manifest;
            } catch (ManifestCorruptException e) {
                log.warnf("Skipping corrupt manifest: %s", e.getMessage());
                if (newestCorrupt == null) {
                    newestCorrupt = e;
                }
            } catch (ManifestNotFoundException e) {
                // listed but gone by the time we fetched it
                log.debugf("Manifest for %s disappeared after listing", date);
            }
        }
        if (newestCorrupt != null) {
            throw newestCorrupt;
        }
        throw new ManifestNotFoundException(config, null);
    }

    public Manifest resolveDate(InventoryConfig config, String date) {
        String key = ManifestKeys.manifestKey(config, date);
        return cache.getOrLoad(CacheKey.of(config, date), () -> load(config, date, key));
    }

    /** Report dates available for the inventory, newest first. */
    public List<String> candidateDates(InventoryConfig config) {
        String root = ManifestKeys.inventoryRoot(config);
        List<String> keys;
        try {
            keys = fetcher.list(config.destinationBucket(), root);
        } catch (ObjectNotFoundException e) {
            return List.of();
        }
        List<String> dates = new ArrayList<>();
        for (String key : keys) {
            ManifestKeys.dateOf(root, key).ifPresent(dates::add);
        }
        dates.sort(Comparator.reverseOrder());
        log.debugf("Found %d manifest candidate(s) under %s/%s", dates.size(), config.destinationBucket(), root);
        return dates;
    }

    /** Drops cached reports of the inventory and resolves the newest again. */
    public Manifest refresh(InventoryConfig config) {
        cache.invalidate(config);
        return resolveLatest(config);
    }

    private Manifest load(InventoryConfig config, String date, String key) {
        byte[] json;
        try {
            json = fetcher.readAll(config.destinationBucket(), key);
        } catch (ObjectNotFoundException e) {
            throw new ManifestNotFoundException(config, date);
        }
        Manifest manifest = parser.parse(json, config, date, key);
        log.infof("Loaded manifest %s/%s (%d data files, %s, %d schema columns)",
                config.destinationBucket(), key, manifest.files().size(),
                ByteSizes.format(manifest.totalDataSize()), manifest.schema().size());
        return manifest;
    }
}
