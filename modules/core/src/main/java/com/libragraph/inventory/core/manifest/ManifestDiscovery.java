package com.libragraph.inventory.core.manifest;

import com.libragraph.inventory.core.source.SourceFetcher;
import com.libragraph.inventory.core.storage.ObjectNotFoundException;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lists the inventory reports delivered to a destination bucket.
 */
public class ManifestDiscovery {

    private static final Logger log = Logger.getLogger(ManifestDiscovery.class);

    private static final Comparator<ManifestLocation> BY_INVENTORY = Comparator
            .comparing(ManifestLocation::sourceBucket)
            .thenComparing(ManifestLocation::inventoryId)
            .thenComparing(ManifestLocation::destinationPrefix);

    private final SourceFetcher fetcher;

    public ManifestDiscovery(SourceFetcher fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher cannot be null");
    }

    /** Every manifest under the prefix, newest date first within each inventory. */
    public List<ManifestLocation> listAll(String destinationBucket, String prefix) {
        String normalized = InventoryConfig.normalizePrefix(prefix);
        String listPrefix = normalized.isEmpty() ? "" : normalized + "/";
        List<String> keys;
        try {
            keys = fetcher.list(destinationBucket, listPrefix);
        } catch (ObjectNotFoundException e) {
            log.warnf("Destination bucket not found: %s", destinationBucket);
            return List.of();
        }
        List<ManifestLocation> found = new ArrayList<>();
        for (String key : keys) {
            ManifestKeys.parse(destinationBucket, key).ifPresent(found::add);
        }
        found.sort(BY_INVENTORY.thenComparing(ManifestLocation::date, Comparator.reverseOrder()));
        log.debugf("Discovered %d manifest(s) in %s/%s", found.size(), destinationBucket, listPrefix);
        return found;
    }

    /** The most recent manifest of each (source bucket, inventory id). */
    public List<ManifestLocation> discover(String destinationBucket, String prefix) {
        Map<String, ManifestLocation> latest = new LinkedHashMap<>();
        for (ManifestLocation location : listAll(destinationBucket, prefix)) {
            String id = location.destinationPrefix() + "\u0000" + location.sourceBucket()
                    + "\u0000" + location.inventoryId();
            latest.merge(id, location, (a, b) -> a.date().compareTo(b.date()) >= 0 ? a : b);
        }
        return List.copyOf(latest.values());
    }
}
