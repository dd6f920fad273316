package com.libragraph.inventory.core.query;

import com.libragraph.inventory.core.manifest.InventoryConfig;
import com.libragraph.inventory.core.manifest.Manifest;
import com.libragraph.inventory.core.manifest.ManifestCache;
import com.libragraph.inventory.core.testing.InMemoryObjectStore;
import com.libragraph.inventory.core.testing.InventoryFixtures;
import com.libragraph.inventory.core.testing.TestEngines;

import java.util.Optional;

/**
 * Publishes a report and resolves its manifest in one step.
 */
final class ScanTestSupport {

    static final InventoryConfig CONFIG = InventoryConfig.csv("b1", "daily", "dest", "inv");
    static final String DATE = "2024-03-01T01-00Z";

    private ScanTestSupport() {
    }

    static Manifest publish(InMemoryObjectStore store, String... csvFiles) {
        InventoryFixtures.publish(store, CONFIG, DATE, csvFiles);
        return TestEngines.resolver(store, ManifestCache.inMemory()).resolve(CONFIG, Optional.of(DATE));
    }
}
