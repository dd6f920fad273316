package com.libragraph.inventory.core.config;

import com.libragraph.inventory.core.manifest.InventoryConfig;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

/**
 * Default bucket and prefix that inventory reports are delivered to.
 */
@ApplicationScoped
public class InventoryDestination {

    @ConfigProperty(name = "inventory.destination.bucket")
    Optional<String> bucket;

    @ConfigProperty(name = "inventory.destination.prefix")
    Optional<String> prefix;

    public String bucket() {
        return bucket.filter(b -> !b.isBlank())
                .orElseThrow(() -> new IllegalStateException("inventory.destination.bucket is not configured"));
    }

    public String prefix() {
        return prefix.orElse("");
    }

    public InventoryConfig configFor(String sourceBucket, String inventoryId) {
        return InventoryConfig.csv(sourceBucket, inventoryId, bucket(), prefix());
    }
}
