package com.libragraph.inventory.core.manifest;

import com.libragraph.inventory.core.InventoryException;

/**
 * No manifest exists for the requested inventory (and date, when one was given).
 */
public class ManifestNotFoundException extends InventoryException {

    public ManifestNotFoundException(InventoryConfig config, String date) {
        super("No inventory manifest for bucket=" + config.sourceBucket()
                + " inventory=" + config.inventoryId()
                + (date != null ? " date=" + date : "")
                + " in " + config.destinationBucket()
                + (config.destinationPrefix().isEmpty() ? "" : "/" + config.destinationPrefix()));
    }
}
