package com.libragraph.inventory.core.manifest;

import com.libragraph.inventory.core.InventoryException;

/**
 * A manifest was fetched but its schema or file list is unusable.
 */
public class ManifestCorruptException extends InventoryException {

    private final String manifestKey;

    public ManifestCorruptException(String manifestKey, String reason) {
        super("Corrupt manifest " + manifestKey + ": " + reason);
        this.manifestKey = manifestKey;
    }

    public ManifestCorruptException(String manifestKey, String reason, Throwable cause) {
        super("Corrupt manifest " + manifestKey + ": " + reason, cause);
        this.manifestKey = manifestKey;
    }

    public String manifestKey() {
        return manifestKey;
    }
}
