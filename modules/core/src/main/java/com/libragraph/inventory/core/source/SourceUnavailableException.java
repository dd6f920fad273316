package com.libragraph.inventory.core.source;

import com.libragraph.inventory.core.InventoryException;

/**
 * Thrown when an object store read keeps failing after the bounded retries.
 */
public class SourceUnavailableException extends InventoryException {

    private final String bucket;
    private final String key;

    public SourceUnavailableException(String bucket, String key, int attempts, Throwable cause) {
        super("Source unavailable after " + attempts + " attempt(s): " + bucket + "/" + key, cause);
        this.bucket = bucket;
        this.key = key;
    }

    public String bucket() {
        return bucket;
    }

    public String key() {
        return key;
    }
}
