package com.libragraph.inventory.core.storage;

/**
 * Thrown when a read targets a bucket or key that does not exist.
 */
public class ObjectNotFoundException extends RuntimeException {

    private final String bucket;
    private final String key;

    public ObjectNotFoundException(String bucket, String key) {
        super("Object not found: bucket=" + bucket + " key=" + key);
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
