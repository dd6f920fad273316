package com.libragraph.inventory.core.manifest;

import java.util.Objects;

/**
 * One shard of an inventory snapshot: a compressed CSV object in the
 * destination bucket.
 *
 * @param bucket       destination bucket holding the file
 * @param key          object key of the file
 * @param size         size in bytes as declared by the manifest (compressed)
 * @param md5Checksum  checksum declared by the manifest, or null
 */
public record DataFileRef(String bucket, String key, long size, String md5Checksum) {

    public DataFileRef {
        Objects.requireNonNull(bucket, "bucket cannot be null");
        Objects.requireNonNull(key, "key cannot be null");
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0, got: " + size);
        }
    }
}
