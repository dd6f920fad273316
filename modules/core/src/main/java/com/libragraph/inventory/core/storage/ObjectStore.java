package com.libragraph.inventory.core.storage;

import java.io.InputStream;
import java.util.List;

/**
 * Read-only access to the bucket holding inventory reports.
 *
 * <p>Authentication, credential refresh and transport-level retries belong to
 * the implementation; callers treat every failure other than
 * {@link ObjectNotFoundException} as possibly transient.
 */
public interface ObjectStore {

    /**
     * Lists every object key under the prefix, recursively, in key order.
     *
     * @throws ObjectNotFoundException if the bucket does not exist
     * @throws StorageException on I/O errors
     */
    List<String> listObjects(String bucket, String prefix);

    /**
     * Opens an object for streaming. The caller must close the stream.
     *
     * @throws ObjectNotFoundException if the bucket or key does not exist
     * @throws StorageException on I/O errors
     */
    InputStream getObject(String bucket, String key);
}
