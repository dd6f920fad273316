package com.libragraph.inventory.core.storage;

import io.minio.GetObjectArgs;
import io.minio.ListObjectsArgs;
import io.minio.MinioClient;
import io.minio.Result;
import io.minio.errors.ErrorResponseException;
import io.minio.messages.Item;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * S3-backed ObjectStore for production use (AWS S3 or MinIO).
 *
 * <p>Listing is recursive and paginated by the client; object reads return the
 * live HTTP body stream, never a buffered copy.
 */
@ApplicationScoped
@IfBuildProperty(name = "inventory.object-store.type", stringValue = "s3")
public class S3ObjectStore implements ObjectStore {

    @Inject
    MinioClient minioClient;

    public S3ObjectStore() {
    }

    public S3ObjectStore(MinioClient minioClient) {
        this.minioClient = minioClient;
    }

    @Override
    public List<String> listObjects(String bucket, String prefix) {
        try {
            List<String> keys = new ArrayList<>();
            for (Result<Item> result : minioClient.listObjects(
                    ListObjectsArgs.builder().bucket(bucket).prefix(prefix).recursive(true).build())) {
                Item item = result.get();
                if (!item.isDir()) {
                    keys.add(item.objectName());
                }
            }
            return keys;
        } catch (ErrorResponseException e) {
            if (isNotFound(e)) {
                throw new ObjectNotFoundException(bucket, prefix);
            }
            throw new StorageException("Failed to list objects: " + bucket + "/" + prefix, e);
        } catch (Exception e) {
            throw new StorageException("Failed to list objects: " + bucket + "/" + prefix, e);
        }
    }

    @Override
    public InputStream getObject(String bucket, String key) {
        try {
            return minioClient.getObject(GetObjectArgs.builder().bucket(bucket).object(key).build());
        } catch (ErrorResponseException e) {
            if (isNotFound(e)) {
                throw new ObjectNotFoundException(bucket, key);
            }
            throw new StorageException("Failed to read object: " + bucket + "/" + key, e);
        } catch (Exception e) {
            throw new StorageException("Failed to read object: " + bucket + "/" + key, e);
        }
    }

    private static boolean isNotFound(ErrorResponseException e) {
        String code = e.errorResponse().code();
        return "NoSuchKey".equals(code) || "NoSuchBucket".equals(code);
    }
}
