package com.libragraph.inventory.core.storage;

import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Filesystem-backed ObjectStore for development and testing.
 *
 * <p>Layout: {@code {root}/{bucket}/{key}}; keys use {@code /} regardless of platform.
 */
@ApplicationScoped
@IfBuildProperty(name = "inventory.object-store.type", stringValue = "filesystem")
public class FilesystemObjectStore implements ObjectStore {

    private static final Logger log = Logger.getLogger(FilesystemObjectStore.class);

    @ConfigProperty(name = "inventory.object-store.filesystem.root")
    String root;

    public FilesystemObjectStore() {
    }

    public FilesystemObjectStore(Path root) {
        this.root = root.toString();
    }

    private Path bucketPath(String bucket) {
        Path rootPath = Path.of(root).toAbsolutePath().normalize();
        Path bucketPath = rootPath.resolve(bucket).normalize();
        if (!bucketPath.startsWith(rootPath) || bucketPath.equals(rootPath)) {
            throw new ObjectNotFoundException(bucket, "");
        }
        return bucketPath;
    }

    /** Keys never resolve outside their bucket directory; such keys name no object. */
    private Path objectPath(String bucket, String key) {
        Path bucketPath = bucketPath(bucket);
        Path path = bucketPath.resolve(key).normalize();
        if (!path.startsWith(bucketPath) || path.equals(bucketPath)) {
            log.warnf("Rejected key outside bucket %s: %s", bucket, key);
            throw new ObjectNotFoundException(bucket, key);
        }
        return path;
    }

    @Override
    public List<String> listObjects(String bucket, String prefix) {
        Path bucketPath = bucketPath(bucket);
        if (!Files.isDirectory(bucketPath)) {
            throw new ObjectNotFoundException(bucket, prefix);
        }
        try (Stream<Path> files = Files.walk(bucketPath)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> toKey(bucketPath, p))
                    .filter(key -> key.startsWith(prefix))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("Failed to list objects: " + bucket + "/" + prefix, e);
        }
    }

    @Override
    public InputStream getObject(String bucket, String key) {
        Path path = objectPath(bucket, key);
        try {
            return Files.newInputStream(path);
        } catch (NoSuchFileException e) {
            throw new ObjectNotFoundException(bucket, key);
        } catch (IOException e) {
            throw new StorageException("Failed to read object: " + bucket + "/" + key, e);
        }
    }

    private static String toKey(Path bucketPath, Path file) {
        return bucketPath.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }
}
