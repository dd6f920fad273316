package com.libragraph.inventory.core.manifest;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.libragraph.inventory.core.storage.StorageException;
import org.jboss.logging.Logger;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Persists cache entries as one JSON file each, named by the hex digest of the
 * entry's key. Files can be deleted independently; unreadable files are
 * reported as misses.
 *
 * <p>The keys present on disk are indexed on first use by reading only the
 * leading key of each file, then kept current by {@link #save} and
 * {@link #delete}.
 */
public class ManifestCacheStore {

    private static final Logger log = Logger.getLogger(ManifestCacheStore.class);

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper;
    private final ObjectReader reader;
    private final AtomicLong fileReads = new AtomicLong();
    private volatile Set<CacheKey> index;

    public ManifestCacheStore(Path directory, ObjectMapper mapper) {
        this.directory = Objects.requireNonNull(directory, "directory cannot be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
        this.reader = mapper.readerFor(CacheEntry.class)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StorageException("Failed to create cache directory: " + directory, e);
        }
    }

    public Path directory() {
        return directory;
    }

    Path pathFor(CacheKey key) {
        return directory.resolve(key.digest().toHex() + SUFFIX);
    }

    public Optional<CacheEntry> load(CacheKey key) {
        Path path = pathFor(key);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        return read(path).filter(entry -> {
            if (!entry.key().equals(key)) {
                log.warnf("Cache file %s holds %s, expected %s", path, entry.key(), key);
                return false;
            }
            return true;
        });
    }

    public void save(CacheEntry entry) {
        Path target = pathFor(entry.key());
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.write(tmp, mapper.writeValueAsBytes(entry));
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to write cache entry: " + target, e);
        }
        Set<CacheKey> keys = index;
        if (keys != null) {
            keys.add(entry.key());
        }
    }

    public boolean delete(CacheKey key) {
        Set<CacheKey> keys = index;
        if (keys != null) {
            keys.remove(key);
        }
        try {
            return Files.deleteIfExists(pathFor(key));
        } catch (IOException e) {
            throw new StorageException("Failed to delete cache entry: " + key, e);
        }
    }

    /** Keys of the entries on disk, without reading their manifests. */
    public Set<CacheKey> keys() {
        Set<CacheKey> keys = index;
        if (keys == null) {
            synchronized (this) {
                if (index == null) {
                    index = scanKeys();
                }
                keys = index;
            }
        }
        return Set.copyOf(keys);
    }

    /** Cache files opened so far, for entries and key headers alike. */
    long fileReads() {
        return fileReads.get();
    }

    /** Removes every entry file, readable or not. */
    public int deleteAll() {
        Set<CacheKey> keys = index;
        if (keys != null) {
            keys.clear();
        }
        int deleted = 0;
        for (Path path : entryFiles()) {
            try {
                if (Files.deleteIfExists(path)) deleted++;
            } catch (IOException e) {
                throw new StorageException("Failed to delete cache entry: " + path, e);
            }
        }
        return deleted;
    }

    private List<Path> entryFiles() {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .filter(Files::isRegularFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("Failed to list cache directory: " + directory, e);
        }
    }

    private Set<CacheKey> scanKeys() {
        Set<CacheKey> keys = ConcurrentHashMap.newKeySet();
        for (Path path : entryFiles()) {
            readKey(path).ifPresent(keys::add);
        }
        log.debugf("Indexed %d cached manifest(s) in %s", keys.size(), directory);
        return keys;
    }

    private Optional<CacheKey> readKey(Path path) {
        fileReads.incrementAndGet();
        try (JsonParser parser = mapper.createParser(path.toFile())) {
            if (parser.nextToken() == JsonToken.START_OBJECT
                    && parser.nextToken() == JsonToken.FIELD_NAME
                    && "key".equals(parser.getCurrentName())) {
                parser.nextToken();
                return Optional.of(mapper.readValue(parser, CacheKey.class));
            }
            log.warnf("Ignoring cache file without a leading key: %s", path);
            return Optional.empty();
        } catch (FileNotFoundException | NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            log.warnf("Ignoring unreadable cache file %s: %s", path, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<CacheEntry> read(Path path) {
        fileReads.incrementAndGet();
        try {
            CacheEntry entry = reader.readValue(Files.readAllBytes(path));
            return Optional.of(entry);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            log.warnf("Ignoring unreadable cache file %s: %s", path, e.getMessage());
            return Optional.empty();
        }
    }
}
