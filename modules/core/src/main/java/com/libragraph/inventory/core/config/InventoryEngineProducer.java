package com.libragraph.inventory.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.inventory.core.manifest.ManifestCache;
import com.libragraph.inventory.core.manifest.ManifestCacheStore;
import com.libragraph.inventory.core.manifest.ManifestDiscovery;
import com.libragraph.inventory.core.manifest.ManifestParser;
import com.libragraph.inventory.core.manifest.ManifestResolver;
import com.libragraph.inventory.core.query.PathDepthAggregator;
import com.libragraph.inventory.core.query.SearchEngine;
import com.libragraph.inventory.core.scan.ScanWorkerPool;
import com.libragraph.inventory.core.source.RetryPolicy;
import com.libragraph.inventory.core.source.SourceFetcher;
import com.libragraph.inventory.core.storage.ObjectStore;
import com.libragraph.inventory.core.stream.ReaderOptions;
import com.libragraph.inventory.core.stream.RecordStreamReader;
import com.libragraph.inventory.formats.registry.CodecRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Wires the framework-free scan components from configuration.
 */
@ApplicationScoped
public class InventoryEngineProducer {

    private static final Logger log = Logger.getLogger(InventoryEngineProducer.class);

    @ConfigProperty(name = "inventory.source.max-attempts", defaultValue = "3")
    int maxAttempts;

    @ConfigProperty(name = "inventory.source.initial-backoff", defaultValue = "200ms")
    Duration initialBackoff;

    @ConfigProperty(name = "inventory.source.max-backoff", defaultValue = "5s")
    Duration maxBackoff;

    @ConfigProperty(name = "inventory.reader.max-consecutive-malformed", defaultValue = "100")
    int maxConsecutiveMalformed;

    @ConfigProperty(name = "inventory.reader.url-decode-keys", defaultValue = "true")
    boolean urlDecodeKeys;

    @ConfigProperty(name = "inventory.cache.directory")
    Optional<String> cacheDirectory;

    @ConfigProperty(name = "inventory.cache.ttl")
    Optional<Duration> cacheTtl;

    @Produces
    @Singleton
    public SourceFetcher sourceFetcher(ObjectStore store) {
        return new SourceFetcher(store, new RetryPolicy(maxAttempts, initialBackoff, maxBackoff));
    }

    @Produces
    @Singleton
    public ManifestCache manifestCache(ObjectMapper mapper) {
        ManifestCacheStore store = cacheDirectory
                .filter(dir -> !dir.isBlank())
                .map(dir -> new ManifestCacheStore(Path.of(dir), mapper))
                .orElse(null);
        log.infof("Manifest cache: %s, ttl=%s",
                store != null ? store.directory() : "memory only",
                cacheTtl.map(Duration::toString).orElse("none"));
        return new ManifestCache(store, cacheTtl.orElse(null), Clock.systemUTC());
    }

    @Produces
    @Singleton
    public ManifestResolver manifestResolver(SourceFetcher fetcher, ObjectMapper mapper, ManifestCache cache) {
        return new ManifestResolver(fetcher, new ManifestParser(mapper), cache);
    }

    @Produces
    @Singleton
    public ManifestDiscovery manifestDiscovery(SourceFetcher fetcher) {
        return new ManifestDiscovery(fetcher);
    }

    @Produces
    @Singleton
    public RecordStreamReader recordStreamReader(SourceFetcher fetcher, CodecRegistry codecs) {
        return new RecordStreamReader(fetcher, codecs, new ReaderOptions(maxConsecutiveMalformed, urlDecodeKeys));
    }

    @Produces
    @Singleton
    public SearchEngine searchEngine(RecordStreamReader reader, ScanWorkerPool pool) {
        return new SearchEngine(reader, pool);
    }

    @Produces
    @Singleton
    public PathDepthAggregator pathDepthAggregator(RecordStreamReader reader, ScanWorkerPool pool) {
        return new PathDepthAggregator(reader, pool);
    }
}
