package com.libragraph.inventory.core.testing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.inventory.core.manifest.ManifestCache;
import com.libragraph.inventory.core.manifest.ManifestParser;
import com.libragraph.inventory.core.manifest.ManifestResolver;
import com.libragraph.inventory.core.source.RetryPolicy;
import com.libragraph.inventory.core.source.SourceFetcher;
import com.libragraph.inventory.core.storage.ObjectStore;
import com.libragraph.inventory.core.stream.ReaderOptions;
import com.libragraph.inventory.core.stream.RecordStreamReader;
import com.libragraph.inventory.formats.codecs.Bzip2Codec;
import com.libragraph.inventory.formats.codecs.GzipCodec;
import com.libragraph.inventory.formats.registry.CodecRegistry;

import java.time.Duration;

/**
 * Scan components wired by hand, with retry delays short enough for tests.
 */
public final class TestEngines {

    public static final RetryPolicy FAST_RETRY = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5));

    private TestEngines() {
    }

    public static SourceFetcher fetcher(ObjectStore store) {
        return new SourceFetcher(store, FAST_RETRY);
    }

    public static ManifestResolver resolver(ObjectStore store, ManifestCache cache) {
        return new ManifestResolver(fetcher(store), new ManifestParser(new ObjectMapper()), cache);
    }

    public static CodecRegistry codecs() {
        return CodecRegistry.of(new GzipCodec(), new Bzip2Codec());
    }

    public static RecordStreamReader reader(ObjectStore store) {
        return reader(store, ReaderOptions.defaults());
    }

    public static RecordStreamReader reader(ObjectStore store, ReaderOptions options) {
        return new RecordStreamReader(fetcher(store), codecs(), options);
    }
}
