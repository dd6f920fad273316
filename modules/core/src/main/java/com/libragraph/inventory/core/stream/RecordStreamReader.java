package com.libragraph.inventory.core.stream;

import com.libragraph.inventory.core.manifest.DataFileRef;
import com.libragraph.inventory.core.manifest.Manifest;
import com.libragraph.inventory.core.source.SourceFetcher;
import com.libragraph.inventory.formats.registry.CodecRegistry;
import org.jboss.logging.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Opens data files as {@link RecordStream}s: fetch through the retrying
 * source, decompress by magic bytes, decode UTF-8 lines incrementally.
 */
public class RecordStreamReader {

    private static final Logger log = Logger.getLogger(RecordStreamReader.class);

    private static final int BUFFER_SIZE = 64 * 1024;

    private final SourceFetcher fetcher;
    private final CodecRegistry codecs;
    private final ReaderOptions options;

    public RecordStreamReader(SourceFetcher fetcher, CodecRegistry codecs, ReaderOptions options) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher cannot be null");
        this.codecs = Objects.requireNonNull(codecs, "codecs cannot be null");
        this.options = Objects.requireNonNull(options, "options cannot be null");
    }

    public RecordStream open(DataFileRef file, List<String> schema) {
        return open(file, schema, null);
    }

    /**
     * @param listener receives every malformed row, may be null
     * @throws com.libragraph.inventory.core.source.SourceUnavailableException when the file cannot be fetched,
     *         also thrown later by the stream once its body keeps breaking off
     * @throws RecordStreamCorruptException when the compression header is undecodable
     */
    public RecordStream open(DataFileRef file, List<String> schema, Consumer<RecordFormatException> listener) {
        return open(file, schema, null, listener);
    }

    /**
     * Opens one of the manifest's data files; records whose schema has no
     * {@code Bucket} column are attributed to the manifest's source bucket.
     */
    public RecordStream open(Manifest manifest, DataFileRef file, Consumer<RecordFormatException> listener) {
        return open(file, manifest.schema(), manifest.sourceBucket(), listener);
    }

    private RecordStream open(DataFileRef file, List<String> schema, String defaultBucket,
                              Consumer<RecordFormatException> listener) {
        RowMapper mapper = new RowMapper(schema, defaultBucket, options.urlDecodeKeys());
        RecordStream stream = new RecordStream(file.bucket(), file.key(), () -> openLines(file),
                fetcher.policy(), mapper, options.maxConsecutiveMalformed(), listener);
        stream.connect();
        log.debugf("Opened data file %s/%s (%d bytes declared)", file.bucket(), file.key(), file.size());
        return stream;
    }

    private BufferedReader openLines(DataFileRef file) throws IOException {
        InputStream raw = new ObjectBodyStream(fetcher.open(file.bucket(), file.key()));
        try {
            InputStream decoded = codecs.open(raw, file.key());
            return new BufferedReader(new InputStreamReader(decoded, StandardCharsets.UTF_8), BUFFER_SIZE);
        } catch (IOException e) {
            closeQuietly(raw, file.key());
            throw e;
        }
    }

    private static void closeQuietly(InputStream in, String key) {
        try {
            in.close();
        } catch (IOException e) {
            log.debugf("Failed to close %s after decode error: %s", key, e.getMessage());
        }
    }
}
