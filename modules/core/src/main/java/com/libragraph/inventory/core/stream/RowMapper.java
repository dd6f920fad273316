package com.libragraph.inventory.core.stream;

import com.libragraph.inventory.formats.csv.CsvFormatException;
import com.libragraph.inventory.formats.csv.CsvRowParser;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Maps CSV rows to {@link InventoryRecord}s by schema position.
 *
 * <p>Column names are matched case-insensitively. A row needs at least as many
 * fields as it takes to reach the {@code Key} and {@code Size} columns; optional
 * columns beyond the row's end are absent, surplus fields are ignored.
 */
final class RowMapper {

    private final int bucketIdx;
    private final int keyIdx;
    private final int sizeIdx;
    private final int lastModifiedIdx;
    private final int storageClassIdx;
    private final int eTagIdx;
    private final int requiredFields;
    private final String defaultBucket;
    private final boolean urlDecodeKeys;

    RowMapper(List<String> schema, String defaultBucket, boolean urlDecodeKeys) {
        this.bucketIdx = indexOf(schema, "Bucket");
        this.keyIdx = indexOf(schema, "Key");
        this.sizeIdx = indexOf(schema, "Size");
        this.lastModifiedIdx = indexOf(schema, "LastModifiedDate");
        this.storageClassIdx = indexOf(schema, "StorageClass");
        this.eTagIdx = indexOf(schema, "ETag");
        if (keyIdx < 0 || sizeIdx < 0) {
            throw new IllegalArgumentException("schema must contain Key and Size: " + schema);
        }
        this.requiredFields = Math.max(keyIdx, sizeIdx) + 1;
        this.defaultBucket = defaultBucket;
        this.urlDecodeKeys = urlDecodeKeys;
    }

    /**
     * @throws IllegalArgumentException with a short reason when the row is malformed
     */
    InventoryRecord map(String line) {
        List<String> fields;
        try {
            fields = CsvRowParser.parse(line);
        } catch (CsvFormatException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
        if (fields.size() < requiredFields) {
            throw new IllegalArgumentException("expected at least " + requiredFields
                    + " fields, got " + fields.size());
        }

        String key = fields.get(keyIdx);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("empty key");
        }
        if (urlDecodeKeys) {
            key = URLDecoder.decode(key, StandardCharsets.UTF_8);
        }

        long size = parseSize(fields.get(sizeIdx));

        String bucket = optional(fields, bucketIdx);
        String lastModified = optional(fields, lastModifiedIdx);
        return new InventoryRecord(
                bucket != null ? bucket : defaultBucket,
                key,
                size,
                lastModified != null ? parseInstant(lastModified) : null,
                optional(fields, storageClassIdx),
                optional(fields, eTagIdx));
    }

    private static long parseSize(String raw) {
        // delete markers and folder placeholders leave the size empty
        if (raw.isEmpty()) {
            return 0L;
        }
        long size;
        try {
            size = Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("non-numeric size '" + raw + "'", e);
        }
        if (size < 0) {
            throw new IllegalArgumentException("negative size " + size);
        }
        return size;
    }

    private static Instant parseInstant(String raw) {
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid LastModifiedDate '" + raw + "'", e);
        }
    }

    private static String optional(List<String> fields, int idx) {
        if (idx < 0 || idx >= fields.size()) {
            return null;
        }
        String value = fields.get(idx);
        return value.isEmpty() ? null : value;
    }

    private static int indexOf(List<String> schema, String column) {
        for (int i = 0; i < schema.size(); i++) {
            if (schema.get(i).equalsIgnoreCase(column)) return i;
        }
        return -1;
    }
}
