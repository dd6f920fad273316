package com.libragraph.inventory.core.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.inventory.types.InventoryFormat;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses {@code manifest.json} documents.
 *
 * <p>Unknown fields are ignored. Anything that would make the report
 * unreadable (no schema, no file list, a schema without {@code Key} and
 * {@code Size}, an unsupported file format) is a {@link ManifestCorruptException}.
 */
public class ManifestParser {

    private static final Logger log = Logger.getLogger(ManifestParser.class);

    static final String KEY_COLUMN = "Key";
    static final String SIZE_COLUMN = "Size";

    private final ObjectMapper mapper;

    public ManifestParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
    }

    public Manifest parse(byte[] json, InventoryConfig config, String date, String manifestKey) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (IOException e) {
            throw new ManifestCorruptException(manifestKey, "invalid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ManifestCorruptException(manifestKey, "not a JSON object");
        }

        InventoryFormat format = parseFormat(root, manifestKey);
        List<String> schema = parseSchema(root, manifestKey);
        List<DataFileRef> files = parseFiles(root, config.destinationBucket(), manifestKey);

        String declaredSource = root.path("sourceBucket").asText("");
        if (!declaredSource.isEmpty() && !declaredSource.equals(config.sourceBucket())) {
            log.warnf("Manifest %s declares sourceBucket=%s, expected %s",
                    manifestKey, declaredSource, config.sourceBucket());
        }

        return new Manifest(config.sourceBucket(), config.destinationBucket(), config.inventoryId(),
                date, manifestKey, parseTimestamp(root.get("creationTimestamp"), manifestKey),
                format, schema, files);
    }

    private static InventoryFormat parseFormat(JsonNode root, String manifestKey) {
        JsonNode node = root.get("fileFormat");
        if (node == null || node.isNull()) {
            return InventoryFormat.CSV;
        }
        InventoryFormat format;
        try {
            format = InventoryFormat.fromLabel(node.asText());
        } catch (IllegalArgumentException e) {
            throw new ManifestCorruptException(manifestKey, "unknown fileFormat " + node.asText(), e);
        }
        if (!format.rowOriented()) {
            throw new ManifestCorruptException(manifestKey, "unsupported fileFormat " + format.label());
        }
        return format;
    }

    private static List<String> parseSchema(JsonNode root, String manifestKey) {
        JsonNode node = root.get("fileSchema");
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new ManifestCorruptException(manifestKey, "missing fileSchema");
        }
        List<String> columns = new ArrayList<>();
        for (String column : node.asText().split(",")) {
            String name = column.trim();
            if (name.isEmpty()) {
                throw new ManifestCorruptException(manifestKey, "empty column name in fileSchema");
            }
            columns.add(name);
        }
        if (!containsIgnoreCase(columns, KEY_COLUMN) || !containsIgnoreCase(columns, SIZE_COLUMN)) {
            throw new ManifestCorruptException(manifestKey,
                    "fileSchema must contain Key and Size, got " + node.asText());
        }
        return columns;
    }

    private static List<DataFileRef> parseFiles(JsonNode root, String bucket, String manifestKey) {
        JsonNode node = root.get("files");
        if (node == null || !node.isArray()) {
            throw new ManifestCorruptException(manifestKey, "missing files array");
        }
        List<DataFileRef> files = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            JsonNode entry = node.get(i);
            if (!entry.isObject()) {
                throw new ManifestCorruptException(manifestKey, "files[" + i + "] is not an object");
            }
            String key = entry.path("key").asText("");
            if (key.isEmpty()) {
                throw new ManifestCorruptException(manifestKey, "files[" + i + "] has no key");
            }
            long size = 0;
            JsonNode sizeNode = entry.get("size");
            if (sizeNode != null && !sizeNode.isNull()) {
                if (!sizeNode.canConvertToLong() && !sizeNode.isTextual()) {
                    throw new ManifestCorruptException(manifestKey, "files[" + i + "] has invalid size");
                }
                try {
                    size = sizeNode.isTextual() ? Long.parseLong(sizeNode.asText()) : sizeNode.asLong();
                } catch (NumberFormatException e) {
                    throw new ManifestCorruptException(manifestKey, "files[" + i + "] has invalid size", e);
                }
                if (size < 0) {
                    throw new ManifestCorruptException(manifestKey, "files[" + i + "] has negative size");
                }
            }
            JsonNode md5 = entry.get("MD5checksum");
            files.add(new DataFileRef(bucket, key, size, md5 != null && md5.isTextual() ? md5.asText() : null));
        }
        return files;
    }

    private static long parseTimestamp(JsonNode node, String manifestKey) {
        if (node == null || node.isNull()) {
            return 0L;
        }
        if (node.canConvertToLong()) {
            return node.asLong();
        }
        try {
            return Long.parseLong(node.asText().trim());
        } catch (NumberFormatException e) {
            log.debugf("Ignoring unparseable creationTimestamp in %s: %s", manifestKey, node.asText());
            return 0L;
        }
    }

    private static boolean containsIgnoreCase(List<String> columns, String name) {
        for (String c : columns) {
            if (c.equalsIgnoreCase(name)) return true;
        }
        return false;
    }
}
