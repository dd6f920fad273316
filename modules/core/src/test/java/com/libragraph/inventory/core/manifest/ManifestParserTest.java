package com.libragraph.inventory.core.manifest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.inventory.types.InventoryFormat;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class ManifestParserTest {

    private static final InventoryConfig CONFIG = InventoryConfig.csv("b1", "daily", "dest", "inv");
    private static final String DATE = "2024-03-01T01-00Z";
    private static final String KEY = "inv/b1/daily/2024-03-01T01-00Z/manifest.json";

    private final ManifestParser parser = new ManifestParser(new ObjectMapper());

    private Manifest parse(String json) {
        return parser.parse(json.getBytes(StandardCharsets.UTF_8), CONFIG, DATE, KEY);
    }

    @Test
    void parsesS3InventoryManifest() {
        Manifest manifest = parse("""
                {
                  "sourceBucket": "b1",
                  "destinationBucket": "arn:aws:s3:::dest",
                  "version": "2016-11-30",
                  "creationTimestamp": "1709254800000",
                  "fileFormat": "CSV",
                  "fileSchema": "Bucket, Key, Size, LastModifiedDate, StorageClass",
                  "files": [
                    {"key": "inv/b1/daily/data/a.csv.gz", "size": 2048, "MD5checksum": "aa"},
                    {"key": "inv/b1/daily/data/b.csv.gz", "size": 1024, "MD5checksum": "bb"}
                  ]
                }
                """);

        assertThat(manifest.sourceBucket()).isEqualTo("b1");
        assertThat(manifest.destinationBucket()).isEqualTo("dest");
        assertThat(manifest.inventoryId()).isEqualTo("daily");
        assertThat(manifest.date()).isEqualTo(DATE);
        assertThat(manifest.manifestKey()).isEqualTo(KEY);
        assertThat(manifest.creationTimestamp()).isEqualTo(1709254800000L);
        assertThat(manifest.format()).isEqualTo(InventoryFormat.CSV);
        assertThat(manifest.schema()).containsExactly("Bucket", "Key", "Size", "LastModifiedDate", "StorageClass");
        assertThat(manifest.files()).containsExactly(
                new DataFileRef("dest", "inv/b1/daily/data/a.csv.gz", 2048, "aa"),
                new DataFileRef("dest", "inv/b1/daily/data/b.csv.gz", 1024, "bb"));
        assertThat(manifest.totalDataSize()).isEqualTo(3072);
    }

    @Test
    void ignoresUnknownFields() {
        Manifest manifest = parse("""
                {"fileFormat":"CSV","fileSchema":"Key, Size","somethingNew":{"x":1},
                 "files":[{"key":"k.csv.gz","size":1,"extra":true}]}
                """);

        assertThat(manifest.files()).hasSize(1);
        assertThat(manifest.files().get(0).md5Checksum()).isNull();
        assertThat(manifest.creationTimestamp()).isZero();
    }

    @Test
    void missingSchemaIsCorrupt() {
        assertThatThrownBy(() -> parse("{\"fileFormat\":\"CSV\",\"files\":[]}"))
                .isInstanceOf(ManifestCorruptException.class)
                .hasMessageContaining("fileSchema");
    }

    @Test
    void schemaWithoutSizeIsCorrupt() {
        assertThatThrownBy(() -> parse("{\"fileSchema\":\"Bucket, Key\",\"files\":[]}"))
                .isInstanceOf(ManifestCorruptException.class)
                .hasMessageContaining("Key and Size");
    }

    @Test
    void missingFilesIsCorrupt() {
        assertThatThrownBy(() -> parse("{\"fileSchema\":\"Key, Size\"}"))
                .isInstanceOf(ManifestCorruptException.class)
                .hasMessageContaining("files");
    }

    @Test
    void nonArrayFilesIsCorrupt() {
        assertThatThrownBy(() -> parse("{\"fileSchema\":\"Key, Size\",\"files\":{}}"))
                .isInstanceOf(ManifestCorruptException.class);
    }

    @Test
    void fileWithoutKeyIsCorrupt() {
        assertThatThrownBy(() -> parse("{\"fileSchema\":\"Key, Size\",\"files\":[{\"size\":3}]}"))
                .isInstanceOf(ManifestCorruptException.class)
                .hasMessageContaining("files[0]");
    }

    @Test
    void negativeFileSizeIsCorrupt() {
        assertThatThrownBy(() -> parse("{\"fileSchema\":\"Key, Size\",\"files\":[{\"key\":\"a\",\"size\":-1}]}"))
                .isInstanceOf(ManifestCorruptException.class)
                .hasMessageContaining("negative");
    }

    @Test
    void columnarFormatsAreUnsupported() {
        assertThatThrownBy(() -> parse("{\"fileFormat\":\"ORC\",\"fileSchema\":\"Key, Size\",\"files\":[]}"))
                .isInstanceOf(ManifestCorruptException.class)
                .hasMessageContaining("ORC");
    }

    @Test
    void invalidJsonIsCorrupt() {
        assertThatThrownBy(() -> parse("{not json"))
                .isInstanceOf(ManifestCorruptException.class)
                .satisfies(e -> assertThat(((ManifestCorruptException) e).manifestKey()).isEqualTo(KEY));
    }
}
