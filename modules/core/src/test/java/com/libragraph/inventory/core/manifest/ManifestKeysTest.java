package com.libragraph.inventory.core.manifest;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ManifestKeysTest {

    private static final InventoryConfig CONFIG = InventoryConfig.csv("b1", "daily", "dest", "/inv/");

    @Test
    void buildsManifestKeyUnderNormalizedPrefix() {
        assertThat(CONFIG.destinationPrefix()).isEqualTo("inv");
        assertThat(ManifestKeys.manifestKey(CONFIG, "2024-03-01T01-00Z"))
                .isEqualTo("inv/b1/daily/2024-03-01T01-00Z/manifest.json");
    }

    @Test
    void emptyPrefixStartsAtSourceBucket() {
        InventoryConfig config = InventoryConfig.csv("b1", "daily", "dest", "");
        assertThat(ManifestKeys.inventoryRoot(config)).isEqualTo("b1/daily/");
    }

    @Test
    void extractsDateOfManifestKeysOnly() {
        String root = ManifestKeys.inventoryRoot(CONFIG);

        assertThat(ManifestKeys.dateOf(root, "inv/b1/daily/2024-03-01T01-00Z/manifest.json"))
                .contains("2024-03-01T01-00Z");
        assertThat(ManifestKeys.dateOf(root, "inv/b1/daily/2024-03-01T01-00Z/manifest.checksum")).isEmpty();
        assertThat(ManifestKeys.dateOf(root, "inv/b1/daily/data/abc.csv.gz")).isEmpty();
        assertThat(ManifestKeys.dateOf(root, "inv/b1/daily/hive/dt=2024-03-01-01-00/symlink.txt")).isEmpty();
        assertThat(ManifestKeys.dateOf(root, "inv/b1/daily/2024-03-01/manifest.json")).isEmpty();
    }

    @Test
    void parsesLocationWithAndWithoutPrefix() {
        assertThat(ManifestKeys.parse("dest", "inv/reports/b1/daily/2024-03-01T01-00Z/manifest.json"))
                .hasValueSatisfying(loc -> {
                    assertThat(loc.destinationPrefix()).isEqualTo("inv/reports");
                    assertThat(loc.sourceBucket()).isEqualTo("b1");
                    assertThat(loc.inventoryId()).isEqualTo("daily");
                    assertThat(loc.date()).isEqualTo("2024-03-01T01-00Z");
                });
        assertThat(ManifestKeys.parse("dest", "b1/daily/2024-03-01T01-00Z/manifest.json"))
                .hasValueSatisfying(loc -> assertThat(loc.destinationPrefix()).isEmpty());
        assertThat(ManifestKeys.parse("dest", "b1/daily/data/x.csv.gz")).isEmpty();
    }

    @Test
    void rejectsMalformedDates() {
        assertThatThrownBy(() -> ManifestKeys.manifestKey(CONFIG, "../../etc"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsSlashInIdentifiers() {
        assertThatThrownBy(() -> InventoryConfig.csv("b1", "a/b", "dest", ""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
