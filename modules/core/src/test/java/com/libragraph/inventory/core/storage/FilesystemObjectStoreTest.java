package com.libragraph.inventory.core.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class FilesystemObjectStoreTest {

    @TempDir
    Path root;

    private FilesystemObjectStore store;

    @BeforeEach
    void setUp() throws IOException {
        store = new FilesystemObjectStore(root);
        write("dest", "inv/b1/daily/2024-03-02T01-00Z/manifest.json", "{}");
        write("dest", "inv/b1/daily/2024-03-01T01-00Z/manifest.json", "{}");
        write("dest", "other/readme.txt", "x");
    }

    private void write(String bucket, String key, String content) throws IOException {
        Path path = root.resolve(bucket).resolve(key);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content);
    }

    @Test
    void listsKeysUnderPrefixSorted() {
        assertThat(store.listObjects("dest", "inv/b1/"))
                .containsExactly(
                        "inv/b1/daily/2024-03-01T01-00Z/manifest.json",
                        "inv/b1/daily/2024-03-02T01-00Z/manifest.json");
    }

    @Test
    void emptyPrefixListsEverything() {
        assertThat(store.listObjects("dest", "")).hasSize(3);
    }

    @Test
    void readsObjectContent() throws IOException {
        try (InputStream in = store.getObject("dest", "other/readme.txt")) {
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("x");
        }
    }

    @Test
    void missingKeyIsNotFound() {
        assertThatThrownBy(() -> store.getObject("dest", "nope.txt"))
                .isInstanceOf(ObjectNotFoundException.class)
                .hasMessageContaining("nope.txt");
    }

    @Test
    void missingBucketIsNotFound() {
        assertThatThrownBy(() -> store.listObjects("absent", ""))
                .isInstanceOf(ObjectNotFoundException.class);
    }

    @Test
    void keysCannotEscapeTheBucket() throws IOException {
        Files.writeString(root.resolve("secret.txt"), "s");
        write("other-bucket", "private.txt", "p");

        assertThatThrownBy(() -> store.getObject("dest", "../secret.txt"))
                .isInstanceOf(ObjectNotFoundException.class);
        assertThatThrownBy(() -> store.getObject("dest", "inv/../../other-bucket/private.txt"))
                .isInstanceOf(ObjectNotFoundException.class);
        assertThatThrownBy(() -> store.listObjects("..", ""))
                .isInstanceOf(ObjectNotFoundException.class);
    }

    @Test
    void dotSegmentsInsideTheBucketStillResolve() throws IOException {
        try (InputStream in = store.getObject("dest", "inv/../other/readme.txt")) {
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("x");
        }
    }
}
