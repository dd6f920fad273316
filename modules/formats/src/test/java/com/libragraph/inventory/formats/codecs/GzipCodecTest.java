package com.libragraph.inventory.formats.codecs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;

class GzipCodecTest {
    private GzipCodec codec;

    @BeforeEach
    void setUp() {
        codec = new GzipCodec();
    }

    @Test
    void shouldMatchGzipMagicBytes() {
        byte[] gzipHeader = new byte[]{0x1f, (byte) 0x8b, 0x08, 0x00};
        assertThat(codec.matches(gzipHeader, "unknown")).isTrue();
    }

    @Test
    void shouldMatchGzipExtension() {
        byte[] unknownHeader = new byte[]{0x00, 0x00};
        assertThat(codec.matches(unknownHeader, "data/part-0.csv.gz")).isTrue();
        assertThat(codec.matches(unknownHeader, "file.gzip")).isTrue();
    }

    @Test
    void shouldNotMatchPlainCsv() {
        byte[] csvHeader = "\"bucket\",".getBytes(StandardCharsets.UTF_8);
        assertThat(codec.matches(csvHeader, "file.csv")).isFalse();
    }

    @Test
    void shouldDecodeStream() throws Exception {
        String original = "\"b1\",\"a/b/c.txt\",\"100\"\n".repeat(1000);

        try (InputStream decoded = codec.decode(new ByteArrayInputStream(gzip(original)))) {
            String result = new String(decoded.readAllBytes(), StandardCharsets.UTF_8);
            assertThat(result).isEqualTo(original);
        }
    }

    static byte[] gzip(String content) throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (GZIPOutputStream out = new GZIPOutputStream(bytes)) {
            out.write(content.getBytes(StandardCharsets.UTF_8));
        }
        return bytes.toByteArray();
    }
}
