package com.libragraph.inventory.util;

import org.apache.commons.codec.digest.Blake3;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * BLAKE3-128 digest (16 bytes) of a composite string key.
 * Immutable value object that can be used as a map key or a file name.
 *
 * <p>Parts are joined with a NUL separator before hashing, so
 * {@code ("ab", "c")} and {@code ("a", "bc")} never collide.
 */
public record KeyDigest(byte[] bytes) {
    private static final int DIGEST_LENGTH = 16;
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public KeyDigest {
        Objects.requireNonNull(bytes, "Key digest bytes cannot be null");
        if (bytes.length != DIGEST_LENGTH) {
            throw new IllegalArgumentException(
                "Key digest must be 16 bytes (BLAKE3-128), got: " + bytes.length
            );
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Digests the given key parts.
     *
     * @throws NullPointerException if any part is null
     */
    public static KeyDigest of(String... parts) {
        Blake3 hasher = Blake3.initHash();
        for (int i = 0; i < parts.length; i++) {
            Objects.requireNonNull(parts[i], "key part " + i + " cannot be null");
            if (i > 0) {
                hasher.update(new byte[]{0});
            }
            hasher.update(parts[i].getBytes(StandardCharsets.UTF_8));
        }
        return new KeyDigest(hasher.doFinalize(DIGEST_LENGTH));
    }

    /**
     * Creates KeyDigest from hex string (32 characters).
     */
    public static KeyDigest fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        if (hex.length() != 32) {
            throw new IllegalArgumentException(
                "BLAKE3-128 hex string must be 32 characters, got: " + hex.length()
            );
        }
        try {
            return new KeyDigest(HEX_FORMAT.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    /**
     * Returns lowercase hex representation (32 characters).
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof KeyDigest other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
