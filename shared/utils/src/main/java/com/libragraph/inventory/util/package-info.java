/**
 * Shared utilities for all inventory modules.
 *
 * <p>Contains {@link com.libragraph.inventory.util.KeyDigest} (BLAKE3-128 digests
 * used to name cache entries), {@link com.libragraph.inventory.util.PathSegments}
 * for separator-delimited object keys, and {@link com.libragraph.inventory.util.ByteSizes}.
 * No framework dependencies beyond Commons Codec.
 */
package com.libragraph.inventory.util;
