package com.libragraph.inventory.core.query;

/**
 * A data file that could not be scanned completely.
 */
public record FileFailure(String key, String reason) {
}
