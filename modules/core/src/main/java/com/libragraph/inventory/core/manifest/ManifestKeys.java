package com.libragraph.inventory.core.manifest;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Key layout of inventory reports inside a destination bucket.
 */
public final class ManifestKeys {

    public static final String MANIFEST_FILE = "manifest.json";

    /** Report dates are minute-resolution UTC stamps, e.g. {@code 2024-03-01T01-00Z}. */
    public static final Pattern DATE_PATTERN = Pattern.compile("\\d{4}-\\d{2}-\\d{2}T\\d{2}-\\d{2}Z");

    private static final Pattern MANIFEST_KEY = Pattern.compile(
            "(?:(.*)/)?([^/]+)/([^/]+)/(" + DATE_PATTERN.pattern() + ")/" + Pattern.quote(MANIFEST_FILE));

    private ManifestKeys() {
    }

    /** Prefix under which every report of the inventory lives, with a trailing slash. */
    public static String inventoryRoot(InventoryConfig config) {
        String base = config.sourceBucket() + "/" + config.inventoryId() + "/";
        return config.destinationPrefix().isEmpty() ? base : config.destinationPrefix() + "/" + base;
    }

    public static String manifestKey(InventoryConfig config, String date) {
        requireDate(date);
        return inventoryRoot(config) + date + "/" + MANIFEST_FILE;
    }

    /**
     * Extracts the report date from a key directly below {@code root}, or empty
     * when the key is not a manifest of that inventory.
     */
    public static Optional<String> dateOf(String root, String key) {
        if (!key.startsWith(root)) {
            return Optional.empty();
        }
        String rest = key.substring(root.length());
        int slash = rest.indexOf('/');
        if (slash < 0 || !rest.substring(slash + 1).equals(MANIFEST_FILE)) {
            return Optional.empty();
        }
        String date = rest.substring(0, slash);
        return DATE_PATTERN.matcher(date).matches() ? Optional.of(date) : Optional.empty();
    }

    /**
     * Parses any manifest key of the form
     * {@code [prefix/]sourceBucket/inventoryId/date/manifest.json}.
     */
    public static Optional<ManifestLocation> parse(String destinationBucket, String key) {
        Matcher m = MANIFEST_KEY.matcher(key);
        if (!m.matches()) {
            return Optional.empty();
        }
        String prefix = m.group(1) != null ? m.group(1) : "";
        return Optional.of(new ManifestLocation(destinationBucket, prefix, m.group(2), m.group(3), m.group(4), key));
    }

    static void requireDate(String date) {
        if (date == null || !DATE_PATTERN.matcher(date).matches()) {
            throw new IllegalArgumentException("Invalid inventory date (expected YYYY-MM-DDTHH-MMZ): " + date);
        }
    }
}
