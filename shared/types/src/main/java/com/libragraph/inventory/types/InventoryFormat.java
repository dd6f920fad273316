package com.libragraph.inventory.types;

/**
 * Output format of an S3 Inventory configuration, as written in the
 * manifest's {@code fileFormat} field.
 */
public enum InventoryFormat {
    CSV(0, "CSV", true),
    ORC(1, "ORC", false),
    PARQUET(2, "Parquet", false);

    private final int id;
    private final String label;
    private final boolean rowOriented;

    InventoryFormat(int id, String label, boolean rowOriented) {
        this.id = id;
        this.label = label;
        this.rowOriented = rowOriented;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    /** True for formats decoded line by line (CSV). */
    public boolean rowOriented() {
        return rowOriented;
    }

    /**
     * Resolves a manifest {@code fileFormat} value, ignoring case.
     *
     * @throws IllegalArgumentException if the label is unknown
     */
    public static InventoryFormat fromLabel(String label) {
        if (label != null) {
            for (InventoryFormat f : values()) {
                if (f.label.equalsIgnoreCase(label.trim())) return f;
            }
        }
        throw new IllegalArgumentException("Unknown inventory format: " + label);
    }
}
