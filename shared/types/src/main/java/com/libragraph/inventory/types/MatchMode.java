package com.libragraph.inventory.types;

public enum MatchMode {
    /** Query appears anywhere in the full key. */
    SUBSTRING("substring"),
    /** Full key starts with the query. */
    PREFIX("prefix"),
    /** Query equals one directory segment of the key (the leaf name is not a folder). */
    EXACT_FOLDER("exact-folder");

    private final String label;

    MatchMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static MatchMode fromLabel(String label) {
        for (MatchMode m : values()) {
            if (m.label.equalsIgnoreCase(label) || m.name().equalsIgnoreCase(label)) return m;
        }
        throw new IllegalArgumentException("Unknown match mode: " + label);
    }
}
