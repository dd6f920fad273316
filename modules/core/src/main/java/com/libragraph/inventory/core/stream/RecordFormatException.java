package com.libragraph.inventory.core.stream;

import com.libragraph.inventory.core.InventoryException;

/**
 * A single data file row could not be decoded. The row is skipped.
 */
public class RecordFormatException extends InventoryException {

    private final String fileKey;
    private final long rowNumber;

    public RecordFormatException(String fileKey, long rowNumber, String reason) {
        super("Malformed row " + rowNumber + " in " + fileKey + ": " + reason);
        this.fileKey = fileKey;
        this.rowNumber = rowNumber;
    }

    public String fileKey() {
        return fileKey;
    }

    /** 1-based line number within the decoded file. */
    public long rowNumber() {
        return rowNumber;
    }
}
