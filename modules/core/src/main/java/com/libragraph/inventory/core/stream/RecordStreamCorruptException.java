package com.libragraph.inventory.core.stream;

import com.libragraph.inventory.core.InventoryException;

/**
 * A data file is unreadable as a whole: undecodable compression, an I/O
 * failure mid-stream, or too many consecutive malformed rows.
 */
public class RecordStreamCorruptException extends InventoryException {

    private final String fileKey;

    public RecordStreamCorruptException(String fileKey, String reason) {
        super("Corrupt data file " + fileKey + ": " + reason);
        this.fileKey = fileKey;
    }

    public RecordStreamCorruptException(String fileKey, String reason, Throwable cause) {
        super("Corrupt data file " + fileKey + ": " + reason, cause);
        this.fileKey = fileKey;
    }

    public String fileKey() {
        return fileKey;
    }
}
