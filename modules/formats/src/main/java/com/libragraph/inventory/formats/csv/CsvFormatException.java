package com.libragraph.inventory.formats.csv;

/**
 * Thrown when a CSV line cannot be split into fields.
 */
public class CsvFormatException extends RuntimeException {

    public CsvFormatException(String message) {
        super(message);
    }
}
