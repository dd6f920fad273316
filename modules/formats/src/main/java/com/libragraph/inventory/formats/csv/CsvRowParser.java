package com.libragraph.inventory.formats.csv;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one CSV line into fields.
 *
 * <p>Handles the dialect S3 Inventory writes: comma separated, every field
 * double-quoted, embedded quotes doubled. Unquoted fields are accepted as well.
 * A line holds exactly one record; the parser never spans lines.
 */
public final class CsvRowParser {

    private static final char DELIMITER = ',';
    private static final char QUOTE = '"';

    private CsvRowParser() {
    }

    /**
     * Parses a single line.
     *
     * @throws CsvFormatException on an unterminated quoted field or text after a closing quote
     */
    public static List<String> parse(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        int i = 0;
        int n = line.length();

        while (true) {
            field.setLength(0);
            if (i < n && line.charAt(i) == QUOTE) {
                i++;
                boolean closed = false;
                while (i < n) {
                    char c = line.charAt(i);
                    if (c == QUOTE) {
                        if (i + 1 < n && line.charAt(i + 1) == QUOTE) {
                            field.append(QUOTE);
                            i += 2;
                            continue;
                        }
                        closed = true;
                        i++;
                        break;
                    }
                    field.append(c);
                    i++;
                }
                if (!closed) {
                    throw new CsvFormatException("Unterminated quoted field at column " + fields.size());
                }
                if (i < n && line.charAt(i) != DELIMITER) {
                    throw new CsvFormatException("Unexpected character after quoted field at column "
                            + fields.size());
                }
            } else {
                while (i < n && line.charAt(i) != DELIMITER) {
                    field.append(line.charAt(i));
                    i++;
                }
            }
            fields.add(field.toString());

            if (i >= n) {
                return fields;
            }
            i++; // delimiter
        }
    }
}
