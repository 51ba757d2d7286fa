/* (C)2026 */
package com.ammann.timegraph.exception;

/**
 * Fatal ingestion failure: the table is structurally unusable and no cache is built.
 *
 * <p>Raised only for a table without columns or with row counts that disagree across
 * columns (and for duplicate column names in a hand-built table).
 */
public class IngestionException extends TimeGraphException {

    public IngestionException(String message) {
        super(message);
    }

    public static IngestionException noColumns() {
        return new IngestionException("Table has no columns");
    }

    public static IngestionException rowCountMismatch(String column, int expected, int actual) {
        return new IngestionException(
                String.format(
                        "Column '%s' has %d rows, expected %d like the preceding columns",
                        column, actual, expected));
    }

    public static IngestionException duplicateColumn(String column) {
        return new IngestionException(String.format("Duplicate column name '%s'", column));
    }
}
