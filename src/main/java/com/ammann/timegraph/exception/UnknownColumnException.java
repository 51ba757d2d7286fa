/* (C)2026 */
package com.ammann.timegraph.exception;

/** Raised when a query names a column the current table does not contain. */
public class UnknownColumnException extends TimeGraphException {

    private final String column;

    public UnknownColumnException(String column) {
        super(String.format("Unknown column '%s'", column));
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
