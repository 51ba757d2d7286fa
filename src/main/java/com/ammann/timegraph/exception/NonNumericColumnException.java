/* (C)2026 */
package com.ammann.timegraph.exception;

/** Raised when a numeric buffer is requested for a text column. */
public class NonNumericColumnException extends TimeGraphException {

    private final String column;

    public NonNumericColumnException(String column) {
        super(String.format("Column '%s' is text and has no numeric buffer", column));
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
