/* (C)2026 */
package com.ammann.timegraph.enumeration;

/** Declared representation of the values in an existing time column. */
public enum TimeRepresentation {
    /** Numeric columns are read as epoch values, text columns as free-text date-times. */
    AUTO,
    /** Numeric Unix epoch values in the configured {@link EpochUnit}. */
    EPOCH,
    /** Text parsed with an explicit {@link java.time.format.DateTimeFormatter} pattern. */
    FORMAT,
    /** Text parsed against a list of common date-time layouts. */
    FREE_TEXT
}
