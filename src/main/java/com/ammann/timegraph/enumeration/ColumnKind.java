/* (C)2026 */
package com.ammann.timegraph.enumeration;

/**
 * Semantic kind of a sanitized column.
 *
 * <p>A column may change kind once, from {@link #TEXT} to {@link #NUMERIC}, while the
 * table is normalized. It never changes afterwards.
 */
public enum ColumnKind {
    /** 64-bit floating point values, {@code NaN} marks a missing value. */
    NUMERIC,
    /** Free text, {@code null} marks a missing value. */
    TEXT,
    /** Seconds since the Unix epoch stored as 64-bit floating point values. */
    TEMPORAL;

    /**
     * Returns {@code true} if columns of this kind can be materialized as numeric buffers.
     */
    public boolean isNumeric() {
        return switch (this) {
            case NUMERIC, TEMPORAL -> true;
            case TEXT -> false;
        };
    }
}
