/* (C)2026 */
package com.ammann.timegraph.enumeration;

/**
 * Reason a query-level computation was skipped instead of producing a value.
 */
public enum SkipReason {
    /** Fewer than two rows where both inputs are finite. */
    INSUFFICIENT_DATA,
    /** At least one input is constant over the valid rows. */
    ZERO_VARIANCE,
    /** The referenced column does not exist in the current table. */
    MISSING_COLUMN,
    /** The referenced column is text and cannot be read numerically. */
    NON_NUMERIC_COLUMN
}
