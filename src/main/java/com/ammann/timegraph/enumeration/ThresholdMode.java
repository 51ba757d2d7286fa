/* (C)2026 */
package com.ammann.timegraph.enumeration;

/** Selects the duty-cycle threshold used by signal statistics. */
public enum ThresholdMode {
    /** The mean of the analysed range. */
    AUTO,
    /** A caller supplied value. */
    MANUAL
}
