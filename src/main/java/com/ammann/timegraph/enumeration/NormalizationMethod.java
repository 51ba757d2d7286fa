/* (C)2026 */
package com.ammann.timegraph.enumeration;

/** Amplitude normalization applied to a signal for display. */
public enum NormalizationMethod {
    /** Divide by the largest absolute value. */
    PEAK,
    /** Divide by the root mean square. */
    RMS,
    /** Scale linearly into {@code [0, 1]}. */
    MINMAX,
    /** Subtract the mean and divide by the standard deviation. */
    ZSCORE
}
