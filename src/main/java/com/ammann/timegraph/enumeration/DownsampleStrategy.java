/* (C)2026 */
package com.ammann.timegraph.enumeration;

/** Point reduction policy for display series. */
public enum DownsampleStrategy {
    /** Every {@code len / maxPoints}-th sample. */
    UNIFORM_STRIDE,
    /** Minimum and maximum of equally sized buckets, keeps peaks visible. */
    MIN_MAX_BUCKET
}
