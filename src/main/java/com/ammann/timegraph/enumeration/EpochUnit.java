/* (C)2026 */
package com.ammann.timegraph.enumeration;

/**
 * Unit of numeric epoch timestamps.
 *
 * <p>{@link #AUTO} applies the magnitude heuristic once at resolution time: values above
 * {@value #MILLISECOND_MAGNITUDE} are treated as milliseconds, everything else as seconds.
 */
public enum EpochUnit {
    SECONDS(1.0),
    MILLISECONDS(1_000.0),
    MICROSECONDS(1_000_000.0),
    NANOSECONDS(1_000_000_000.0),
    AUTO(Double.NaN);

    /** Magnitude above which auto-detected epoch values are read as milliseconds. */
    public static final double MILLISECOND_MAGNITUDE = 1e12;

    private final double divisor;

    EpochUnit(double divisor) {
        this.divisor = divisor;
    }

    /**
     * Resolves {@link #AUTO} against a sample value. Explicit units return themselves.
     *
     * @param sample first finite value of the column
     * @return the concrete unit to apply
     */
    public EpochUnit resolve(double sample) {
        if (this != AUTO) {
            return this;
        }
        return Math.abs(sample) > MILLISECOND_MAGNITUDE ? MILLISECONDS : SECONDS;
    }

    /**
     * Converts a value in this unit to seconds.
     *
     * @throws IllegalStateException if called on {@link #AUTO}
     */
    public double toSeconds(double value) {
        if (this == AUTO) {
            throw new IllegalStateException("AUTO must be resolved before conversion");
        }
        return value / divisor;
    }
}
