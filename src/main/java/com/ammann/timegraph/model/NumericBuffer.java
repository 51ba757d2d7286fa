/* (C)2026 */
package com.ammann.timegraph.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.DoubleStream;

/**
 * Materialized, read-only array of doubles for one column.
 *
 * <p>Buffers are shared between any number of readers. The backing array is never
 * exposed; {@link #toArray()} and {@link #slice(int, int)} return copies.
 */
public final class NumericBuffer {

    private final String source;
    private final double[] values;

    /**
     * Wraps {@code values} without copying. The caller hands over ownership and must not
     * modify the array afterwards.
     *
     * @param source name of the column (or derived series) the values came from
     * @param values the materialized values
     */
    public NumericBuffer(String source, double[] values) {
        this.source = Objects.requireNonNull(source, "source");
        this.values = Objects.requireNonNull(values, "values");
    }

    public String source() {
        return source;
    }

    public int length() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public double get(int index) {
        return values[index];
    }

    public double[] toArray() {
        return values.clone();
    }

    /**
     * Copies the half-open index range {@code [from, to)}.
     */
    public double[] slice(int from, int to) {
        return Arrays.copyOfRange(values, from, to);
    }

    public DoubleStream stream() {
        return Arrays.stream(values);
    }

    /**
     * Returns {@code true} if both buffers hold the same values in the same order.
     */
    public boolean contentEquals(NumericBuffer other) {
        return other != null && Arrays.equals(values, other.values);
    }

    @Override
    public String toString() {
        return "NumericBuffer[" + source + ", length=" + values.length + "]";
    }
}
