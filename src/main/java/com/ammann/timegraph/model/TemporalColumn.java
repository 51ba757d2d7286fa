/* (C)2026 */
package com.ammann.timegraph.model;

import com.ammann.timegraph.enumeration.ColumnKind;
import java.util.Objects;

/**
 * Time column expressed in seconds since the Unix epoch (or since zero for synthetic
 * axes).
 *
 * @param name    column name
 * @param seconds timestamps in seconds, copied on construction and on access
 */
public record TemporalColumn(String name, double[] seconds) implements Column {

    public TemporalColumn {
        Objects.requireNonNull(name, "name");
        seconds = Objects.requireNonNull(seconds, "seconds").clone();
    }

    @Override
    public double[] seconds() {
        return seconds.clone();
    }

    public double value(int row) {
        return seconds[row];
    }

    /**
     * Counts positions where a timestamp is smaller than its predecessor.
     */
    public int decreasingSteps() {
        int count = 0;
        for (int i = 1; i < seconds.length; i++) {
            if (seconds[i] < seconds[i - 1]) {
                count++;
            }
        }
        return count;
    }

    @Override
    public ColumnKind kind() {
        return ColumnKind.TEMPORAL;
    }

    @Override
    public int rowCount() {
        return seconds.length;
    }

    @Override
    public TemporalColumn rename(String newName) {
        return new TemporalColumn(newName, seconds);
    }

    @Override
    public TemporalColumn selectRows(int[] rows) {
        double[] selected = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            selected[i] = seconds[rows[i]];
        }
        return new TemporalColumn(name, selected);
    }
}
