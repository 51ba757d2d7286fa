/* (C)2026 */
package com.ammann.timegraph.model;

import com.ammann.timegraph.enumeration.ColumnKind;
import java.util.Objects;

/**
 * 64-bit floating point column. {@code NaN} is the canonical missing value; a sanitized
 * numeric column contains no {@code NaN} and no infinities.
 *
 * @param name   column name
 * @param values column values, copied on construction and on access
 */
public record NumericColumn(String name, double[] values) implements Column {

    public NumericColumn {
        Objects.requireNonNull(name, "name");
        values = Objects.requireNonNull(values, "values").clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public double value(int row) {
        return values[row];
    }

    /** Counts missing ({@code NaN}) and infinite entries. */
    public int invalidCount() {
        int count = 0;
        for (double value : values) {
            if (!Double.isFinite(value)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public ColumnKind kind() {
        return ColumnKind.NUMERIC;
    }

    @Override
    public int rowCount() {
        return values.length;
    }

    @Override
    public NumericColumn rename(String newName) {
        return new NumericColumn(newName, values);
    }

    @Override
    public NumericColumn selectRows(int[] rows) {
        double[] selected = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            selected[i] = values[rows[i]];
        }
        return new NumericColumn(name, selected);
    }
}
