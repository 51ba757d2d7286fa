/* (C)2026 */
package com.ammann.timegraph.model;

import com.ammann.timegraph.enumeration.ColumnKind;
import java.util.Objects;

/**
 * Text column. {@code null} is the canonical missing value.
 *
 * @param name   column name
 * @param values cell values, copied on construction and on access
 */
public record TextColumn(String name, String[] values) implements Column {

    public TextColumn {
        Objects.requireNonNull(name, "name");
        values = Objects.requireNonNull(values, "values").clone();
    }

    @Override
    public String[] values() {
        return values.clone();
    }

    public String value(int row) {
        return values[row];
    }

    public int missingCount() {
        int count = 0;
        for (String value : values) {
            if (value == null) {
                count++;
            }
        }
        return count;
    }

    @Override
    public ColumnKind kind() {
        return ColumnKind.TEXT;
    }

    @Override
    public int rowCount() {
        return values.length;
    }

    @Override
    public TextColumn rename(String newName) {
        return new TextColumn(newName, values);
    }

    @Override
    public TextColumn selectRows(int[] rows) {
        String[] selected = new String[rows.length];
        for (int i = 0; i < rows.length; i++) {
            selected[i] = values[rows[i]];
        }
        return new TextColumn(name, selected);
    }
}
