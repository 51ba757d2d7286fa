/* (C)2026 */
package com.ammann.timegraph.model;

import com.ammann.timegraph.exception.IngestionException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, immutable set of typed columns produced by normalization.
 *
 * <p>Invariants checked on construction: at least one column, unique names, and the same
 * row count in every column. Any violation is fatal and raised as
 * {@link IngestionException}. Operations that change the table return a new instance.
 */
public final class SanitizedTable {

    private final List<Column> columns;
    private final Map<String, Column> byName;
    private final int rowCount;

    public SanitizedTable(List<? extends Column> columns) {
        if (columns == null || columns.isEmpty()) {
            throw IngestionException.noColumns();
        }

        Map<String, Column> index = new LinkedHashMap<>();
        int expectedRows = columns.get(0).rowCount();
        for (Column column : columns) {
            if (column.rowCount() != expectedRows) {
                throw IngestionException.rowCountMismatch(
                        column.name(), expectedRows, column.rowCount());
            }
            if (index.putIfAbsent(column.name(), column) != null) {
                throw IngestionException.duplicateColumn(column.name());
            }
        }

        this.columns = List.copyOf(columns);
        this.byName = Collections.unmodifiableMap(index);
        this.rowCount = expectedRows;
    }

    public List<Column> columns() {
        return columns;
    }

    public List<String> columnNames() {
        return List.copyOf(byName.keySet());
    }

    public Optional<Column> column(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean hasColumn(String name) {
        return byName.containsKey(name);
    }

    public int rowCount() {
        return rowCount;
    }

    public int columnCount() {
        return columns.size();
    }

    /**
     * Returns a new table with {@code column} inserted at the front.
     */
    public SanitizedTable withLeadingColumn(Column column) {
        List<Column> updated = new ArrayList<>(columns.size() + 1);
        updated.add(column);
        updated.addAll(columns);
        return new SanitizedTable(updated);
    }

    /**
     * Returns a new table where the column with the same name as {@code column} is
     * replaced in place.
     */
    public SanitizedTable withReplacedColumn(Column column) {
        List<Column> updated = new ArrayList<>(columns.size());
        boolean replaced = false;
        for (Column existing : columns) {
            if (existing.name().equals(column.name())) {
                updated.add(column);
                replaced = true;
            } else {
                updated.add(existing);
            }
        }
        if (!replaced) {
            throw new IllegalArgumentException("No column named " + column.name());
        }
        return new SanitizedTable(updated);
    }

    /**
     * Returns a new table keeping only the given rows of every column.
     */
    public SanitizedTable selectRows(int[] rows) {
        List<Column> updated = new ArrayList<>(columns.size());
        for (Column column : columns) {
            updated.add(column.selectRows(rows));
        }
        return new SanitizedTable(updated);
    }

    @Override
    public String toString() {
        return "SanitizedTable[columns=" + byName.keySet() + ", rows=" + rowCount + "]";
    }
}
