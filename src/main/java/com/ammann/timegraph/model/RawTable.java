/* (C)2026 */
package com.ammann.timegraph.model;

import com.ammann.timegraph.enumeration.ColumnKind;
import com.ammann.timegraph.exception.IngestionException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Table as handed over by an external reader: a header, rows of raw cells and optional
 * declared column kinds.
 *
 * <p>Cells are {@link String}, {@link Number} or {@code null}. Rows may have a different
 * field count than the header; normalization drops them. Declared kinds are hints, a
 * {@code null} entry means "untyped".
 */
public final class RawTable {

    private final List<String> header;
    private final List<ColumnKind> declaredKinds;
    private final List<List<Object>> rows;

    private RawTable(List<String> header, List<ColumnKind> declaredKinds, List<List<Object>> rows) {
        this.header = Collections.unmodifiableList(new ArrayList<>(header));
        this.declaredKinds = Collections.unmodifiableList(new ArrayList<>(declaredKinds));
        this.rows = Collections.unmodifiableList(rows);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a table from columns, as produced by columnar readers.
     *
     * @throws IngestionException if the column lengths disagree
     */
    public static RawTable ofColumns(List<String> names, List<? extends List<?>> columns) {
        Objects.requireNonNull(names, "names");
        Objects.requireNonNull(columns, "columns");
        if (names.size() != columns.size()) {
            throw new IllegalArgumentException(
                    "Got " + names.size() + " names for " + columns.size() + " columns");
        }
        if (columns.isEmpty()) {
            return new RawTable(names, List.of(), List.of());
        }

        int rowCount = columns.get(0).size();
        for (int c = 1; c < columns.size(); c++) {
            if (columns.get(c).size() != rowCount) {
                throw IngestionException.rowCountMismatch(names.get(c), rowCount, columns.get(c).size());
            }
        }

        List<List<Object>> rows = new ArrayList<>(rowCount);
        for (int r = 0; r < rowCount; r++) {
            List<Object> row = new ArrayList<>(columns.size());
            for (List<?> column : columns) {
                row.add(column.get(r));
            }
            rows.add(Collections.unmodifiableList(row));
        }
        return new RawTable(names, Collections.nCopies(names.size(), null), rows);
    }

    /**
     * Renders a sanitized table back into raw form, declaring each column's kind.
     */
    public static RawTable from(SanitizedTable table) {
        Builder builder = builder();
        for (Column column : table.columns()) {
            builder.column(column.name(), column.kind());
        }
        for (int r = 0; r < table.rowCount(); r++) {
            Object[] cells = new Object[table.columnCount()];
            for (int c = 0; c < table.columnCount(); c++) {
                Column column = table.columns().get(c);
                cells[c] =
                        switch (column.kind()) {
                            case NUMERIC -> ((NumericColumn) column).value(r);
                            case TEMPORAL -> ((TemporalColumn) column).value(r);
                            case TEXT -> ((TextColumn) column).value(r);
                        };
            }
            builder.row(cells);
        }
        return builder.build();
    }

    public List<String> header() {
        return header;
    }

    public int columnCount() {
        return header.size();
    }

    /** Declared kind of column {@code index}, or {@code null} when untyped. */
    public ColumnKind declaredKind(int index) {
        return index < declaredKinds.size() ? declaredKinds.get(index) : null;
    }

    public List<List<Object>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    /** Fluent builder used by readers and tests. */
    public static final class Builder {
        private final List<String> header = new ArrayList<>();
        private final List<ColumnKind> kinds = new ArrayList<>();
        private final List<List<Object>> rows = new ArrayList<>();

        private Builder() {}

        public Builder header(String... names) {
            for (String name : names) {
                column(name, null);
            }
            return this;
        }

        public Builder column(String name, ColumnKind declaredKind) {
            header.add(name);
            kinds.add(declaredKind);
            return this;
        }

        public Builder row(Object... cells) {
            rows.add(Collections.unmodifiableList(Arrays.asList(cells.clone())));
            return this;
        }

        public RawTable build() {
            return new RawTable(header, kinds, new ArrayList<>(rows));
        }
    }
}
