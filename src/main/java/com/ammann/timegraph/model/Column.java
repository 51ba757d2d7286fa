/* (C)2026 */
package com.ammann.timegraph.model;

import com.ammann.timegraph.enumeration.ColumnKind;

/**
 * A named, immutable column of a {@link SanitizedTable}.
 *
 * <p>The set of variants is closed. Consumers switch over {@link #kind()} instead of
 * probing runtime types.
 */
public sealed interface Column permits NumericColumn, TextColumn, TemporalColumn {

    String name();

    ColumnKind kind();

    int rowCount();

    /**
     * Returns a copy of this column under a different name.
     */
    Column rename(String newName);

    /**
     * Returns a new column holding only the given rows, in the given order.
     *
     * @param rows row indices into this column
     */
    Column selectRows(int[] rows);
}
