/* (C)2026 */
package com.ammann.timegraph.dto;

import com.ammann.timegraph.enumeration.ColumnKind;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Per-column outcome of normalization.
 *
 * <p>Missing values are split by origin: {@code nullCount} were missing in the source
 * (null markers or empty cells), {@code unparsedCount} were text tokens that failed the
 * numeric parse of a coerced column, and {@code infiniteCount} were infinities removed
 * before forward filling. All three are filled the same way; {@code filledCount} is
 * their sum for numeric columns.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ColumnDiagnosticsDTO(
        String originalName,
        String name,
        ColumnKind kind,
        long nullCount,
        double nullPercent,
        boolean coerced,
        Double coercionSuccessRate,
        long unparsedCount,
        long infiniteCount,
        long filledCount) {

    /**
     * Returns {@code true} if the column name was changed by sanitization.
     */
    public boolean renamed() {
        return !name.equals(originalName);
    }
}
