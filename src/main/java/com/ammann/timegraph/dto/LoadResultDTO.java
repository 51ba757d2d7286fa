/* (C)2026 */
package com.ammann.timegraph.dto;

import java.util.List;

/**
 * Summary handed back to the caller after a table has been loaded and published.
 *
 * @param generation   cache generation the table was published as
 * @param columns      sanitized column names, time column first
 * @param timeColumn   name of the resolved time column
 * @param rowCount     rows in the published table
 * @param diagnostics  full load report
 */
public record LoadResultDTO(
        long generation,
        List<String> columns,
        String timeColumn,
        int rowCount,
        LoadDiagnosticsDTO diagnostics) {

    public LoadResultDTO {
        columns = List.copyOf(columns);
    }
}
