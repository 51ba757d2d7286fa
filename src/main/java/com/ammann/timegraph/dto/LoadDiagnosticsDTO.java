/* (C)2026 */
package com.ammann.timegraph.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Structured report surfaced once per load on the diagnostics channel.
 *
 * <p>Consumed by logging and reporting; the engine never acts on it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoadDiagnosticsDTO(
        long inputRows,
        long keptRows,
        long skippedRows,
        List<ColumnDiagnosticsDTO> columns,
        List<String> notes,
        TimeAxisReportDTO timeAxis,
        Instant createdAt) {

    public LoadDiagnosticsDTO {
        columns = columns == null ? List.of() : List.copyOf(columns);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    /**
     * Returns a copy with the time-axis report attached and the kept row count adjusted
     * for rows dropped during time resolution.
     */
    public LoadDiagnosticsDTO withTimeAxis(TimeAxisReportDTO report, List<String> extraNotes) {
        List<String> merged = new ArrayList<>(notes);
        merged.addAll(extraNotes);
        return new LoadDiagnosticsDTO(
                inputRows,
                keptRows - report.droppedRows(),
                skippedRows,
                columns,
                merged,
                report,
                createdAt);
    }

    /** Looks up the diagnostics of a column by its sanitized name. */
    public ColumnDiagnosticsDTO column(String name) {
        return columns.stream().filter(c -> c.name().equals(name)).findFirst().orElse(null);
    }
}
