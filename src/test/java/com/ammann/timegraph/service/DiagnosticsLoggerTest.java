/* (C)2026 */
package com.ammann.timegraph.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.timegraph.dto.ColumnDiagnosticsDTO;
import com.ammann.timegraph.dto.LoadDiagnosticsDTO;
import com.ammann.timegraph.dto.TimeAxisReportDTO;
import com.ammann.timegraph.enumeration.ColumnKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class DiagnosticsLoggerTest {

    private final DiagnosticsLogger logger =
            new DiagnosticsLogger(new ObjectMapper().registerModule(new JavaTimeModule()));

    @Test
    void rendersReportAsJson() {
        LoadDiagnosticsDTO diagnostics = new LoadDiagnosticsDTO(
                5,
                4,
                1,
                List.of(new ColumnDiagnosticsDTO("Speed", "Speed", ColumnKind.NUMERIC, 1, 25.0, true, 0.8, 1, 0, 2)),
                List.of("1 rows dropped: unparseable time value"),
                TimeAxisReportDTO.synthetic("time", 1000.0, true),
                Instant.parse("2026-01-01T00:00:00Z"));

        String rendered = logger.render(diagnostics);

        assertThat(rendered)
                .startsWith("Load diagnostics: {")
                .contains("\"skippedRows\":1")
                .contains("\"coercionSuccessRate\":0.8")
                .contains("\"fallbackUsed\":true")
                .doesNotContain("\"resolvedUnit\"");
    }

    @Test
    void observerAcceptsReports() {
        LoadDiagnosticsDTO diagnostics = new LoadDiagnosticsDTO(1, 1, 0, List.of(), List.of(), null, Instant.now());

        logger.onLoad(diagnostics);

        assertThat(logger.render(diagnostics)).doesNotContain("timeAxis");
    }
}
