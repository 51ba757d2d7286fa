/* (C)2026 */
package com.ammann.timegraph.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.timegraph.dto.ColumnDiagnosticsDTO;
import com.ammann.timegraph.enumeration.ColumnKind;
import com.ammann.timegraph.exception.IngestionException;
import com.ammann.timegraph.model.Column;
import com.ammann.timegraph.model.NumericColumn;
import com.ammann.timegraph.model.RawTable;
import com.ammann.timegraph.model.SanitizedTable;
import com.ammann.timegraph.model.TemporalColumn;
import com.ammann.timegraph.model.TextColumn;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TypeNormalizationServiceTest {

    private TypeNormalizationService service;

    @BeforeEach
    void setUp() {
        service = new TypeNormalizationService();
    }

    @Test
    void forwardFillsInteriorGaps() {
        RawTable raw = RawTable.ofColumns(List.of("v"), List.of(Arrays.asList(1.0, null, null, 5.0)));

        TypeNormalizationService.NormalizationResult result = service.normalize(raw);

        assertThat(numeric(result.table(), "v").values()).containsExactly(1.0, 1.0, 1.0, 5.0);
        ColumnDiagnosticsDTO diagnostics = result.diagnostics().column("v");
        assertThat(diagnostics.nullCount()).isEqualTo(2);
        assertThat(diagnostics.nullPercent()).isEqualTo(50.0);
        assertThat(diagnostics.filledCount()).isEqualTo(2);
        assertThat(diagnostics.coerced()).isFalse();
    }

    @Test
    void fillsLeadingGapsWithZero() {
        RawTable raw = RawTable.ofColumns(List.of("v"), List.of(Arrays.asList(null, null, 3.0)));

        TypeNormalizationService.NormalizationResult result = service.normalize(raw);

        assertThat(numeric(result.table(), "v").values()).containsExactly(0.0, 0.0, 3.0);
    }

    @Test
    void coercesMostlyNumericTextAndFillsTheFailure() {
        RawTable raw = RawTable.ofColumns(
                List.of("v"), List.of(List.of("1.0", "2.0", "ERROR", "4.0", "5.0")));

        TypeNormalizationService.NormalizationResult result = service.normalize(raw);

        NumericColumn column = numeric(result.table(), "v");
        assertThat(column.values()).containsExactly(1.0, 2.0, 2.0, 4.0, 5.0);
        ColumnDiagnosticsDTO diagnostics = result.diagnostics().column("v");
        assertThat(diagnostics.coerced()).isTrue();
        assertThat(diagnostics.coercionSuccessRate()).isEqualTo(0.8);
        assertThat(diagnostics.unparsedCount()).isEqualTo(1);
        assertThat(diagnostics.nullCount()).isZero();
    }

    @Test
    void keepsMostlyTextualColumnsAsText() {
        RawTable raw = RawTable.ofColumns(
                List.of("state"), List.of(List.of("ON", "OFF", "1", "ON", "OFF")));

        TypeNormalizationService.NormalizationResult result = service.normalize(raw);

        Column column = result.table().column("state").orElseThrow();
        assertThat(column).isInstanceOf(TextColumn.class);
        assertThat(((TextColumn) column).values()).containsExactly("ON", "OFF", "1", "ON", "OFF");
        assertThat(result.diagnostics().notes()).anySatisfy(note -> assertThat(note).contains("state"));
        assertThat(result.diagnostics().column("state").coercionSuccessRate()).isEqualTo(0.2);
    }

    @Test
    void mapsNullMarkersCaseInsensitively() {
        RawTable raw = RawTable.ofColumns(
                List.of("v"), List.of(List.of("1", "n/a", "null", " ", "-", "none", "2")));

        TypeNormalizationService.NormalizationResult result = service.normalize(raw);

        assertThat(numeric(result.table(), "v").values()).containsExactly(1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 2.0);
        assertThat(result.diagnostics().column("v").nullCount()).isEqualTo(5);
    }

    @Test
    void honoursConfiguredNullMarkers() {
        service.nullMarkers = List.of("missing");
        RawTable raw = RawTable.ofColumns(List.of("v"), List.of(List.of("4", "MISSING", "NA")));

        TypeNormalizationService.NormalizationResult result = service.normalize(raw);

        // "NA" is no longer a marker, so it counts as a failed parse; 1 of 2 present cells parse
        Column column = result.table().column("v").orElseThrow();
        assertThat(column.kind()).isEqualTo(ColumnKind.TEXT);
        assertThat(result.diagnostics().column("v").nullCount()).isEqualTo(1);
    }

    @Test
    void replacesInfinitiesByFilledValues() {
        RawTable raw = RawTable.ofColumns(
                List.of("v"), List.of(Arrays.asList(2.0, Double.POSITIVE_INFINITY, 3.0, Double.NaN)));

        TypeNormalizationService.NormalizationResult result = service.normalize(raw);

        assertThat(numeric(result.table(), "v").values()).containsExactly(2.0, 2.0, 3.0, 3.0);
        ColumnDiagnosticsDTO diagnostics = result.diagnostics().column("v");
        assertThat(diagnostics.infiniteCount()).isEqualTo(1);
        assertThat(diagnostics.nullCount()).isEqualTo(1);
        assertThat(diagnostics.filledCount()).isEqualTo(2);
    }

    @Test
    void dropsRowsWithWrongFieldCount() {
        RawTable raw = RawTable.builder()
                .header("a", "b")
                .row("1", "2")
                .row("3")
                .row("4", "5", "6")
                .row("7", "8")
                .build();

        TypeNormalizationService.NormalizationResult result = service.normalize(raw);

        assertThat(result.table().rowCount()).isEqualTo(2);
        assertThat(result.diagnostics().inputRows()).isEqualTo(4);
        assertThat(result.diagnostics().keptRows()).isEqualTo(2);
        assertThat(result.diagnostics().skippedRows()).isEqualTo(2);
        assertThat(numeric(result.table(), "b").values()).containsExactly(2.0, 8.0);
    }

    @Test
    void sanitizesAndDeduplicatesNames() {
        RawTable raw = RawTable.builder().header("Motor Speed", "Motor_Speed").row(1, 2).build();

        TypeNormalizationService.NormalizationResult result = service.normalize(raw);

        assertThat(result.table().columnNames()).containsExactly("Motor_Speed", "Motor_Speed_1");
        assertThat(result.diagnostics().column("Motor_Speed").renamed()).isTrue();
        assertThat(result.diagnostics().column("Motor_Speed").originalName()).isEqualTo("Motor Speed");
        assertThat(result.diagnostics().column("Motor_Speed_1").renamed()).isTrue();
    }

    @Test
    void keepsDeclaredTemporalColumnsUnfilled() {
        RawTable raw = RawTable.builder()
                .column("t", ColumnKind.TEMPORAL)
                .column("v", null)
                .row("1", "10")
                .row("bad", "11")
                .row("3", "12")
                .build();

        TypeNormalizationService.NormalizationResult result = service.normalize(raw);

        TemporalColumn time = (TemporalColumn) result.table().column("t").orElseThrow();
        assertThat(time.seconds()[0]).isEqualTo(1.0);
        assertThat(time.seconds()[1]).isNaN();
        assertThat(result.diagnostics().column("t").unparsedCount()).isEqualTo(1);
    }

    @Test
    void allMissingColumnBecomesEmptyText() {
        RawTable raw = RawTable.ofColumns(
                List.of("a", "b"), List.of(List.of("1", "2"), Arrays.asList(null, "NULL")));

        TypeNormalizationService.NormalizationResult result = service.normalize(raw);

        assertThat(result.table().column("b").orElseThrow().kind()).isEqualTo(ColumnKind.TEXT);
        assertThat(result.diagnostics().column("b").nullPercent()).isEqualTo(100.0);
    }

    @Test
    void normalizingTwiceIsIdempotent() {
        RawTable raw = RawTable.builder()
                .header("time", "speed", "state", "mixed")
                .row("0", "1.5", "ON", "1")
                .row("1", null, "OFF", "oops")
                .row("2", "inf", "ON", "3")
                .row("3", "4.5", null, "4")
                .row("4", "NA", "ON", "5")
                .build();

        SanitizedTable once = service.normalize(raw).table();
        SanitizedTable twice = service.normalize(RawTable.from(once)).table();

        assertThat(twice.columnNames()).isEqualTo(once.columnNames());
        for (Column column : once.columns()) {
            Column other = twice.column(column.name()).orElseThrow();
            assertThat(other.kind()).isEqualTo(column.kind());
            switch (column.kind()) {
                case NUMERIC -> assertThat(((NumericColumn) other).values())
                        .containsExactly(((NumericColumn) column).values());
                case TEMPORAL -> assertThat(((TemporalColumn) other).seconds())
                        .containsExactly(((TemporalColumn) column).seconds());
                case TEXT -> assertThat(((TextColumn) other).values())
                        .containsExactly(((TextColumn) column).values());
            }
        }
    }

    @Test
    void rejectsTablesWithoutColumns() {
        RawTable raw = RawTable.builder().build();

        assertThatThrownBy(() -> service.normalize(raw))
                .isInstanceOf(IngestionException.class)
                .hasMessageContaining("no columns");
    }

    @Test
    void forwardFillReportsFilledPositions() {
        double[] values = {Double.NaN, 2.0, Double.NaN, Double.NaN, 7.0};

        int filled = TypeNormalizationService.forwardFill(values);

        assertThat(filled).isEqualTo(3);
        assertThat(values).containsExactly(0.0, 2.0, 2.0, 2.0, 7.0);
    }

    @Test
    void leavesGapsOfDesignatedTimeColumnUnfilled() {
        RawTable raw = RawTable.ofColumns(
                List.of("t", "v"),
                List.of(Arrays.asList("1000", null, "garbage", "4000", "5000", "6000"),
                        Arrays.asList(1.0, null, 3.0, 4.0, 5.0, 6.0)));

        TypeNormalizationService.NormalizationResult result = service.normalize(raw, "t");

        double[] time = numeric(result.table(), "t").values();
        assertThat(time[0]).isEqualTo(1000.0);
        assertThat(time[1]).isNaN();
        assertThat(time[2]).isNaN();
        assertThat(time[3]).isEqualTo(4000.0);
        assertThat(result.diagnostics().column("t").filledCount()).isZero();
        assertThat(result.diagnostics().column("t").unparsedCount()).isEqualTo(1);
        assertThat(numeric(result.table(), "v").values()).containsExactly(1.0, 1.0, 3.0, 4.0, 5.0, 6.0);
    }

    @Test
    void matchesDesignatedTimeColumnByOriginalHeader() {
        RawTable raw = RawTable.ofColumns(List.of("Time Stamp"), List.of(Arrays.asList(null, 2.0)));

        TypeNormalizationService.NormalizationResult result = service.normalize(raw, "Time Stamp");

        assertThat(numeric(result.table(), "Time_Stamp").values()[0]).isNaN();
    }

    private static NumericColumn numeric(SanitizedTable table, String name) {
        return (NumericColumn) table.column(name).orElseThrow();
    }
}
