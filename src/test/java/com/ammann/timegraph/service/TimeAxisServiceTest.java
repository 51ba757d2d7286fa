/* (C)2026 */
package com.ammann.timegraph.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.timegraph.enumeration.EpochUnit;
import com.ammann.timegraph.enumeration.StartInstantMode;
import com.ammann.timegraph.enumeration.TimeMode;
import com.ammann.timegraph.enumeration.TimeRepresentation;
import com.ammann.timegraph.exception.ValidationException;
import com.ammann.timegraph.model.ImportConfiguration;
import com.ammann.timegraph.model.NumericColumn;
import com.ammann.timegraph.model.SanitizedTable;
import com.ammann.timegraph.model.TemporalColumn;
import com.ammann.timegraph.model.TextColumn;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TimeAxisServiceTest {

    private TimeAxisService service;

    @BeforeEach
    void setUp() {
        service = new TimeAxisService();
    }

    @Test
    void detectsMillisecondEpochs() {
        SanitizedTable table = new SanitizedTable(List.of(
                new NumericColumn("ts", new double[] {1704110400000.0, 1704110401000.0}),
                new NumericColumn("v", new double[] {1, 2})));

        TimeAxisService.TimeResolution resolution = service.resolve(table, ImportConfiguration.existing("ts"));

        TemporalColumn time = temporal(resolution);
        assertThat(time.seconds()).containsExactly(1704110400.0, 1704110401.0);
        assertThat(resolution.report().resolvedUnit()).isEqualTo(EpochUnit.MILLISECONDS);
        assertThat(resolution.timeColumn()).isEqualTo("ts");
    }

    @Test
    void keepsSecondEpochsAsIs() {
        SanitizedTable table = new SanitizedTable(List.of(
                new NumericColumn("ts", new double[] {1704110400.0, 1704110400.5})));

        TimeAxisService.TimeResolution resolution = service.resolve(table, ImportConfiguration.existing("ts"));

        assertThat(temporal(resolution).seconds()).containsExactly(1704110400.0, 1704110400.5);
        assertThat(resolution.report().resolvedUnit()).isEqualTo(EpochUnit.SECONDS);
    }

    @Test
    void appliesExplicitEpochUnit() {
        SanitizedTable table = new SanitizedTable(List.of(
                new NumericColumn("ts", new double[] {1_000_000.0, 2_500_000.0})));

        TimeAxisService.TimeResolution resolution =
                service.resolve(table, ImportConfiguration.epoch("ts", EpochUnit.MICROSECONDS));

        assertThat(temporal(resolution).seconds()).containsExactly(1.0, 2.5);
    }

    @Test
    void parsesFormattedTextAndDropsUnparseableRows() {
        SanitizedTable table = new SanitizedTable(List.of(
                new TextColumn("stamp", new String[] {"2024-01-01 12:00:00", "garbage", "2024-01-01 12:00:02"}),
                new NumericColumn("v", new double[] {1, 2, 3})));

        TimeAxisService.TimeResolution resolution =
                service.resolve(table, ImportConfiguration.formatted("stamp", "yyyy-MM-dd HH:mm:ss"));

        assertThat(temporal(resolution).seconds()).containsExactly(1704110400.0, 1704110402.0);
        assertThat(resolution.table().rowCount()).isEqualTo(2);
        assertThat(((NumericColumn) resolution.table().column("v").orElseThrow()).values())
                .containsExactly(1.0, 3.0);
        assertThat(resolution.report().droppedRows()).isEqualTo(1);
        assertThat(resolution.notes()).anySatisfy(note -> assertThat(note).contains("1 rows dropped"));
    }

    @Test
    void parsesFreeTextInSeveralLayouts() {
        SanitizedTable table = new SanitizedTable(List.of(new TextColumn("stamp", new String[] {
            "2024-01-01T00:00:00Z",
            "2024-01-01T00:00:01",
            "2024-01-01 00:00:02.5",
            "01/01/2024 00:00:03",
            "01.01.2024 00:00:04",
            "2024-01-02"
        })));

        TimeAxisService.TimeResolution resolution = service.resolve(table,
                new ImportConfiguration(TimeMode.EXISTING, "stamp", TimeRepresentation.FREE_TEXT,
                        null, null, null, null, null));

        double base = 1704067200.0;
        assertThat(temporal(resolution).seconds())
                .containsExactly(base, base + 1, base + 2.5, base + 3, base + 4, base + 86400);
    }

    @Test
    void parsesEpochTextColumns() {
        SanitizedTable table = new SanitizedTable(List.of(
                new TextColumn("ts", new String[] {"1704110400000", "1704110400500"})));

        TimeAxisService.TimeResolution resolution = service.resolve(table,
                new ImportConfiguration(TimeMode.EXISTING, "ts", TimeRepresentation.EPOCH,
                        null, EpochUnit.AUTO, null, null, null));

        assertThat(temporal(resolution).seconds()).containsExactly(1704110400.0, 1704110400.5);
    }

    @Test
    void reportsOutOfOrderStepsWithoutReordering() {
        SanitizedTable table = new SanitizedTable(List.of(
                new NumericColumn("ts", new double[] {0, 2, 1, 3, 2})));

        TimeAxisService.TimeResolution resolution = service.resolve(table, ImportConfiguration.existing("ts"));

        assertThat(temporal(resolution).seconds()).containsExactly(0.0, 2.0, 1.0, 3.0, 2.0);
        assertThat(resolution.report().outOfOrderSteps()).isEqualTo(2);
        assertThat(resolution.report().hasAnomalies()).isTrue();
    }

    @Test
    void rejectsInvalidFormatPattern() {
        SanitizedTable table = new SanitizedTable(List.of(new TextColumn("ts", new String[] {"x"})));

        assertThatThrownBy(() -> service.resolve(table, ImportConfiguration.formatted("ts", "yyyy-{{")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("yyyy-{{");
    }

    @Test
    void fallsBackToSyntheticAxisWhenColumnMissing() {
        SanitizedTable table = new SanitizedTable(List.of(new NumericColumn("v", new double[] {5, 6, 7})));

        TimeAxisService.TimeResolution resolution = service.resolve(table, ImportConfiguration.existing("nope"));

        assertThat(resolution.timeColumn()).isEqualTo("time");
        assertThat(resolution.table().columnNames()).containsExactly("time", "v");
        assertThat(temporal(resolution).seconds()).containsExactly(0.0, 0.001, 0.002);
        assertThat(resolution.report().fallbackUsed()).isTrue();
        assertThat(resolution.report().mode()).isEqualTo(TimeMode.SYNTHETIC);
        assertThat(resolution.notes()).anySatisfy(note -> assertThat(note).contains("nope"));
    }

    @Test
    void generatesSyntheticAxisFromZero() {
        SanitizedTable table = new SanitizedTable(List.of(new NumericColumn("v", new double[] {1, 2, 3, 4})));

        TimeAxisService.TimeResolution resolution = service.resolve(table, ImportConfiguration.synthetic(4.0));

        assertThat(temporal(resolution).seconds()).containsExactly(0.0, 0.25, 0.5, 0.75);
        assertThat(resolution.report().samplingRateHz()).isEqualTo(4.0);
        assertThat(resolution.report().fallbackUsed()).isFalse();
    }

    @Test
    void syntheticAxisAvoidsNameCollision() {
        SanitizedTable table = new SanitizedTable(List.of(new NumericColumn("time", new double[] {1, 2})));

        TimeAxisService.TimeResolution resolution = service.resolve(table, ImportConfiguration.synthetic(1.0));

        assertThat(resolution.timeColumn()).isEqualTo("time_1");
        assertThat(resolution.table().columnNames()).containsExactly("time_1", "time");
    }

    @Test
    void syntheticAxisStartsNowOrAtCustomInstant() {
        SanitizedTable table = new SanitizedTable(List.of(new NumericColumn("v", new double[] {1, 2})));
        service.clock = Clock.fixed(Instant.ofEpochSecond(1_000), ZoneOffset.UTC);

        TimeAxisService.TimeResolution now = service.resolve(
                table, ImportConfiguration.synthetic(2.0, StartInstantMode.NOW, null));
        TimeAxisService.TimeResolution custom = service.resolve(
                table, ImportConfiguration.synthetic(2.0, StartInstantMode.CUSTOM, Instant.ofEpochMilli(5_500)));

        assertThat(temporal(now).seconds()).containsExactly(1000.0, 1000.5);
        assertThat(temporal(custom).seconds()[0]).isCloseTo(5.5, within(1e-9));
        assertThat(temporal(custom).seconds()[1]).isCloseTo(6.0, within(1e-9));
    }

    @Test
    void rejectsInvalidSyntheticConfiguration() {
        SanitizedTable table = new SanitizedTable(List.of(new NumericColumn("v", new double[] {1})));

        assertThatThrownBy(() -> service.resolve(table, ImportConfiguration.synthetic(0.0)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("samplingRateHz");
        assertThatThrownBy(() -> service.resolve(table, ImportConfiguration.synthetic(-5.0)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.resolve(
                        table, ImportConfiguration.synthetic(1.0, StartInstantMode.CUSTOM, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("startInstant");
    }

    @Test
    void detectsMillisecondsPastLeadingGapAndDropsIt() {
        SanitizedTable table = new SanitizedTable(List.of(
                new NumericColumn("t", new double[] {Double.NaN, 1704110400000.0, 1704110401000.0}),
                new NumericColumn("v", new double[] {1, 2, 3})));

        TimeAxisService.TimeResolution resolution = service.resolve(table, ImportConfiguration.existing("t"));

        assertThat(resolution.report().resolvedUnit()).isEqualTo(EpochUnit.MILLISECONDS);
        assertThat(resolution.report().droppedRows()).isEqualTo(1);
        assertThat(temporal(resolution).seconds()).containsExactly(1704110400.0, 1704110401.0);
        assertThat(((NumericColumn) resolution.table().column("v").orElseThrow()).values())
                .containsExactly(2.0, 3.0);
    }

    private static TemporalColumn temporal(TimeAxisService.TimeResolution resolution) {
        return (TemporalColumn) resolution.table().column(resolution.timeColumn()).orElseThrow();
    }
}
