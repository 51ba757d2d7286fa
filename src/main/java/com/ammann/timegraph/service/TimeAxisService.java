/* (C)2026 */
package com.ammann.timegraph.service;

import com.ammann.timegraph.dto.TimeAxisReportDTO;
import com.ammann.timegraph.enumeration.EpochUnit;
import com.ammann.timegraph.enumeration.TimeMode;
import com.ammann.timegraph.enumeration.TimeRepresentation;
import com.ammann.timegraph.exception.ValidationException;
import com.ammann.timegraph.model.Column;
import com.ammann.timegraph.model.ImportConfiguration;
import com.ammann.timegraph.model.NumericColumn;
import com.ammann.timegraph.model.SanitizedTable;
import com.ammann.timegraph.model.TemporalColumn;
import com.ammann.timegraph.model.TextColumn;
import com.ammann.timegraph.properties.EngineProperties;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Derives the time axis of a sanitized table.
 *
 * <p>Existing-column mode parses a designated column into seconds since the epoch;
 * synthetic mode generates {@code t_i = start + i / f}. The output is always a
 * {@link TemporalColumn} in seconds.
 *
 * <p>Rows whose time value cannot be parsed are dropped and counted. Out-of-order
 * timestamps are kept as they are and reported. If the designated column is missing the
 * resolver falls back to a synthetic axis at {@code timegraph.time.fallback-rate-hz}.
 */
@ApplicationScoped
public class TimeAxisService {

    private static final Logger LOG = Logger.getLogger(TimeAxisService.class);

    static final String SYNTHETIC_COLUMN = "time";
    static final double DEFAULT_FALLBACK_RATE_HZ = 1000.0;

    private static final List<DateTimeFormatter> FREE_TEXT_FORMATS = List.of(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            new DateTimeFormatterBuilder()
                    .append(DateTimeFormatter.ISO_LOCAL_DATE)
                    .appendLiteral(' ')
                    .append(DateTimeFormatter.ISO_LOCAL_TIME)
                    .toFormatter(Locale.ROOT),
            DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss", Locale.ROOT),
            DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm:ss", Locale.ROOT),
            DateTimeFormatter.ISO_LOCAL_DATE);

    @ConfigProperty(name = EngineProperties.Time.FALLBACK_RATE_HZ, defaultValue = "1000.0")
    double fallbackRateHz = DEFAULT_FALLBACK_RATE_HZ;

    @ConfigProperty(name = EngineProperties.Time.ZONE, defaultValue = "UTC")
    String zone = "UTC";

    Clock clock = Clock.systemUTC();

    /**
     * Resolves the time axis according to {@code config}.
     *
     * @param table  sanitized table
     * @param config import configuration
     * @return table carrying the temporal column, its name and a report
     * @throws ValidationException if the configuration is unusable (non-positive rate,
     *                             invalid pattern, missing custom start)
     */
    public TimeResolution resolve(SanitizedTable table, ImportConfiguration config) {
        ImportConfiguration effective = config != null ? config : ImportConfiguration.existing(null);

        if (effective.timeMode() == TimeMode.SYNTHETIC) {
            return synthesize(table, effective, false);
        }

        String columnName = effective.timeColumn();
        if (columnName == null || !table.hasColumn(columnName)) {
            LOG.warnf("Time column '%s' not found, generating a %.1f Hz axis", columnName, fallbackRateHz);
            ImportConfiguration fallback = ImportConfiguration.synthetic(fallbackRateHz);
            TimeResolution resolution = synthesize(table, fallback, true);
            String note = columnName == null
                    ? "No time column configured, generated synthetic time axis"
                    : String.format("Time column '%s' not found, generated synthetic time axis", columnName);
            return resolution.withNote(note);
        }

        return parseExisting(table, table.column(columnName).orElseThrow(), effective);
    }

    private TimeResolution parseExisting(SanitizedTable table, Column column, ImportConfiguration config) {
        TimeRepresentation representation = config.timeRepresentation();
        EpochUnit resolvedUnit = null;
        double[] seconds;

        switch (column.kind()) {
            case TEMPORAL -> seconds = ((TemporalColumn) column).seconds();
            case NUMERIC -> {
                double[] raw = ((NumericColumn) column).values();
                if (representation == TimeRepresentation.FORMAT || representation == TimeRepresentation.FREE_TEXT) {
                    seconds = parseText(numbersAsText(raw), representation, config.timeFormat());
                } else {
                    resolvedUnit = config.timeUnit().resolve(firstFinite(raw));
                    seconds = toSeconds(raw, resolvedUnit);
                }
            }
            case TEXT -> {
                String[] raw = ((TextColumn) column).values();
                if (representation == TimeRepresentation.EPOCH) {
                    double[] numeric = new double[raw.length];
                    for (int i = 0; i < raw.length; i++) {
                        numeric[i] = raw[i] == null ? Double.NaN : NumericProbe.parseToken(raw[i]);
                    }
                    resolvedUnit = config.timeUnit().resolve(firstFinite(numeric));
                    seconds = toSeconds(numeric, resolvedUnit);
                } else {
                    seconds = parseText(raw, representation, config.timeFormat());
                }
            }
            default -> throw new IllegalStateException("Unexpected column kind " + column.kind());
        }

        if (resolvedUnit == EpochUnit.MILLISECONDS && config.timeUnit() == EpochUnit.AUTO) {
            LOG.infof("Time column '%s' detected as millisecond timestamps, converted to seconds", column.name());
        }

        int[] keep = finiteRows(seconds);
        long dropped = seconds.length - keep.length;
        SanitizedTable updated = table.withReplacedColumn(new TemporalColumn(column.name(), seconds));
        if (dropped > 0) {
            LOG.warnf("Dropped %d rows with unparseable time values in column '%s'", dropped, column.name());
            updated = updated.selectRows(keep);
        }

        TemporalColumn time = (TemporalColumn) updated.column(column.name()).orElseThrow();
        long outOfOrder = time.decreasingSteps();
        if (outOfOrder > 0) {
            LOG.warnf("Time column '%s' has %d out-of-order steps, kept as is", column.name(), outOfOrder);
        }

        TimeAxisReportDTO report = new TimeAxisReportDTO(
                TimeMode.EXISTING,
                column.name(),
                representation,
                resolvedUnit,
                dropped,
                outOfOrder,
                false,
                null);
        List<String> notes = new ArrayList<>();
        if (dropped > 0) {
            notes.add(String.format("%d rows dropped: unparseable time value", dropped));
        }
        if (outOfOrder > 0) {
            notes.add(String.format("Time column '%s' is not monotonic (%d decreasing steps)", column.name(), outOfOrder));
        }
        return new TimeResolution(updated, column.name(), report, notes);
    }

    private TimeResolution synthesize(SanitizedTable table, ImportConfiguration config, boolean fallback) {
        Double rate = config.samplingRateHz();
        if (rate == null) {
            throw ValidationException.missingSetting("samplingRateHz", "a synthetic time axis");
        }
        if (!(rate > 0) || Double.isInfinite(rate)) {
            throw ValidationException.invalidParameter("samplingRateHz", rate, "a positive finite rate");
        }

        double start = switch (config.startInstantMode()) {
            case ZERO -> 0.0;
            case NOW -> epochSeconds(clock.instant());
            case CUSTOM -> {
                if (config.startInstant() == null) {
                    throw ValidationException.missingSetting("startInstant", "a CUSTOM start");
                }
                yield epochSeconds(config.startInstant());
            }
        };

        double[] seconds = new double[table.rowCount()];
        for (int i = 0; i < seconds.length; i++) {
            seconds[i] = start + i / rate;
        }

        String name = uniqueName(table, SYNTHETIC_COLUMN);
        LOG.infof("Generated synthetic time column '%s': %d rows at %.3f Hz starting at %.3f s",
                name, seconds.length, rate, start);

        SanitizedTable updated = table.withLeadingColumn(new TemporalColumn(name, seconds));
        return new TimeResolution(updated, name, TimeAxisReportDTO.synthetic(name, rate, fallback), List.of());
    }

    private double[] parseText(String[] raw, TimeRepresentation representation, String pattern) {
        List<DateTimeFormatter> formats;
        if (representation == TimeRepresentation.FORMAT) {
            if (pattern == null || pattern.isBlank()) {
                throw ValidationException.missingSetting("timeFormat", "FORMAT time representation");
            }
            try {
                formats = List.of(DateTimeFormatter.ofPattern(pattern, Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Invalid time format pattern '" + pattern + "'", e);
            }
        } else {
            formats = FREE_TEXT_FORMATS;
        }

        ZoneId zoneId = ZoneId.of(zone);
        double[] seconds = new double[raw.length];
        int preferred = 0;
        for (int i = 0; i < raw.length; i++) {
            seconds[i] = Double.NaN;
            if (raw[i] == null) {
                continue;
            }
            String text = raw[i].strip();
            for (int attempt = 0; attempt < formats.size(); attempt++) {
                int index = (preferred + attempt) % formats.size();
                double parsed = tryParse(formats.get(index), text, zoneId);
                if (!Double.isNaN(parsed)) {
                    seconds[i] = parsed;
                    preferred = index;
                    break;
                }
            }
        }
        return seconds;
    }

    /**
     * Parses {@code text}; returns {@code NaN} if the layout does not match. A mismatch is
     * a row-level defect counted by the caller.
     */
    private static double tryParse(DateTimeFormatter format, String text, ZoneId zoneId) {
        try {
            TemporalAccessor parsed = format.parse(text);
            Instant instant;
            if (parsed.isSupported(ChronoField.INSTANT_SECONDS)) {
                instant = Instant.from(parsed);
            } else if (parsed.isSupported(ChronoField.HOUR_OF_DAY)) {
                instant = LocalDateTime.from(parsed).atZone(zoneId).toInstant();
            } else {
                instant = LocalDate.from(parsed).atStartOfDay(zoneId).toInstant();
            }
            return epochSeconds(instant);
        } catch (DateTimeException e) {
            return Double.NaN;
        }
    }

    private static double[] toSeconds(double[] raw, EpochUnit unit) {
        double[] seconds = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            seconds[i] = unit.toSeconds(raw[i]);
        }
        return seconds;
    }

    private static String[] numbersAsText(double[] raw) {
        String[] text = new String[raw.length];
        for (int i = 0; i < raw.length; i++) {
            double value = raw[i];
            if (Double.isNaN(value)) {
                text[i] = null;
            } else if (value == Math.rint(value) && Math.abs(value) < 1e18) {
                text[i] = Long.toString((long) value);
            } else {
                text[i] = Double.toString(value);
            }
        }
        return text;
    }

    private static double firstFinite(double[] values) {
        for (double value : values) {
            if (Double.isFinite(value)) {
                return value;
            }
        }
        return 0.0;
    }

    private static int[] finiteRows(double[] values) {
        int count = 0;
        for (double value : values) {
            if (Double.isFinite(value)) {
                count++;
            }
        }
        int[] rows = new int[count];
        int next = 0;
        for (int i = 0; i < values.length; i++) {
            if (Double.isFinite(values[i])) {
                rows[next++] = i;
            }
        }
        return rows;
    }

    private static double epochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }

    private static String uniqueName(SanitizedTable table, String base) {
        if (!table.hasColumn(base)) {
            return base;
        }
        int counter = 1;
        while (table.hasColumn(base + "_" + counter)) {
            counter++;
        }
        return base + "_" + counter;
    }

    /**
     * Table with its resolved time axis.
     *
     * @param table      table containing the temporal column
     * @param timeColumn name of the temporal column
     * @param report     resolution report for the diagnostics channel
     * @param notes      human readable anomalies
     */
    public record TimeResolution(
            SanitizedTable table, String timeColumn, TimeAxisReportDTO report, List<String> notes) {

        public TimeResolution {
            notes = List.copyOf(notes);
        }

        TimeResolution withNote(String note) {
            List<String> merged = new ArrayList<>(notes);
            merged.add(note);
            return new TimeResolution(table, timeColumn, report, merged);
        }
    }
}
