/* (C)2026 */
package com.ammann.timegraph.service;

import com.ammann.timegraph.dto.ColumnDiagnosticsDTO;
import com.ammann.timegraph.dto.LoadDiagnosticsDTO;
import com.ammann.timegraph.enumeration.ColumnKind;
import com.ammann.timegraph.exception.IngestionException;
import com.ammann.timegraph.model.Column;
import com.ammann.timegraph.model.NumericColumn;
import com.ammann.timegraph.model.RawTable;
import com.ammann.timegraph.model.SanitizedTable;
import com.ammann.timegraph.model.TemporalColumn;
import com.ammann.timegraph.model.TextColumn;
import com.ammann.timegraph.properties.EngineProperties;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Turns a freshly read {@link RawTable} into a {@link SanitizedTable}.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>drop rows whose field count differs from the header (counted, never fatal)</li>
 *   <li>sanitize and de-duplicate column names</li>
 *   <li>map null markers to the canonical missing value</li>
 *   <li>decide each column's kind; text columns are probed and coerced to numeric when
 *       the parse rate reaches {@link #COERCION_THRESHOLD}</li>
 *   <li>replace infinities by missing values, forward fill, fill leading gaps with zero</li>
 * </ol>
 *
 * <p>The designated time column is parsed but never filled: its missing and unparseable
 * cells stay {@code NaN} so that {@link TimeAxisService} can drop and count those rows.
 *
 * <p>Only a table without columns (or with disagreeing column lengths, see
 * {@link RawTable#ofColumns}) is fatal. Everything else degrades and is reported in the
 * returned {@link LoadDiagnosticsDTO}.
 */
@ApplicationScoped
public class TypeNormalizationService {

    private static final Logger LOG = Logger.getLogger(TypeNormalizationService.class);

    /**
     * Minimum share of parseable non-missing cells for a text column to become numeric.
     * Fixed policy: lower values coerce genuinely categorical data.
     */
    public static final double COERCION_THRESHOLD = 0.8;

    static final List<String> DEFAULT_NULL_MARKERS =
            List.of("NULL", "NA", "NaN", "None", "N/A", "-");

    /**
     * Literal tokens treated as missing, compared case-insensitively after trimming.
     * Blank cells are always missing.
     */
    @ConfigProperty(
            name = EngineProperties.Normalizer.NULL_MARKERS,
            defaultValue = EngineProperties.Normalizer.DEFAULT_NULL_MARKERS)
    List<String> nullMarkers = DEFAULT_NULL_MARKERS;

    /**
     * Normalizes a raw table without a designated time column.
     */
    public NormalizationResult normalize(RawTable raw) {
        return normalize(raw, null);
    }

    /**
     * Normalizes a raw table.
     *
     * @param raw        table as read by the external reader
     * @param timeColumn designated time column, by original or sanitized name; {@code null} if none
     * @return the sanitized table and its diagnostics
     * @throws IngestionException if the table has no columns
     */
    public NormalizationResult normalize(RawTable raw, String timeColumn) {
        if (raw == null || raw.columnCount() == 0) {
            throw IngestionException.noColumns();
        }

        long startTime = System.nanoTime();
        int width = raw.columnCount();

        List<List<Object>> rows = new ArrayList<>(raw.rowCount());
        long skippedRows = 0;
        for (List<Object> row : raw.rows()) {
            if (row.size() != width) {
                skippedRows++;
                continue;
            }
            rows.add(row);
        }
        if (skippedRows > 0) {
            LOG.warnf("Dropped %d of %d rows with a field count different from %d",
                    skippedRows, raw.rowCount(), width);
        }

        List<String> names = ColumnNameSanitizer.sanitize(raw.header());
        Set<String> markers = markerSet();

        List<Column> columns = new ArrayList<>(width);
        List<ColumnDiagnosticsDTO> diagnostics = new ArrayList<>(width);
        List<String> notes = new ArrayList<>();

        for (int c = 0; c < width; c++) {
            String originalName = raw.header().get(c);
            String name = names.get(c);
            if (!name.equals(originalName)) {
                LOG.debugf("Column '%s' renamed to '%s'", originalName, name);
            }

            List<Object> cells = new ArrayList<>(rows.size());
            long sourceMissing = 0;
            for (List<Object> row : rows) {
                Object cell = canonicalize(row.get(c), markers);
                if (cell == null) {
                    sourceMissing++;
                }
                cells.add(cell);
            }

            boolean isTime = timeColumn != null
                    && (timeColumn.equals(name) || timeColumn.equals(originalName));
            ColumnOutcome outcome = normalizeColumn(name, raw.declaredKind(c), cells, !isTime);
            columns.add(outcome.column());
            if (outcome.note() != null) {
                notes.add(outcome.note());
            }

            double nullPercent = rows.isEmpty() ? 0.0 : (sourceMissing * 100.0) / rows.size();
            diagnostics.add(new ColumnDiagnosticsDTO(
                    originalName,
                    name,
                    outcome.column().kind(),
                    sourceMissing,
                    nullPercent,
                    outcome.coerced(),
                    outcome.successRate(),
                    outcome.unparsedCount(),
                    outcome.infiniteCount(),
                    outcome.filledCount()));
        }

        SanitizedTable table = new SanitizedTable(columns);

        LOG.infof("Normalized table in %.2fms: %d columns, %d rows kept, %d rows skipped",
                (System.nanoTime() - startTime) / 1_000_000.0, width, rows.size(), skippedRows);

        LoadDiagnosticsDTO report = new LoadDiagnosticsDTO(
                raw.rowCount(),
                rows.size(),
                skippedRows,
                diagnostics,
                notes,
                null,
                Instant.now());
        return new NormalizationResult(table, report);
    }

    /**
     * Maps blank strings and configured null markers to {@code null} and non-finite
     * {@link Number}s other than infinities to {@code null}.
     */
    Object canonicalize(Object cell, Set<String> markers) {
        if (cell == null) {
            return null;
        }
        if (cell instanceof Number number) {
            return Double.isNaN(number.doubleValue()) ? null : number;
        }
        String text = cell.toString();
        String trimmed = text.strip();
        if (trimmed.isEmpty() || markers.contains(trimmed.toUpperCase(Locale.ROOT))) {
            return null;
        }
        return text;
    }

    private Set<String> markerSet() {
        Set<String> markers = new HashSet<>();
        if (nullMarkers != null) {
            for (String marker : nullMarkers) {
                markers.add(marker.strip().toUpperCase(Locale.ROOT));
            }
        }
        return markers;
    }

    private ColumnOutcome normalizeColumn(
            String name, ColumnKind declared, List<Object> cells, boolean fillGaps) {
        ColumnKind target = declared != null ? declared : inferKind(cells);

        return switch (target) {
            case TEMPORAL -> {
                NumericProbe.ProbeResult probe = NumericProbe.probe(cells);
                yield new ColumnOutcome(
                        new TemporalColumn(name, probe.parsed()),
                        false, null, probe.failedCount(), 0, 0, null);
            }
            case NUMERIC -> numericOutcome(name, NumericProbe.probe(cells), false, fillGaps);
            case TEXT -> {
                NumericProbe.ProbeResult probe = NumericProbe.probe(cells);
                if (probe.nonMissingCount() > 0 && probe.successRate() >= COERCION_THRESHOLD) {
                    LOG.debugf("Column '%s' coerced to numeric (%.1f%% parsed)",
                            name, probe.successRate() * 100.0);
                    yield numericOutcome(name, probe, true, fillGaps);
                }
                String note = probe.nonMissingCount() == 0
                        ? null
                        : String.format(Locale.ROOT, "Column '%s' kept as text (%.1f%% numeric)",
                                name, probe.successRate() * 100.0);
                if (note != null) {
                    LOG.info(note);
                }
                yield new ColumnOutcome(
                        new TextColumn(name, toText(cells)),
                        false, probe.nonMissingCount() == 0 ? null : probe.successRate(),
                        0, 0, 0, note);
            }
        };
    }

    /**
     * Columns whose present cells are all {@link Number}s are numeric; anything else
     * starts as text and may be coerced.
     */
    private ColumnKind inferKind(List<Object> cells) {
        boolean anyPresent = false;
        for (Object cell : cells) {
            if (cell == null) {
                continue;
            }
            if (!(cell instanceof Number)) {
                return ColumnKind.TEXT;
            }
            anyPresent = true;
        }
        return anyPresent ? ColumnKind.NUMERIC : ColumnKind.TEXT;
    }

    private ColumnOutcome numericOutcome(
            String name, NumericProbe.ProbeResult probe, boolean coerced, boolean fillGaps) {
        double[] values = probe.parsed();
        for (int i = 0; i < values.length; i++) {
            if (Double.isInfinite(values[i])) {
                values[i] = Double.NaN;
            }
        }
        int filled = fillGaps ? forwardFill(values) : 0;
        if (filled > 0) {
            LOG.debugf("Column '%s': filled %d missing values (%d infinite, %d unparsed)",
                    name, filled, probe.infiniteCount(), probe.failedCount());
        }
        return new ColumnOutcome(
                new NumericColumn(name, values),
                coerced,
                coerced ? probe.successRate() : null,
                probe.failedCount(),
                probe.infiniteCount(),
                filled,
                null);
    }

    /**
     * Carries the last valid value forward over {@code NaN}s; leading {@code NaN}s become
     * zero.
     *
     * @param values modified in place
     * @return number of filled positions
     */
    static int forwardFill(double[] values) {
        int filled = 0;
        double last = Double.NaN;
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                values[i] = Double.isNaN(last) ? 0.0 : last;
                filled++;
            } else {
                last = values[i];
            }
        }
        return filled;
    }

    private static String[] toText(List<Object> cells) {
        String[] text = new String[cells.size()];
        for (int i = 0; i < text.length; i++) {
            Object cell = cells.get(i);
            text[i] = cell == null ? null : cell.toString();
        }
        return text;
    }

    private record ColumnOutcome(
            Column column,
            boolean coerced,
            Double successRate,
            long unparsedCount,
            long infiniteCount,
            long filledCount,
            String note) {
    }

    /**
     * Sanitized table together with the report describing how it was produced.
     */
    public record NormalizationResult(SanitizedTable table, LoadDiagnosticsDTO diagnostics) {
    }
}
