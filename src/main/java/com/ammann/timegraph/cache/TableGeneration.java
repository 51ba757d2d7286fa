/* (C)2026 */
package com.ammann.timegraph.cache;

import com.ammann.timegraph.exception.NonNumericColumnException;
import com.ammann.timegraph.exception.UnknownColumnException;
import com.ammann.timegraph.model.Column;
import com.ammann.timegraph.model.NumericBuffer;
import com.ammann.timegraph.model.NumericColumn;
import com.ammann.timegraph.model.SanitizedTable;
import com.ammann.timegraph.model.TemporalColumn;
import io.micrometer.core.instrument.Counter;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * One published table together with every cache derived from it.
 *
 * <p>A generation is never modified after it has been replaced; callers that hold on to
 * it keep reading a consistent table. Buffers are materialized at most once per column:
 * {@link ConcurrentHashMap#computeIfAbsent} builds the array completely before it is
 * visible to other readers.
 */
public final class TableGeneration {

    private final long number;
    private final SanitizedTable table;
    private final String timeColumn;
    private final Map<String, NumericBuffer> buffers = new ConcurrentHashMap<>();
    private final Map<String, NumericBuffer> derived = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> scans = new ConcurrentHashMap<>();
    private final StatisticsCache statistics;
    private final Counter scanCounter;

    TableGeneration(
            long number,
            SanitizedTable table,
            String timeColumn,
            int statisticsCapacity,
            Counter scanCounter) {
        if (!table.hasColumn(timeColumn)) {
            throw new UnknownColumnException(timeColumn);
        }
        this.number = number;
        this.table = table;
        this.timeColumn = timeColumn;
        this.statistics = new StatisticsCache(statisticsCapacity);
        this.scanCounter = scanCounter;
    }

    public long number() {
        return number;
    }

    public SanitizedTable table() {
        return table;
    }

    public String timeColumn() {
        return timeColumn;
    }

    public int rowCount() {
        return table.rowCount();
    }

    public StatisticsCache statistics() {
        return statistics;
    }

    /**
     * Returns the numeric buffer of {@code name}, materializing it on first use.
     *
     * @throws UnknownColumnException    if the table has no such column
     * @throws NonNumericColumnException if the column holds text
     */
    public NumericBuffer getBuffer(String name) {
        Column column = table.column(name).orElseThrow(() -> new UnknownColumnException(name));
        if (!column.kind().isNumeric()) {
            throw new NonNumericColumnException(name);
        }
        return buffers.computeIfAbsent(name, key -> materialize(column));
    }

    /**
     * Like {@link #getBuffer(String)} but empty for unknown columns.
     *
     * @throws NonNumericColumnException if the column holds text
     */
    public Optional<NumericBuffer> findBuffer(String name) {
        if (name == null || !table.hasColumn(name)) {
            return Optional.empty();
        }
        return Optional.of(getBuffer(name));
    }

    public NumericBuffer timeBuffer() {
        return getBuffer(timeColumn);
    }

    /**
     * Memoizes a buffer computed from this generation's columns under {@code key}.
     */
    public NumericBuffer derived(String key, Supplier<NumericBuffer> computation) {
        return derived.computeIfAbsent(key, k -> computation.get());
    }

    public boolean hasDerived(String key) {
        return derived.containsKey(key);
    }

    /**
     * Number of times the source column was read to build a buffer.
     */
    public long scanCount(String name) {
        AtomicLong count = scans.get(name);
        return count == null ? 0 : count.get();
    }

    private NumericBuffer materialize(Column column) {
        double[] values = switch (column.kind()) {
            case NUMERIC -> ((NumericColumn) column).values();
            case TEMPORAL -> ((TemporalColumn) column).seconds();
            case TEXT -> throw new NonNumericColumnException(column.name());
        };
        scans.computeIfAbsent(column.name(), key -> new AtomicLong()).incrementAndGet();
        if (scanCounter != null) {
            scanCounter.increment();
        }
        return new NumericBuffer(column.name(), values);
    }
}
