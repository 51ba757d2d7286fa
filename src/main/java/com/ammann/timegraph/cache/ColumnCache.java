/* (C)2026 */
package com.ammann.timegraph.cache;

import com.ammann.timegraph.model.NumericBuffer;
import com.ammann.timegraph.model.SanitizedTable;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.jboss.logging.Logger;

/**
 * Holder of the currently published {@link TableGeneration}.
 *
 * <p>Any number of readers may query concurrently under the read lock. Replacing the
 * table takes the write lock and swaps in a fresh generation; nothing from the previous
 * table (buffers, derived series, statistics) survives the swap.
 *
 * <p>Readers that need several values from the same table should take one
 * {@link #current()} snapshot and work on it.
 */
public class ColumnCache {

    private static final Logger LOG = Logger.getLogger(ColumnCache.class);

    static final int DEFAULT_STATISTICS_CAPACITY = 256;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong generations = new AtomicLong();
    private final int statisticsCapacity;
    private final Counter scanCounter;

    private TableGeneration current;

    public ColumnCache() {
        this(DEFAULT_STATISTICS_CAPACITY, null);
    }

    /**
     * @param statisticsCapacity maximum statistics entries per generation
     * @param meterRegistry      registry for the scan counter, may be {@code null}
     */
    public ColumnCache(int statisticsCapacity, MeterRegistry meterRegistry) {
        this.statisticsCapacity = statisticsCapacity;
        this.scanCounter = meterRegistry == null
                ? null
                : Counter.builder("timegraph_column_scans_total")
                        .description("Source column scans performed to materialize buffers")
                        .register(meterRegistry);
    }

    /**
     * Publishes {@code table} as a new generation.
     *
     * @param table      sanitized table with a resolved time axis
     * @param timeColumn name of its temporal column
     * @return the new generation
     */
    public TableGeneration replaceTable(SanitizedTable table, String timeColumn) {
        lock.writeLock().lock();
        try {
            TableGeneration next = new TableGeneration(
                    generations.incrementAndGet(), table, timeColumn, statisticsCapacity, scanCounter);
            TableGeneration previous = current;
            current = next;
            if (previous != null) {
                LOG.debugf("Replaced table generation %d with %d", previous.number(), next.number());
            }
            LOG.infof("Published table generation %d: %d columns, %d rows",
                    next.number(), table.columnCount(), table.rowCount());
            return next;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Drops the current table and all caches derived from it. */
    public void reset() {
        lock.writeLock().lock();
        try {
            if (current != null) {
                LOG.infof("Dropped table generation %d", current.number());
            }
            current = null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isLoaded() {
        return snapshot().isPresent();
    }

    /**
     * Returns the current generation, or empty if no table is loaded.
     */
    public Optional<TableGeneration> snapshot() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(current);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @throws IllegalStateException if no table is loaded
     */
    public TableGeneration current() {
        return snapshot().orElseThrow(() -> new IllegalStateException("No table loaded"));
    }

    public NumericBuffer getBuffer(String name) {
        lock.readLock().lock();
        try {
            return requireCurrent().getBuffer(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<NumericBuffer> findBuffer(String name) {
        lock.readLock().lock();
        try {
            return requireCurrent().findBuffer(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    public NumericBuffer timeBuffer() {
        lock.readLock().lock();
        try {
            return requireCurrent().timeBuffer();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Scan count of {@code name} in the current generation; zero if nothing is loaded.
     */
    public long scanCount(String name) {
        return snapshot().map(generation -> generation.scanCount(name)).orElse(0L);
    }

    /** Number of the current generation, zero if nothing is loaded. */
    public long generation() {
        return snapshot().map(TableGeneration::number).orElse(0L);
    }

    private TableGeneration requireCurrent() {
        if (current == null) {
            throw new IllegalStateException("No table loaded");
        }
        return current;
    }
}
