/* (C)2026 */
package com.ammann.timegraph.cache;

import com.ammann.timegraph.model.StatisticsSnapshot;
import com.ammann.timegraph.model.StatsCacheKey;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded memo of statistics results for one table generation.
 *
 * <p>Entries are evicted in insertion order once {@code capacity} is exceeded. All
 * access is synchronized; entries are immutable snapshots, so a reader never sees a
 * partially built value.
 */
public final class StatisticsCache {

    private final int capacity;
    private final Map<StatsCacheKey, StatisticsSnapshot> entries;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public StatisticsCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Statistics cache capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<StatsCacheKey, StatisticsSnapshot> eldest) {
                return size() > StatisticsCache.this.capacity;
            }
        };
    }

    /**
     * Looks up a snapshot and records a hit or a miss.
     */
    public synchronized Optional<StatisticsSnapshot> get(StatsCacheKey key) {
        StatisticsSnapshot snapshot = entries.get(key);
        if (snapshot == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(snapshot);
    }

    public synchronized void put(StatsCacheKey key, StatisticsSnapshot snapshot) {
        entries.put(key, snapshot);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public int capacity() {
        return capacity;
    }

    public long hitCount() {
        return hits.get();
    }

    public long missCount() {
        return misses.get();
    }
}
