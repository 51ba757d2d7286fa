/* (C)2026 */
package com.ammann.timegraph.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.timegraph.enumeration.ThresholdMode;
import com.ammann.timegraph.model.RowRange;
import com.ammann.timegraph.model.StatisticsSnapshot;
import com.ammann.timegraph.model.StatsCacheKey;
import org.junit.jupiter.api.Test;

class StatisticsCacheTest {

    @Test
    void recordsHitsAndMisses() {
        StatisticsCache cache = new StatisticsCache(4);
        StatsCacheKey key = StatsCacheKey.of("a", RowRange.all(3), ThresholdMode.AUTO, 0.0);

        assertThat(cache.get(key)).isEmpty();
        cache.put(key, snapshot(1.0));

        assertThat(cache.get(key)).contains(snapshot(1.0));
        assertThat(cache.hitCount()).isEqualTo(1);
        assertThat(cache.missCount()).isEqualTo(1);
    }

    @Test
    void evictsOldestEntryBeyondCapacity() {
        StatisticsCache cache = new StatisticsCache(2);
        StatsCacheKey first = StatsCacheKey.of("a", RowRange.all(1), ThresholdMode.AUTO, 0.0);
        StatsCacheKey second = StatsCacheKey.of("b", RowRange.all(1), ThresholdMode.AUTO, 0.0);
        StatsCacheKey third = StatsCacheKey.of("c", RowRange.all(1), ThresholdMode.AUTO, 0.0);

        cache.put(first, snapshot(1.0));
        cache.put(second, snapshot(2.0));
        cache.put(third, snapshot(3.0));

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get(first)).isEmpty();
        assertThat(cache.get(third)).isPresent();
    }

    @Test
    void autoThresholdValueDoesNotSplitKeys() {
        StatsCacheKey a = StatsCacheKey.of("a", RowRange.all(3), ThresholdMode.AUTO, 1.0);
        StatsCacheKey b = StatsCacheKey.of("a", RowRange.all(3), ThresholdMode.AUTO, 2.0);
        StatsCacheKey manual = StatsCacheKey.of("a", RowRange.all(3), ThresholdMode.MANUAL, 2.0);

        assertThat(a).isEqualTo(b);
        assertThat(manual).isNotEqualTo(b);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new StatisticsCache(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static StatisticsSnapshot snapshot(double mean) {
        return new StatisticsSnapshot(
                1, mean, mean, mean, mean, 0.0, 0.0, null, null, null, null, 0.0, null, null, null, null);
    }
}
