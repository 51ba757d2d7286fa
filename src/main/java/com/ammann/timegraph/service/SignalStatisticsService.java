/* (C)2026 */
package com.ammann.timegraph.service;

import com.ammann.timegraph.cache.ColumnCache;
import com.ammann.timegraph.cache.StatisticsCache;
import com.ammann.timegraph.cache.TableGeneration;
import com.ammann.timegraph.enumeration.ThresholdMode;
import com.ammann.timegraph.model.NumericBuffer;
import com.ammann.timegraph.model.RowRange;
import com.ammann.timegraph.model.StatisticsSnapshot;
import com.ammann.timegraph.model.StatsCacheKey;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Arrays;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Descriptive statistics of a signal over a row range, memoized per table generation.
 *
 * <p>The standard deviation is the population deviation. Percentiles interpolate
 * linearly between the closest ranks. The duty cycle is the share of elapsed time the
 * signal spends above the threshold (the mean in {@link ThresholdMode#AUTO}), where a
 * level change is dated at the last sample before it.
 */
@ApplicationScoped
public class SignalStatisticsService {

    private static final Logger LOG = Logger.getLogger(SignalStatisticsService.class);

    static final int MIN_SAMPLES_FOR_MOMENTS = 11;

    @Inject MeterRegistry meterRegistry;

    private Counter hitCounter;
    private Counter missCounter;

    void initMetrics() {
        if (meterRegistry != null && hitCounter == null) {
            hitCounter = Counter.builder("timegraph_statistics_cache_requests_total")
                    .description("Statistics lookups answered from the cache")
                    .tag("result", "hit")
                    .register(meterRegistry);
            missCounter = Counter.builder("timegraph_statistics_cache_requests_total")
                    .description("Statistics lookups that had to be computed")
                    .tag("result", "miss")
                    .register(meterRegistry);
        }
    }

    public Optional<StatisticsSnapshot> statistics(
            ColumnCache cache,
            String signal,
            RowRange range,
            ThresholdMode mode,
            double thresholdValue,
            boolean percentiles) {
        return statistics(cache.current(), signal, range, mode, thresholdValue, percentiles);
    }

    /**
     * Computes, or returns the memoized, statistics of {@code signal} over {@code range}.
     *
     * @param range          rows to include; clamped to the table
     * @param mode           duty-cycle threshold mode
     * @param thresholdValue threshold for {@link ThresholdMode#MANUAL}, ignored otherwise
     * @param percentiles    whether median, quartiles and IQR are needed
     * @return empty if the range holds no rows
     * @throws com.ammann.timegraph.exception.UnknownColumnException    for unknown signals
     * @throws com.ammann.timegraph.exception.NonNumericColumnException for text signals
     */
    public Optional<StatisticsSnapshot> statistics(
            TableGeneration generation,
            String signal,
            RowRange range,
            ThresholdMode mode,
            double thresholdValue,
            boolean percentiles) {
        initMetrics();
        ThresholdMode effectiveMode = mode != null ? mode : ThresholdMode.AUTO;
        NumericBuffer values = generation.getBuffer(signal);
        RowRange rows = range.clampTo(generation.rowCount());
        if (rows.isEmpty()) {
            return Optional.empty();
        }

        StatisticsCache cache = generation.statistics();
        StatsCacheKey key = StatsCacheKey.of(signal, rows, effectiveMode, thresholdValue);
        Optional<StatisticsSnapshot> cached = cache.get(key);
        if (cached.isPresent() && (!percentiles || cached.get().hasPercentiles())) {
            increment(hitCounter);
            return cached;
        }
        increment(missCounter);

        double threshold = effectiveMode == ThresholdMode.MANUAL ? thresholdValue : Double.NaN;
        StatisticsSnapshot snapshot = compute(
                values.slice(rows.start(), rows.end()),
                generation.timeBuffer().slice(rows.start(), rows.end()),
                threshold,
                percentiles);
        cache.put(key, snapshot);
        LOG.debugf("Computed statistics for '%s' rows [%d, %d)", signal, rows.start(), rows.end());
        return Optional.of(snapshot);
    }

    /**
     * Statistics over the rows whose time lies in {@code [startSeconds, endSeconds]}.
     */
    public Optional<StatisticsSnapshot> statisticsForTimeRange(
            TableGeneration generation,
            String signal,
            double startSeconds,
            double endSeconds,
            ThresholdMode mode,
            double thresholdValue,
            boolean percentiles) {
        generation.getBuffer(signal);
        Optional<RowRange> rows = SignalLookupService.rowRange(generation.timeBuffer(), startSeconds, endSeconds);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return statistics(generation, signal, rows.get(), mode, thresholdValue, percentiles);
    }

    /**
     * @param y         signal values, at least one
     * @param x         times matching {@code y}
     * @param threshold duty-cycle threshold, {@code NaN} for the mean
     */
    static StatisticsSnapshot compute(double[] y, double[] x, double threshold, boolean percentiles) {
        int n = y.length;

        double sum = 0.0;
        double sumSquares = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : y) {
            sum += value;
            sumSquares += value * value;
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        double mean = sum / n;
        double rms = Math.sqrt(sumSquares / n);

        double m2 = 0.0;
        double m3 = 0.0;
        double m4 = 0.0;
        for (double value : y) {
            double d = value - mean;
            double d2 = d * d;
            m2 += d2;
            m3 += d2 * d;
            m4 += d2 * d2;
        }
        double std = Math.sqrt(m2 / n);

        Double skewness = null;
        Double kurtosis = null;
        if (n >= MIN_SAMPLES_FOR_MOMENTS && std > 0) {
            skewness = (m3 / n) / (std * std * std);
            kurtosis = (m4 / n) / (std * std * std * std) - 3.0;
        }

        Double median = null;
        Double q25 = null;
        Double q75 = null;
        Double iqr = null;
        if (percentiles) {
            double[] sorted = y.clone();
            Arrays.sort(sorted);
            median = percentile(sorted, 50.0);
            q25 = percentile(sorted, 25.0);
            q75 = percentile(sorted, 75.0);
            iqr = q75 - q25;
        }

        Double duration = null;
        Double sampleRate = null;
        if (n > 1) {
            duration = x[n - 1] - x[0];
            double meanStep = duration / (n - 1);
            sampleRate = meanStep > 0 ? 1.0 / meanStep : 0.0;
        }

        double effectiveThreshold = Double.isNaN(threshold) ? mean : threshold;
        return new StatisticsSnapshot(
                n,
                mean,
                min,
                max,
                rms,
                std,
                max - min,
                median,
                q25,
                q75,
                iqr,
                dutyCycle(y, x, effectiveThreshold),
                duration,
                sampleRate,
                skewness,
                kurtosis);
    }

    /**
     * Percentage of {@code [x[0], x[n-1]]} spent strictly above {@code threshold}.
     */
    static double dutyCycle(double[] y, double[] x, double threshold) {
        int n = y.length;
        if (n < 2) {
            return 0.0;
        }
        double total = x[n - 1] - x[0];
        if (!(total > 0)) {
            return 0.0;
        }

        double highTime = 0.0;
        boolean high = y[0] > threshold;
        double lastChange = x[0];
        for (int i = 1; i < n; i++) {
            boolean nowHigh = y[i] > threshold;
            if (nowHigh != high) {
                double changeTime = x[i - 1];
                if (high) {
                    highTime += changeTime - lastChange;
                }
                high = nowHigh;
                lastChange = changeTime;
            }
        }
        if (high) {
            highTime += x[n - 1] - lastChange;
        }
        return highTime / total * 100.0;
    }

    /**
     * Linear interpolation between closest ranks over an ascending array.
     */
    static double percentile(double[] sorted, double p) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = p / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    private static void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }
}
