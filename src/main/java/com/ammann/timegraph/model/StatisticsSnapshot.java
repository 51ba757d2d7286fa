/* (C)2026 */
package com.ammann.timegraph.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Immutable descriptive statistics of one signal over one row range.
 *
 * <p>Core scalars are always present. {@code median}, {@code q25}, {@code q75} and
 * {@code iqr} are {@code null} unless percentiles were requested. {@code skewness} and
 * {@code kurtosis} need more than ten samples and a non-zero deviation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatisticsSnapshot(
        int count,
        double mean,
        double min,
        double max,
        double rms,
        double standardDeviation,
        double peakToPeak,
        Double median,
        Double q25,
        Double q75,
        Double iqr,
        double dutyCyclePercent,
        Double durationSeconds,
        Double sampleRateHz,
        Double skewness,
        Double kurtosis) {

    public boolean hasPercentiles() {
        return median != null;
    }
}
