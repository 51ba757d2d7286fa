/* (C)2026 */
package com.ammann.timegraph.model;

import com.ammann.timegraph.enumeration.ThresholdMode;
import java.util.Objects;

/**
 * Identity of a memoized statistics query.
 *
 * <p>Use {@link #of} so that the threshold value of {@link ThresholdMode#AUTO} queries
 * does not split the cache.
 */
public record StatsCacheKey(
        String signalName, RowRange rowRange, ThresholdMode thresholdMode, double thresholdValue) {

    public StatsCacheKey {
        Objects.requireNonNull(signalName, "signalName");
        Objects.requireNonNull(rowRange, "rowRange");
        Objects.requireNonNull(thresholdMode, "thresholdMode");
    }

    public static StatsCacheKey of(
            String signalName, RowRange rowRange, ThresholdMode mode, double thresholdValue) {
        double effective = mode == ThresholdMode.MANUAL ? thresholdValue : 0.0;
        return new StatsCacheKey(signalName, rowRange, mode, effective);
    }
}
