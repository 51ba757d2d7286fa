/* (C)2026 */
package com.ammann.timegraph.service;

import com.ammann.timegraph.cache.TableGeneration;
import com.ammann.timegraph.exception.ValidationException;
import com.ammann.timegraph.model.NumericBuffer;
import com.ammann.timegraph.model.RowRange;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Optional;

/**
 * Point and window lookups of a signal on the time axis.
 */
@ApplicationScoped
public class SignalLookupService {

    /**
     * Linearly interpolated value of {@code signal} at {@code timeSeconds}.
     *
     * <p>Assumes an ascending time axis. Returns empty for an empty table or a time
     * outside {@code [first, last]}.
     */
    public Optional<Double> valueAt(TableGeneration generation, String signal, double timeSeconds) {
        NumericBuffer values = generation.getBuffer(signal);
        NumericBuffer time = generation.timeBuffer();
        int n = Math.min(values.length(), time.length());
        if (n == 0 || Double.isNaN(timeSeconds)) {
            return Optional.empty();
        }
        if (timeSeconds < time.get(0) || timeSeconds > time.get(n - 1)) {
            return Optional.empty();
        }

        int low = 0;
        int high = n - 1;
        while (high - low > 1) {
            int mid = (low + high) >>> 1;
            if (time.get(mid) <= timeSeconds) {
                low = mid;
            } else {
                high = mid;
            }
        }

        double t0 = time.get(low);
        double t1 = time.get(high);
        if (timeSeconds <= t0 || t1 == t0) {
            return Optional.of(values.get(low));
        }
        if (timeSeconds >= t1) {
            return Optional.of(values.get(high));
        }
        double fraction = (timeSeconds - t0) / (t1 - t0);
        return Optional.of(values.get(low) + (values.get(high) - values.get(low)) * fraction);
    }

    /**
     * Rows of {@code signal} whose time lies in {@code [startSeconds, endSeconds]}.
     *
     * @throws com.ammann.timegraph.exception.UnknownColumnException for unknown signals
     */
    public Optional<RowRange> rangeOf(
            TableGeneration generation, String signal, double startSeconds, double endSeconds) {
        generation.getBuffer(signal);
        return rowRange(generation.timeBuffer(), startSeconds, endSeconds);
    }

    /**
     * Smallest row range covering every row whose time lies in {@code [start, end]};
     * empty if there is none.
     */
    static Optional<RowRange> rowRange(NumericBuffer time, double startSeconds, double endSeconds) {
        if (Double.isNaN(startSeconds) || Double.isNaN(endSeconds) || endSeconds < startSeconds) {
            throw ValidationException.invalidParameter(
                    "timeRange", "[" + startSeconds + ", " + endSeconds + "]", "start <= end");
        }
        int first = -1;
        int last = -1;
        for (int i = 0; i < time.length(); i++) {
            double t = time.get(i);
            if (t >= startSeconds && t <= endSeconds) {
                if (first < 0) {
                    first = i;
                }
                last = i;
            }
        }
        return first < 0 ? Optional.empty() : Optional.of(new RowRange(first, last + 1));
    }
}
