/* (C)2026 */
package com.ammann.timegraph.service;

import com.ammann.timegraph.enumeration.DownsampleStrategy;
import com.ammann.timegraph.exception.ValidationException;
import com.ammann.timegraph.model.DownsampledSeries;
import com.ammann.timegraph.model.NumericBuffer;
import com.ammann.timegraph.properties.EngineProperties;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Reduces a buffer to at most {@code maxPoints} samples for display.
 *
 * <p>The source buffer is never modified. Buffers that already fit are returned whole.
 */
@ApplicationScoped
public class DownsamplingService {

    private static final Logger LOG = Logger.getLogger(DownsamplingService.class);

    static final int DEFAULT_MAX_POINTS = 10_000;

    @ConfigProperty(name = EngineProperties.Downsample.STRATEGY, defaultValue = "UNIFORM_STRIDE")
    DownsampleStrategy strategy = DownsampleStrategy.UNIFORM_STRIDE;

    @ConfigProperty(name = EngineProperties.Downsample.DEFAULT_MAX_POINTS, defaultValue = "10000")
    int defaultMaxPoints = DEFAULT_MAX_POINTS;

    public int defaultMaxPoints() {
        return defaultMaxPoints;
    }

    /**
     * Reduces {@code buffer} with the configured strategy.
     */
    public DownsampledSeries reduce(NumericBuffer buffer, int maxPoints) {
        return reduce(buffer, maxPoints, strategy);
    }

    /**
     * Reduces {@code buffer} to at most {@code maxPoints} samples.
     *
     * @throws ValidationException if {@code maxPoints < 1}
     */
    public DownsampledSeries reduce(NumericBuffer buffer, int maxPoints, DownsampleStrategy strategy) {
        if (maxPoints < 1) {
            throw ValidationException.invalidParameter("maxPoints", maxPoints, "a value of at least 1");
        }

        int length = buffer.length();
        if (length <= maxPoints) {
            return identity(buffer);
        }

        int[] indices = switch (strategy) {
            case UNIFORM_STRIDE -> strideIndices(length, maxPoints);
            case MIN_MAX_BUCKET -> maxPoints < 2
                    ? strideIndices(length, maxPoints)
                    : minMaxIndices(buffer, maxPoints);
        };

        double[] values = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            values[i] = buffer.get(indices[i]);
        }

        LOG.debugf("Downsampled '%s' from %d to %d points (%s)",
                buffer.source(), length, indices.length, strategy);
        return new DownsampledSeries(indices, values);
    }

    private static DownsampledSeries identity(NumericBuffer buffer) {
        int[] indices = new int[buffer.length()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        return new DownsampledSeries(indices, buffer.toArray());
    }

    static int[] strideIndices(int length, int maxPoints) {
        int stride = length / maxPoints;
        int[] indices = new int[maxPoints];
        for (int i = 0; i < maxPoints; i++) {
            indices[i] = i * stride;
        }
        return indices;
    }

    /**
     * Splits the buffer into {@code maxPoints / 2} contiguous buckets and keeps the
     * minimum and maximum of each. Ties resolve to the first occurrence.
     */
    static int[] minMaxIndices(NumericBuffer buffer, int maxPoints) {
        int length = buffer.length();
        int buckets = maxPoints / 2;
        int[] scratch = new int[buckets * 2];
        int count = 0;

        for (int b = 0; b < buckets; b++) {
            int from = (int) ((long) b * length / buckets);
            int to = (int) ((long) (b + 1) * length / buckets);
            if (from >= to) {
                continue;
            }
            int minIndex = from;
            int maxIndex = from;
            for (int i = from + 1; i < to; i++) {
                double value = buffer.get(i);
                if (value < buffer.get(minIndex)) {
                    minIndex = i;
                }
                if (value > buffer.get(maxIndex)) {
                    maxIndex = i;
                }
            }
            if (minIndex == maxIndex) {
                scratch[count++] = minIndex;
            } else {
                scratch[count++] = Math.min(minIndex, maxIndex);
                scratch[count++] = Math.max(minIndex, maxIndex);
            }
        }

        int[] indices = new int[count];
        System.arraycopy(scratch, 0, indices, 0, count);
        return indices;
    }
}
