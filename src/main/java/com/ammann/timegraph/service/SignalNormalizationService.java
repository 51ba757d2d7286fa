/* (C)2026 */
package com.ammann.timegraph.service;

import com.ammann.timegraph.cache.TableGeneration;
import com.ammann.timegraph.enumeration.NormalizationMethod;
import com.ammann.timegraph.model.NumericBuffer;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Locale;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Scaled copies of signals for overlaying series with different units.
 *
 * <p>Results live in the generation's derived cache; the source buffer is never
 * replaced. A zero divisor (silent signal, constant signal) yields an unchanged copy.
 */
@ApplicationScoped
public class SignalNormalizationService {

    private static final Logger LOG = Logger.getLogger(SignalNormalizationService.class);

    public NumericBuffer normalize(TableGeneration generation, String signal, NormalizationMethod method) {
        Objects.requireNonNull(method, "method");
        NumericBuffer source = generation.getBuffer(signal);
        String key = derivedKey(signal, method);
        return generation.derived(key, () -> new NumericBuffer(key, apply(source.toArray(), method)));
    }

    static String derivedKey(String signal, NormalizationMethod method) {
        return signal + "::" + method.name().toLowerCase(Locale.ROOT);
    }

    /**
     * Normalizes {@code data} in place.
     */
    static double[] apply(double[] data, NormalizationMethod method) {
        if (data.length == 0) {
            return data;
        }

        double offset;
        double divisor;
        switch (method) {
            case PEAK -> {
                double peak = 0.0;
                for (double value : data) {
                    peak = Math.max(peak, Math.abs(value));
                }
                offset = 0.0;
                divisor = peak;
            }
            case RMS -> {
                double sumSquares = 0.0;
                for (double value : data) {
                    sumSquares += value * value;
                }
                offset = 0.0;
                divisor = Math.sqrt(sumSquares / data.length);
            }
            case MINMAX -> {
                double min = Double.POSITIVE_INFINITY;
                double max = Double.NEGATIVE_INFINITY;
                for (double value : data) {
                    min = Math.min(min, value);
                    max = Math.max(max, value);
                }
                offset = min;
                divisor = max - min;
            }
            case ZSCORE -> {
                double sum = 0.0;
                for (double value : data) {
                    sum += value;
                }
                double mean = sum / data.length;
                double m2 = 0.0;
                for (double value : data) {
                    m2 += (value - mean) * (value - mean);
                }
                offset = mean;
                divisor = Math.sqrt(m2 / data.length);
            }
            default -> throw new IllegalArgumentException("Unsupported normalization " + method);
        }

        if (divisor == 0.0 || !Double.isFinite(divisor)) {
            LOG.debugf("Normalization %s has a zero divisor, returning values unchanged", method);
            return data;
        }
        for (int i = 0; i < data.length; i++) {
            data[i] = (data[i] - offset) / divisor;
        }
        return data;
    }
}
