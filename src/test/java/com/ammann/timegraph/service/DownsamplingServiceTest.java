/* (C)2026 */
package com.ammann.timegraph.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.timegraph.enumeration.DownsampleStrategy;
import com.ammann.timegraph.exception.ValidationException;
import com.ammann.timegraph.model.DownsampledSeries;
import com.ammann.timegraph.model.NumericBuffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DownsamplingServiceTest {

    private DownsamplingService service;

    @BeforeEach
    void setUp() {
        service = new DownsamplingService();
    }

    @Test
    void returnsSmallBuffersWhole() {
        NumericBuffer buffer = ramp(5);

        DownsampledSeries series = service.reduce(buffer, 5);

        assertThat(series.indices()).containsExactly(0, 1, 2, 3, 4);
        assertThat(series.values()).containsExactly(0.0, 1.0, 2.0, 3.0, 4.0);
    }

    @Test
    void takesEveryStrideSample() {
        DownsampledSeries series = service.reduce(ramp(10), 3);

        assertThat(series.indices()).containsExactly(0, 3, 6);
        assertThat(series.values()).containsExactly(0.0, 3.0, 6.0);
    }

    @ParameterizedTest
    @CsvSource({
        "0, 1, UNIFORM_STRIDE",
        "1, 1, UNIFORM_STRIDE",
        "1000, 1, UNIFORM_STRIDE",
        "1000, 7, UNIFORM_STRIDE",
        "1001, 1000, UNIFORM_STRIDE",
        "100000, 999, UNIFORM_STRIDE",
        "1000, 1, MIN_MAX_BUCKET",
        "1000, 7, MIN_MAX_BUCKET",
        "1001, 1000, MIN_MAX_BUCKET",
        "100000, 999, MIN_MAX_BUCKET"
    })
    void neverExceedsMaxPoints(int length, int maxPoints, DownsampleStrategy strategy) {
        NumericBuffer buffer = ramp(length);

        DownsampledSeries series = service.reduce(buffer, maxPoints, strategy);

        assertThat(series.size()).isLessThanOrEqualTo(maxPoints);
        assertThat(series.indices()).isSorted();
        for (int i = 0; i < series.size(); i++) {
            assertThat(series.values()[i]).isEqualTo(buffer.get(series.indices()[i]));
        }
    }

    @Test
    void minMaxBucketsKeepPeaks() {
        double[] values = new double[100];
        values[37] = 50.0;
        values[81] = -20.0;

        DownsampledSeries series =
                service.reduce(new NumericBuffer("spiky", values), 10, DownsampleStrategy.MIN_MAX_BUCKET);

        assertThat(series.indices()).contains(37, 81);
        assertThat(series.values()).contains(50.0, -20.0);
    }

    @Test
    void doesNotModifyTheSource() {
        NumericBuffer buffer = ramp(50);

        service.reduce(buffer, 4, DownsampleStrategy.MIN_MAX_BUCKET);
        service.reduce(buffer, 4);

        assertThat(buffer.toArray()).containsExactly(ramp(50).toArray());
    }

    @Test
    void rejectsNonPositiveMaxPoints() {
        assertThatThrownBy(() -> service.reduce(ramp(3), 0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("maxPoints");
    }

    @Test
    void usesConfiguredStrategy() {
        service.strategy = DownsampleStrategy.MIN_MAX_BUCKET;
        double[] values = new double[20];
        values[3] = 9.0;

        DownsampledSeries series = service.reduce(new NumericBuffer("v", values), 4);

        assertThat(series.indices()).contains(3);
    }

    private static NumericBuffer ramp(int length) {
        double[] values = new double[length];
        for (int i = 0; i < length; i++) {
            values[i] = i;
        }
        return new NumericBuffer("ramp", values);
    }
}
