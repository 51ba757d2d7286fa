/* (C)2026 */
package com.ammann.timegraph.service;

import static com.ammann.timegraph.support.TestTables.numeric;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.timegraph.cache.TableGeneration;
import com.ammann.timegraph.enumeration.NormalizationMethod;
import com.ammann.timegraph.model.NumericBuffer;
import com.ammann.timegraph.support.TestTables;
import java.util.Locale;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SignalNormalizationServiceTest {

    private SignalNormalizationService service;
    private TableGeneration generation;

    @BeforeEach
    void setUp() {
        service = new SignalNormalizationService();
        generation = TestTables.publish(numeric("v", -2, 0, 4), numeric("flat", 3, 3, 3));
    }

    @Test
    void derivedKeyIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));

            assertThat(SignalNormalizationService.derivedKey("v", NormalizationMethod.MINMAX))
                    .isEqualTo("v::minmax");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void peakDividesByLargestMagnitude() {
        NumericBuffer result = service.normalize(generation, "v", NormalizationMethod.PEAK);

        assertThat(result.toArray()).containsExactly(-0.5, 0.0, 1.0);
    }

    @Test
    void minMaxMapsOntoUnitInterval() {
        NumericBuffer result = service.normalize(generation, "v", NormalizationMethod.MINMAX);

        assertThat(result.toArray()).containsExactly(0.0, 2.0 / 6.0, 1.0);
    }

    @Test
    void rmsDividesByRootMeanSquare() {
        NumericBuffer result = service.normalize(generation, "v", NormalizationMethod.RMS);
        double rms = Math.sqrt(20.0 / 3.0);

        assertThat(result.get(0)).isCloseTo(-2 / rms, within(1e-12));
        assertThat(result.get(2)).isCloseTo(4 / rms, within(1e-12));
    }

    @Test
    void zScoreCentersAndScales() {
        double[] values = service.normalize(generation, "v", NormalizationMethod.ZSCORE).toArray();

        double mean = (values[0] + values[1] + values[2]) / 3.0;
        double variance = (values[0] * values[0] + values[1] * values[1] + values[2] * values[2]) / 3.0;
        assertThat(mean).isCloseTo(0.0, within(1e-12));
        assertThat(variance).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void zeroDivisorReturnsUnchangedCopy() {
        NumericBuffer result = service.normalize(generation, "flat", NormalizationMethod.ZSCORE);

        assertThat(result.toArray()).containsExactly(3.0, 3.0, 3.0);
        assertThat(result).isNotSameAs(generation.getBuffer("flat"));
    }

    @Test
    void memoizesWithoutTouchingTheSource() {
        NumericBuffer first = service.normalize(generation, "v", NormalizationMethod.PEAK);
        NumericBuffer second = service.normalize(generation, "v", NormalizationMethod.PEAK);

        assertThat(second).isSameAs(first);
        assertThat(generation.hasDerived("v::peak")).isTrue();
        assertThat(generation.getBuffer("v").toArray()).containsExactly(-2.0, 0.0, 4.0);
        assertThat(generation.scanCount("v")).isEqualTo(1);
    }
}
