package tsforecast.ml;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HoltWintersTest {

    private static final double[] SERIES = {10, 20, 30, 12, 22, 32, 14, 24, 34, 16};

    @Nested
    @DisplayName("additive")
    class Additive {

        @Test
        @DisplayName("matches hand-computed recurrence")
        void knownValues() {
            double[] out = new HoltWinters(HoltWinters.Seasonality.ADDITIVE, 0.3, 0.1, 0.1, 3)
                .fitAndPredict(SERIES, SERIES);

            assertThat(out).hasSize(SERIES.length);
            assertThat(out[0]).isEqualTo(10);
            assertThat(out[1]).isCloseTo(21.066666666666663, within(1e-9));
            assertThat(out[2]).isCloseTo(31.314666666666664, within(1e-9));
            assertThat(out[3]).isCloseTo(12.248826666666664, within(1e-9));
            assertThat(out[9]).isCloseTo(16.145518053879123, within(1e-9));
        }

        @Test
        void needsMoreObservationsThanSeason() {
            HoltWinters hw = new HoltWinters(HoltWinters.Seasonality.ADDITIVE, 0.3, 0.1, 0.1, 4);
            assertThatThrownBy(() -> hw.fitAndPredict(new double[] {1, 2, 3, 4}, new double[] {1, 2, 3, 4}))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("multiplicative")
    class Multiplicative {

        @Test
        @DisplayName("matches hand-computed recurrence")
        void knownValues() {
            double[] out = new HoltWinters(HoltWinters.Seasonality.MULTIPLICATIVE, 0.3, 0.1, 0.1, 3)
                .fitAndPredict(SERIES, SERIES);

            assertThat(out[0]).isEqualTo(10);
            assertThat(out[1]).isCloseTo(22.12756687898089, within(1e-9));
            assertThat(out[5]).isCloseTo(36.81974201969546, within(1e-9));
            assertThat(out[9]).isCloseTo(15.089587425275417, within(1e-9));
        }

        @Test
        @DisplayName("zero level and zero seasonal factors do not produce NaN or Infinity")
        void zeroGuards() {
            double[] data = {0, 5, 0, 5, 0, 5, 0, 5};
            double[] out = new HoltWinters(HoltWinters.Seasonality.MULTIPLICATIVE, 0.3, 0.1, 0.1, 2)
                .fitAndPredict(data, data);

            for (double v : out) assertThat(Double.isFinite(v)).isTrue();
            assertThat(out[0]).isEqualTo(0);
            assertThat(out[1]).isCloseTo(2.035, within(1e-9));
        }
    }

    @Test
    void namesAndFamily() {
        assertThat(new HoltWinters(HoltWinters.Seasonality.ADDITIVE, 0.3, 0.1, 0.1, 2).getName())
            .isEqualTo("Holt-Winters Additive");
        assertThat(new HoltWinters(HoltWinters.Seasonality.MULTIPLICATIVE, 0.3, 0.1, 0.1, 2).getFamily())
            .isEqualTo(ModelFamily.SMOOTHING);
    }

    @Test
    void safeDivideSubstitutesOneForZero() {
        assertThat(SafeMath.safeDivide(6, 0)).isEqualTo(6);
        assertThat(SafeMath.safeDivide(6, 3)).isEqualTo(2);
        assertThat(SafeMath.safeDivide(6, 0, 2)).isEqualTo(3);
        assertThat(SafeMath.safeDivide(6, -0.0)).isEqualTo(6);
    }

    @Test
    void seasonalIndicesWrapAround() {
        SeasonalIndices indices = new SeasonalIndices(3);
        indices.set(0, 1);
        indices.set(4, 2);
        indices.set(8, 3);

        assertThat(indices.get(3)).isEqualTo(1);
        assertThat(indices.get(1)).isEqualTo(2);
        assertThat(indices.get(2)).isEqualTo(3);
        assertThat(indices.get(-1)).isEqualTo(3);
    }
}
