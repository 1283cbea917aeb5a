package tsforecast.ml;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HoltLinearTrendTest {

    @Test
    @DisplayName("forecast is the level only, not level + trend")
    void reportsLevel() {
        double[] x = {10, 12, 13};
        double[] out = HoltLinearTrend.smooth(x, 0.3, 0.1);

        double level0 = 10, trend0 = 2;
        double level1 = 0.3 * 12 + 0.7 * (level0 + trend0);
        double trend1 = 0.1 * (level1 - level0) + 0.9 * trend0;
        double level2 = 0.3 * 13 + 0.7 * (level1 + trend1);

        assertThat(out[0]).isEqualTo(10);
        assertThat(out[1]).isCloseTo(level1, within(1e-12));
        assertThat(out[2]).isCloseTo(level2, within(1e-12));
    }

    @Test
    @DisplayName("linear series is tracked exactly")
    void tracksLinearSeries() {
        double[] x = new double[10];
        for (int i = 0; i < x.length; i++) x[i] = 5 + 3 * i;

        double[] out = new HoltLinearTrend(0.3, 0.1).fitAndPredict(x, x);
        for (int i = 0; i < x.length; i++) {
            assertThat(out[i]).isCloseTo(x[i], within(1e-9));
        }
    }

    @Test
    void needsTwoObservations() {
        assertThatThrownBy(() -> HoltLinearTrend.smooth(new double[] {1}, 0.3, 0.1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("at least 2");
    }

    @Test
    void smoothingFactorsOutsideUnitIntervalRejected() {
        assertThatThrownBy(() -> new HoltLinearTrend(1.5, 0.1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("alpha");
        assertThatThrownBy(() -> new HoltLinearTrend(0.3, -0.1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("beta");
        assertThatThrownBy(() -> new HoltLinearTrend(0.3, Double.NaN))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
