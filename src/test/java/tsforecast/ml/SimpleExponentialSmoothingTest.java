package tsforecast.ml;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SimpleExponentialSmoothingTest {

    private final double[] series = {10, 12, 13, 12, 15, 16, 14, 17, 19, 18, 20, 22};

    @Test
    @DisplayName("alpha = 1 reproduces the series")
    void alphaOne() {
        assertThat(SimpleExponentialSmoothing.smooth(series, 1.0)).containsExactly(series);
    }

    @Test
    @DisplayName("alpha = 0 stays at the first value")
    void alphaZero() {
        double[] out = SimpleExponentialSmoothing.smooth(series, 0.0);
        for (double v : out) {
            assertThat(v).isEqualTo(series[0]);
        }
    }

    @Test
    @DisplayName("recurrence s_i = a x_i + (1-a) s_{i-1}, fully defined")
    void recurrence() {
        double[] out = new SimpleExponentialSmoothing(0.3).fitAndPredict(new double[0], series);

        assertThat(out[0]).isEqualTo(10);
        assertThat(out[1]).isCloseTo(0.3 * 12 + 0.7 * 10, within(1e-12));
        assertThat(out[2]).isCloseTo(0.3 * 13 + 0.7 * out[1], within(1e-12));
        for (double v : out) assertThat(Forecaster.isDefined(v)).isTrue();
    }

    @Test
    void alphaOutsideUnitIntervalRejected() {
        assertThatThrownBy(() -> new SimpleExponentialSmoothing(1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SimpleExponentialSmoothing(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }
}
