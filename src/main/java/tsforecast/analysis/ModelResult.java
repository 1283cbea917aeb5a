package tsforecast.analysis;

import tsforecast.ml.Forecaster;
import tsforecast.ml.MetricSet;
import tsforecast.ml.ModelFamily;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * A fitted model: its predictions over the whole series and its metrics on the test window.
 */
public final class ModelResult {

    private final String name;
    private final ModelFamily family;
    private final double[] predictions;
    private final MetricSet metrics;

    ModelResult(String name, ModelFamily family, double[] predictions, MetricSet metrics) {
        this.name = name;
        this.family = family;
        this.predictions = predictions.clone();
        this.metrics = metrics;
    }

    public String getName() { return name; }
    public ModelFamily getFamily() { return family; }
    public MetricSet getMetrics() { return metrics; }

    /** Number of positions, equal to the series length. */
    public int size() { return predictions.length; }

    public boolean isDefined(int position) {
        return Forecaster.isDefined(predictions[position]);
    }

    public OptionalDouble getPrediction(int position) {
        return isDefined(position) ? OptionalDouble.of(predictions[position]) : OptionalDouble.empty();
    }

    /** Predictions aligned with the series; {@code null} where the model has no value. */
    public List<Double> getPredictions() {
        List<Double> out = new ArrayList<>(predictions.length);
        for (int i = 0; i < predictions.length; i++) {
            out.add(isDefined(i) ? predictions[i] : null);
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public String toString() {
        return name + " [" + family.getLabel() + "] " + metrics;
    }
}
