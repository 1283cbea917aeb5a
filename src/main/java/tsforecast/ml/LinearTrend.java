package tsforecast.ml;

/**
 * Linear trend model: a {@link LinearRegression} of value on position, fitted on the
 * training segment only and extrapolated over every position of the full series.
 */
public class LinearTrend implements Forecaster {

    @Override
    public String getName() { return "Linear Regression"; }

    @Override
    public ModelFamily getFamily() { return ModelFamily.CLASSICAL; }

    @Override
    public double[] fitAndPredict(double[] train, double[] series) {
        return fit(train).predict(0, series.length);
    }

    public static LinearRegression fit(double[] train) {
        return new LinearRegression(train);
    }
}
