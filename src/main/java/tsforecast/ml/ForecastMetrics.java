package tsforecast.ml;

/**
 * Scores a prediction sequence against the actual values it is aligned with.
 * <p>
 * Only pairs whose prediction is defined and finite are counted (n). With eᵢ = actualᵢ − predictedᵢ:
 * <pre>
 *   MSE  = Σe² / n            RMSE = √MSE
 *   MAE  = Σ|e| / n           MAPE = 100 · Σ_{actual≠0} |e / actual| / n
 *   AIC  = n·ln(MSE) + 2k     BIC  = n·ln(MSE) + k·ln(n)
 * </pre>
 * k is {@link #EFFECTIVE_PARAMETERS} for every model, so AIC/BIC only compare fit quality
 * between models of the same run. A perfect fit (MSE = 0) leaves AIC and BIC undefined.
 * MAPE is undefined when every counted actual is zero.
 */
public final class ForecastMetrics {

    public static final int EFFECTIVE_PARAMETERS = 3;

    private ForecastMetrics() {
    }

    public static MetricSet evaluate(double[] actual, double[] predicted) {
        if (actual == null || predicted == null || actual.length != predicted.length) {
            throw new IllegalArgumentException("actual and predicted must be non-null and of the same length");
        }
        int n = 0, nonZeroActuals = 0;
        double sse = 0, sae = 0, sape = 0;
        for (int i = 0; i < actual.length; i++) {
            if (!Forecaster.isDefined(predicted[i])) continue;
            double error = actual[i] - predicted[i];
            sse += error * error;
            sae += Math.abs(error);
            if (actual[i] != 0) {
                sape += Math.abs(error / actual[i]);
                nonZeroActuals++;
            }
            n++;
        }
        if (n == 0) {
            return new MetricSet(0, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
        }

        double mse = sse / n;
        double logMse = Math.log(mse);
        return new MetricSet(n,
            mse,
            Math.sqrt(mse),
            sae / n,
            nonZeroActuals > 0 ? sape / n * 100 : Double.NaN,
            n * logMse + 2 * EFFECTIVE_PARAMETERS,
            n * logMse + EFFECTIVE_PARAMETERS * Math.log(n));
    }
}
