package tsforecast.ml;

/**
 * Holt's linear trend smoothing (double exponential smoothing).
 * <p>
 * L₀ = x₀, T₀ = x₁ − x₀<br>
 * Lᵢ = α·xᵢ + (1 − α)(Lᵢ₋₁ + Tᵢ₋₁)<br>
 * Tᵢ = β(Lᵢ − Lᵢ₋₁) + (1 − β)Tᵢ₋₁
 * <p>
 * The value reported at position i is the level Lᵢ alone, not Lᵢ + Tᵢ.
 */
public class HoltLinearTrend implements Forecaster {

    private final double alpha;
    private final double beta;

    public HoltLinearTrend(double alpha, double beta) {
        if (!(alpha >= 0 && alpha <= 1)) {
            throw new IllegalArgumentException("alpha must be in [0, 1], got " + alpha);
        }
        if (!(beta >= 0 && beta <= 1)) {
            throw new IllegalArgumentException("beta must be in [0, 1], got " + beta);
        }
        this.alpha = alpha;
        this.beta = beta;
    }

    @Override
    public String getName() { return "Holt Linear Trend"; }

    @Override
    public ModelFamily getFamily() { return ModelFamily.SMOOTHING; }

    @Override
    public double[] fitAndPredict(double[] train, double[] series) {
        return smooth(series, alpha, beta);
    }

    public static double[] smooth(double[] data, double alpha, double beta) {
        if (data.length < 2) {
            throw new IllegalArgumentException("Holt smoothing needs at least 2 observations, got " + data.length);
        }
        double[] out = new double[data.length];
        double level = data[0];
        double trend = data[1] - data[0];
        out[0] = level;
        for (int i = 1; i < data.length; i++) {
            double newLevel = alpha * data[i] + (1 - alpha) * (level + trend);
            trend = beta * (newLevel - level) + (1 - beta) * trend;
            level = newLevel;
            out[i] = level;
        }
        return out;
    }
}
