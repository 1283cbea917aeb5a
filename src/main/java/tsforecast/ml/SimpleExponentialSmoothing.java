package tsforecast.ml;

/**
 * Simple exponential smoothing.
 * <p>
 * s₀ = x₀, sᵢ = α·xᵢ + (1 − α)·sᵢ₋₁
 */
public class SimpleExponentialSmoothing implements Forecaster {

    private final double alpha;

    public SimpleExponentialSmoothing(double alpha) {
        if (!(alpha >= 0 && alpha <= 1)) {
            throw new IllegalArgumentException("alpha must be in [0, 1], got " + alpha);
        }
        this.alpha = alpha;
    }

    @Override
    public String getName() { return "Simple Exponential Smoothing"; }

    @Override
    public ModelFamily getFamily() { return ModelFamily.SMOOTHING; }

    @Override
    public double[] fitAndPredict(double[] train, double[] series) {
        return smooth(series, alpha);
    }

    public static double[] smooth(double[] data, double alpha) {
        if (data.length == 0) return new double[0];
        double[] out = new double[data.length];
        out[0] = data[0];
        for (int i = 1; i < data.length; i++) {
            out[i] = alpha * data[i] + (1 - alpha) * out[i - 1];
        }
        return out;
    }
}
