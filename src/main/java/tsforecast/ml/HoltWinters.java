package tsforecast.ml;

/**
 * Holt-Winters triple exponential smoothing with an additive or multiplicative season.
 * <p>
 * Initialisation: L₀ = x₀, T₀ = (x_s − x₀)/s, seasonal seed Sᵢ = xᵢ − L₀ (additive) or
 * xᵢ / L₀ (multiplicative) for i &lt; s.
 * <p>
 * Additive, for i ≥ 1 and k = i mod s:
 * <pre>
 *   Lᵢ = α(xᵢ − S_k) + (1 − α)(Lᵢ₋₁ + Tᵢ₋₁)
 *   Tᵢ = β(Lᵢ − Lᵢ₋₁) + (1 − β)Tᵢ₋₁
 *   S_k = γ(xᵢ − Lᵢ) + (1 − γ)S_k
 *   ŷᵢ = Lᵢ + Tᵢ + S_k
 * </pre>
 * Multiplicative replaces the differences with ratios and forecasts (Lᵢ + Tᵢ)·S_k.
 * Seasonal indices live in a ring of s slots updated in place. Every division by a
 * seasonal or level value goes through {@link SafeMath#safeDivide(double, double)}.
 * The prediction at position 0 is x₀.
 */
public class HoltWinters implements Forecaster {

    public enum Seasonality {
        ADDITIVE("Holt-Winters Additive"),
        MULTIPLICATIVE("Holt-Winters Multiplicative");

        private final String modelName;

        Seasonality(String modelName) {
            this.modelName = modelName;
        }

        public String getModelName() { return modelName; }
    }

    private final Seasonality seasonality;
    private final double alpha;
    private final double beta;
    private final double gamma;
    private final int season;

    public HoltWinters(Seasonality seasonality, double alpha, double beta, double gamma, int season) {
        if (seasonality == null) throw new IllegalArgumentException("seasonality required");
        if (season < 1) throw new IllegalArgumentException("season must be >= 1, got " + season);
        this.seasonality = seasonality;
        this.alpha = alpha;
        this.beta = beta;
        this.gamma = gamma;
        this.season = season;
    }

    @Override
    public String getName() { return seasonality.getModelName(); }

    @Override
    public ModelFamily getFamily() { return ModelFamily.SMOOTHING; }

    @Override
    public double[] fitAndPredict(double[] train, double[] series) {
        return seasonality == Seasonality.ADDITIVE ? additive(series) : multiplicative(series);
    }

    private double[] additive(double[] data) {
        checkLength(data);
        double[] out = new double[data.length];
        double level = data[0];
        double trend = (data[season] - data[0]) / season;
        SeasonalIndices indices = new SeasonalIndices(season);
        for (int i = 0; i < season; i++) {
            indices.set(i, data[i] - level);
        }
        out[0] = data[0];

        for (int i = 1; i < data.length; i++) {
            double newLevel = alpha * (data[i] - indices.get(i)) + (1 - alpha) * (level + trend);
            trend = beta * (newLevel - level) + (1 - beta) * trend;
            level = newLevel;
            indices.set(i, gamma * (data[i] - level) + (1 - gamma) * indices.get(i));
            out[i] = level + trend + indices.get(i);
        }
        return out;
    }

    private double[] multiplicative(double[] data) {
        checkLength(data);
        double[] out = new double[data.length];
        double level = data[0];
        double trend = (data[season] - data[0]) / season;
        SeasonalIndices indices = new SeasonalIndices(season);
        for (int i = 0; i < season; i++) {
            indices.set(i, SafeMath.safeDivide(data[i], level));
        }
        out[0] = data[0];

        for (int i = 1; i < data.length; i++) {
            double newLevel = alpha * SafeMath.safeDivide(data[i], indices.get(i)) + (1 - alpha) * (level + trend);
            trend = beta * (newLevel - level) + (1 - beta) * trend;
            level = newLevel;
            indices.set(i, gamma * SafeMath.safeDivide(data[i], level) + (1 - gamma) * indices.get(i));
            out[i] = (level + trend) * indices.get(i);
        }
        return out;
    }

    private void checkLength(double[] data) {
        if (data.length <= season) {
            throw new IllegalArgumentException(
                "Holt-Winters with season " + season + " needs more than " + season + " observations, got " + data.length);
        }
    }
}
