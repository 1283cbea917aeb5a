package tsforecast.ml;

/**
 * A univariate forecasting strategy.
 * <p>
 * Implementations are stateless: every call fits whatever parameters the model needs from
 * {@code train} and returns one prediction per position of {@code series}, using
 * {@link #UNDEFINED} where the model cannot produce a value (e.g. a warm-up window).
 */
public interface Forecaster {

    /** Marker for a position without a prediction. Test with {@link #isDefined(double)}. */
    double UNDEFINED = Double.NaN;

    String getName();

    ModelFamily getFamily();

    /**
     * @param train  leading segment of {@code series} used for fitting
     * @param series full series (train followed by test)
     * @return predictions aligned 1:1 with {@code series}
     */
    double[] fitAndPredict(double[] train, double[] series);

    static boolean isDefined(double prediction) {
        return Double.isFinite(prediction);
    }
}
