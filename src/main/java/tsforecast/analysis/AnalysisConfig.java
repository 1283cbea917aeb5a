package tsforecast.analysis;

import tsforecast.ml.MovingAverage;
import tsforecast.ml.SeasonalityDetector;

/**
 * Parameters of an analysis run. Validated once, when built; a run never sees an invalid value.
 * <ul>
 *   <li>trainRatio: share of the series used for fitting, in [0.5, 0.9]</li>
 *   <li>alpha, beta, gamma: level, trend and season smoothing factors, each in (0, 1)</li>
 *   <li>maxLag: largest autocorrelation lag examined, &gt; 0</li>
 *   <li>movingAverageWindow: moving-average window, &ge; 1</li>
 * </ul>
 */
public final class AnalysisConfig {

    public static final double MIN_TRAIN_RATIO = 0.5;
    public static final double MAX_TRAIN_RATIO = 0.9;

    public static final double DEFAULT_TRAIN_RATIO = 0.8;
    public static final double DEFAULT_ALPHA = 0.3;
    public static final double DEFAULT_BETA = 0.1;
    public static final double DEFAULT_GAMMA = 0.1;

    private final double trainRatio;
    private final double alpha;
    private final double beta;
    private final double gamma;
    private final int maxLag;
    private final int movingAverageWindow;

    private AnalysisConfig(Builder b) {
        this.trainRatio = b.trainRatio;
        this.alpha = b.alpha;
        this.beta = b.beta;
        this.gamma = b.gamma;
        this.maxLag = b.maxLag;
        this.movingAverageWindow = b.movingAverageWindow;
    }

    public static AnalysisConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Clamp a user-supplied ratio into the accepted range, e.g. from a slider or request. */
    public static double clampTrainRatio(double ratio) {
        return Math.max(MIN_TRAIN_RATIO, Math.min(MAX_TRAIN_RATIO, ratio));
    }

    public double getTrainRatio() { return trainRatio; }
    public double getAlpha() { return alpha; }
    public double getBeta() { return beta; }
    public double getGamma() { return gamma; }
    public int getMaxLag() { return maxLag; }
    public int getMovingAverageWindow() { return movingAverageWindow; }

    public Builder toBuilder() {
        return new Builder()
            .trainRatio(trainRatio)
            .alpha(alpha)
            .beta(beta)
            .gamma(gamma)
            .maxLag(maxLag)
            .movingAverageWindow(movingAverageWindow);
    }

    @Override
    public String toString() {
        return "AnalysisConfig{trainRatio=" + trainRatio + ", alpha=" + alpha + ", beta=" + beta
            + ", gamma=" + gamma + ", maxLag=" + maxLag + ", movingAverageWindow=" + movingAverageWindow + "}";
    }

    public static final class Builder {
        private double trainRatio = DEFAULT_TRAIN_RATIO;
        private double alpha = DEFAULT_ALPHA;
        private double beta = DEFAULT_BETA;
        private double gamma = DEFAULT_GAMMA;
        private int maxLag = SeasonalityDetector.DEFAULT_MAX_LAG;
        private int movingAverageWindow = MovingAverage.DEFAULT_WINDOW;

        private Builder() {
        }

        public Builder trainRatio(double trainRatio) { this.trainRatio = trainRatio; return this; }
        public Builder alpha(double alpha) { this.alpha = alpha; return this; }
        public Builder beta(double beta) { this.beta = beta; return this; }
        public Builder gamma(double gamma) { this.gamma = gamma; return this; }
        public Builder maxLag(int maxLag) { this.maxLag = maxLag; return this; }
        public Builder movingAverageWindow(int window) { this.movingAverageWindow = window; return this; }

        /** @throws InvalidConfigurationException if any value is out of range */
        public AnalysisConfig build() {
            if (!(trainRatio >= MIN_TRAIN_RATIO && trainRatio <= MAX_TRAIN_RATIO)) {
                throw new InvalidConfigurationException(
                    "trainRatio must be in [" + MIN_TRAIN_RATIO + ", " + MAX_TRAIN_RATIO + "], got " + trainRatio);
            }
            requireOpenUnit("alpha", alpha);
            requireOpenUnit("beta", beta);
            requireOpenUnit("gamma", gamma);
            if (maxLag < 1) throw new InvalidConfigurationException("maxLag must be > 0, got " + maxLag);
            if (movingAverageWindow < 1) {
                throw new InvalidConfigurationException("movingAverageWindow must be >= 1, got " + movingAverageWindow);
            }
            return new AnalysisConfig(this);
        }

        private static void requireOpenUnit(String name, double value) {
            if (!(value > 0 && value < 1)) {
                throw new InvalidConfigurationException(name + " must be in (0, 1), got " + value);
            }
        }
    }
}
