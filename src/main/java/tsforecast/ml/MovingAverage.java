package tsforecast.ml;

/**
 * Trailing moving average: the prediction at position i is the mean of the {@code window}
 * values ending at i. Positions before the first full window are undefined.
 */
public class MovingAverage implements Forecaster {

    public static final int DEFAULT_WINDOW = 3;

    private final int window;

    public MovingAverage(int window) {
        if (window < 1) throw new IllegalArgumentException("window must be >= 1, got " + window);
        this.window = window;
    }

    public MovingAverage() {
        this(DEFAULT_WINDOW);
    }

    @Override
    public String getName() { return "Moving Average"; }

    @Override
    public ModelFamily getFamily() { return ModelFamily.CLASSICAL; }

    public int getWindow() { return window; }

    /** Nothing to fit: the average is recomputed over the full series. */
    @Override
    public double[] fitAndPredict(double[] train, double[] series) {
        return smooth(series, window);
    }

    public static double[] smooth(double[] data, int window) {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            if (i < window - 1) {
                out[i] = UNDEFINED;
                continue;
            }
            double sum = 0;
            for (int j = i - window + 1; j <= i; j++) sum += data[j];
            out[i] = sum / window;
        }
        return out;
    }
}
