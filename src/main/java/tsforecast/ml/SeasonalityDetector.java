package tsforecast.ml;

import org.apache.commons.math3.stat.StatUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Autocorrelation-based seasonality heuristic.
 * <p>
 * acf(ℓ) = Σ_{i=ℓ}^{n-1} (xᵢ − x̄)(xᵢ₋ℓ − x̄) / (n·σ²) for ℓ = 1 .. min(maxLag, ⌊n/2⌋),
 * with σ² the population variance.
 * <p>
 * A lag is a candidate period when its coefficient is strictly greater than both of its
 * neighbours in the autocorrelogram and above {@link #SIGNIFICANCE_THRESHOLD}. The smallest
 * candidate wins. The first and last lags have only one neighbour and never qualify.
 */
public final class SeasonalityDetector {

    public static final double SIGNIFICANCE_THRESHOLD = 0.3;
    public static final int DEFAULT_MAX_LAG = 24;

    private SeasonalityDetector() {
    }

    public static SeasonalityResult detect(double[] data) {
        return detect(data, DEFAULT_MAX_LAG);
    }

    public static SeasonalityResult detect(double[] data, int maxLag) {
        if (data == null || data.length == 0) throw new IllegalArgumentException("data must be non-empty");
        if (maxLag < 1) throw new IllegalArgumentException("maxLag must be >= 1, got " + maxLag);

        List<Autocorrelation> acf = autocorrelogram(data, maxLag);
        Integer period = null;
        for (int i = 1; i < acf.size() - 1; i++) {
            double v = acf.get(i).coefficient();
            if (v > acf.get(i - 1).coefficient() && v > acf.get(i + 1).coefficient() && v > SIGNIFICANCE_THRESHOLD) {
                period = acf.get(i).getLag();
                break;
            }
        }
        return new SeasonalityResult(period, acf);
    }

    /** Every coefficient is undefined for a constant series, so no lag qualifies as a period. */
    public static List<Autocorrelation> autocorrelogram(double[] data, int maxLag) {
        int n = data.length;
        double mean = StatUtils.mean(data);
        double variance = StatUtils.populationVariance(data, mean);
        double denominator = n * variance;

        int lags = Math.min(maxLag, n / 2);
        List<Autocorrelation> acf = new ArrayList<>(Math.max(lags, 0));
        for (int lag = 1; lag <= lags; lag++) {
            double sum = 0;
            for (int i = lag; i < n; i++) {
                sum += (data[i] - mean) * (data[i - lag] - mean);
            }
            acf.add(new Autocorrelation(lag, sum / denominator));
        }
        return acf;
    }
}
