package tsforecast.ml;

import org.apache.commons.math3.stat.StatUtils;

import java.util.Arrays;
import java.util.OptionalDouble;

/**
 * Descriptive statistics of a series: population moments, median and range.
 * <p>
 * Skewness and excess kurtosis are standardised by the population standard deviation and
 * are undefined (empty) for a constant series.
 */
public final class DescriptiveSummary {

    private final int count;
    private final double mean;
    private final double variance;
    private final double std;
    private final double median;
    private final double min;
    private final double max;
    private final double skewness;
    private final double kurtosis;

    private DescriptiveSummary(int count, double mean, double variance, double median,
                               double min, double max, double skewness, double kurtosis) {
        this.count = count;
        this.mean = mean;
        this.variance = variance;
        this.std = Math.sqrt(variance);
        this.median = median;
        this.min = min;
        this.max = max;
        this.skewness = skewness;
        this.kurtosis = kurtosis;
    }

    public static DescriptiveSummary of(double[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("values must be non-empty");
        }
        int n = values.length;
        double mean = StatUtils.mean(values);
        double variance = StatUtils.populationVariance(values, mean);
        double std = Math.sqrt(variance);

        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double median = n % 2 == 0 ? (sorted[n / 2 - 1] + sorted[n / 2]) / 2 : sorted[n / 2];

        double skewness = Double.NaN;
        double kurtosis = Double.NaN;
        if (std > 0) {
            double m3 = 0, m4 = 0;
            for (double v : values) {
                double z = (v - mean) / std;
                m3 += z * z * z;
                m4 += z * z * z * z;
            }
            skewness = m3 / n;
            kurtosis = m4 / n - 3;
        }
        return new DescriptiveSummary(n, mean, variance, median,
            StatUtils.min(values), StatUtils.max(values), skewness, kurtosis);
    }

    public int getCount() { return count; }
    public double getMean() { return mean; }
    /** Population variance (divisor n). */
    public double getVariance() { return variance; }
    public double getStd() { return std; }
    public double getMedian() { return median; }
    public double getMin() { return min; }
    public double getMax() { return max; }

    /** Empty when the series has zero variance. */
    public OptionalDouble getSkewness() { return finite(skewness); }

    /** Excess kurtosis; empty when the series has zero variance. */
    public OptionalDouble getKurtosis() { return finite(kurtosis); }

    public boolean isDegenerate() { return !(std > 0); }

    static OptionalDouble finite(double v) {
        return Double.isFinite(v) ? OptionalDouble.of(v) : OptionalDouble.empty();
    }
}
