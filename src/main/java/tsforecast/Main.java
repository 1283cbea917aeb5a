package tsforecast;

import tsforecast.analysis.AnalysisConfig;
import tsforecast.analysis.AnalysisResult;
import tsforecast.analysis.ForecastAnalyzer;
import tsforecast.analysis.ModelResult;
import tsforecast.analysis.Series;
import tsforecast.analysis.SkippedModel;
import tsforecast.io.AnalysisReport;
import tsforecast.io.SeriesCsvReader;
import tsforecast.ml.DescriptiveSummary;
import tsforecast.ml.MetricSet;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Demo: compare moving average, linear trend, exponential smoothing, Holt and Holt-Winters
 * on a series and print the ranking.
 * <p>
 * Usage: {@code Main [file.csv] [trainRatio] [--export report.json]}. Without a file the
 * built-in monthly sample is analysed.
 */
public class Main {

    public static void main(String[] args) {
        List<String> positional = new ArrayList<>();
        Path export = null;
        for (int i = 0; i < args.length; i++) {
            if ("--export".equals(args[i]) && i + 1 < args.length) {
                export = Paths.get(args[++i]);
            } else if (args[i] != null && !args[i].trim().isEmpty()) {
                positional.add(args[i].trim());
            }
        }

        try {
            Series series = positional.isEmpty()
                ? Series.of(sampleMonthlySeries())
                : SeriesCsvReader.read(Paths.get(positional.get(0)));
            double ratio = positional.size() > 1
                ? AnalysisConfig.clampTrainRatio(Double.parseDouble(positional.get(1)))
                : AnalysisConfig.DEFAULT_TRAIN_RATIO;

            ForecastAnalyzer analyzer = new ForecastAnalyzer(AnalysisConfig.builder().trainRatio(ratio).build());
            AnalysisResult result = analyzer.analyze(series);
            print(result);

            if (export != null) {
                AnalysisReport.write(result, export);
                System.out.println("Report written to " + export.toAbsolutePath());
            }
        } catch (Exception e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            System.err.println("Analysis error: " + msg);
            System.exit(1);
        }
    }

    private static void print(AnalysisResult result) {
        DescriptiveSummary s = result.getStatistics();
        System.out.println("=== Exploratory statistics ===");
        System.out.printf("Observations = %d (train %d / test %d)%n",
            result.getSeries().size(), result.getTrainSize(), result.getTestSize());
        System.out.printf("Mean = %.2f | Median = %.2f%n", s.getMean(), s.getMedian());
        System.out.printf("Std = %.2f | Variance = %.2f%n", s.getStd(), s.getVariance());
        System.out.printf("Min = %.2f | Max = %.2f%n", s.getMin(), s.getMax());
        System.out.printf("Skewness = %s | Kurtosis = %s%n", format(s.getSkewness()), format(s.getKurtosis()));
        if (result.getSeasonality().isDetected()) {
            System.out.println("Seasonality detected: period = " + result.getSeasonality().getPeriod().getAsInt());
        } else {
            System.out.println("No significant seasonality detected");
        }
        System.out.println();

        System.out.println("=== Model ranking (test RMSE) ===");
        int rank = 1;
        for (ModelResult m : result.getModels()) {
            MetricSet metrics = m.getMetrics();
            System.out.printf("%d. %-30s RMSE %s | MAE %s | MAPE %s%% | AIC %s%n", rank++, m.getName(),
                format(metrics.getRmse()), format(metrics.getMae()), format(metrics.getMape()), format(metrics.getAic()));
        }
        for (SkippedModel skipped : result.getSkippedModels()) {
            System.out.println("   skipped: " + skipped);
        }
        System.out.println();
        System.out.println("Best model: " + result.getBestModel().getName());
        System.out.println("Residuals (first 5): " + format(result.getResiduals(), 5));
    }

    private static String format(OptionalDouble v) {
        return v.isPresent() ? String.format("%.4f", v.getAsDouble()) : "n/a";
    }

    private static String format(double[] a, int max) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < Math.min(a.length, max); i++) {
            if (i > 0) sb.append(", ");
            sb.append(String.format("%.2f", a[i]));
        }
        if (a.length > max) sb.append("...");
        sb.append("]");
        return sb.toString();
    }

    /** Synthetic monthly series with a yearly cycle. */
    static double[] sampleMonthlySeries() {
        return new double[] {
            45, 52, 61, 78, 88, 95, 102, 98, 85, 72, 58, 48,
            50, 55, 65, 82, 92, 100, 108, 104, 88, 75, 62, 51,
            48, 54, 68, 85, 94, 103, 112, 106, 90, 78, 64, 52,
            52, 58, 70, 86, 96, 105, 115, 108, 92, 80, 66, 55
        };
    }
}
