package tsforecast.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tsforecast.ml.DescriptiveSummary;
import tsforecast.ml.ForecastMetrics;
import tsforecast.ml.Forecaster;
import tsforecast.ml.HoltLinearTrend;
import tsforecast.ml.HoltWinters;
import tsforecast.ml.LinearTrend;
import tsforecast.ml.MetricSet;
import tsforecast.ml.MovingAverage;
import tsforecast.ml.SeasonalityDetector;
import tsforecast.ml.SeasonalityResult;
import tsforecast.ml.SimpleExponentialSmoothing;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the full comparison on a series: statistics, seasonality detection, fit and score of
 * every model on a chronological train/test split, ranking by test RMSE and residuals of the winner.
 * <p>
 * The analyzer moves IDLE → RUNNING → COMPLETED. Only one run may be in progress at a time;
 * a request arriving while RUNNING is rejected with {@link AnalysisInProgressException}.
 * A COMPLETED analyzer may run again, and the new result replaces the previous one.
 */
public class ForecastAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ForecastAnalyzer.class);

    public static final int MIN_OBSERVATIONS = 10;

    private static final Comparator<ModelResult> BY_RMSE =
        Comparator.comparingDouble(m -> m.getMetrics().rankingScore());

    public enum State { IDLE, RUNNING, COMPLETED }

    private final AnalysisConfig config;
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private volatile AnalysisResult lastResult;

    public ForecastAnalyzer(AnalysisConfig config) {
        if (config == null) throw new IllegalArgumentException("config required");
        this.config = config;
    }

    public ForecastAnalyzer() {
        this(AnalysisConfig.defaults());
    }

    public AnalysisConfig getConfig() { return config; }

    public State getState() { return state.get(); }

    public Optional<AnalysisResult> getLastResult() { return Optional.ofNullable(lastResult); }

    /**
     * @throws InsufficientDataException   fewer than {@link #MIN_OBSERVATIONS} observations; state unchanged
     * @throws AnalysisInProgressException another run is in progress
     * @throws ModelFailedException        a model that should have run threw; state restored
     */
    public AnalysisResult analyze(Series series) {
        if (series == null) throw new IllegalArgumentException("series required");
        if (series.size() < MIN_OBSERVATIONS) {
            log.warn("Insufficient data: {} observations (minimum {})", series.size(), MIN_OBSERVATIONS);
            throw new InsufficientDataException(series.size(), MIN_OBSERVATIONS);
        }
        State previous = state.get();
        if (previous == State.RUNNING || !state.compareAndSet(previous, State.RUNNING)) {
            throw new AnalysisInProgressException();
        }

        boolean completed = false;
        try {
            AnalysisResult result = run(series);
            lastResult = result;
            state.set(State.COMPLETED);
            completed = true;
            return result;
        } finally {
            if (!completed) state.set(previous);
        }
    }

    /** Same as {@link #analyze(Series)}, executed on the given executor. */
    public CompletableFuture<AnalysisResult> analyzeAsync(Series series, Executor executor) {
        return CompletableFuture.supplyAsync(() -> analyze(series), executor);
    }

    private AnalysisResult run(Series series) {
        RunLog runLog = new RunLog(log);
        double[] values = series.values();
        Split split = Split.of(values.length, config.getTrainRatio());
        double[] train = split.train(values);
        runLog.info("Analysis started: {} observations, {}", values.length, config);

        DescriptiveSummary stats = DescriptiveSummary.of(values);
        runLog.info("Mean={} median={} std={} variance={} min={} max={} skewness={} kurtosis={}",
            fmt(stats.getMean()), fmt(stats.getMedian()), fmt(stats.getStd()), fmt(stats.getVariance()),
            fmt(stats.getMin()), fmt(stats.getMax()), fmt(stats.getSkewness()), fmt(stats.getKurtosis()));

        SeasonalityResult seasonality = SeasonalityDetector.detect(values, config.getMaxLag());
        if (seasonality.isDetected()) {
            runLog.info("Seasonality detected: period={}", seasonality.getPeriod().getAsInt());
        } else {
            runLog.info("No significant seasonality detected");
        }
        runLog.info("Split: train={} test={}", split.getTrainSize(), split.getTestSize());

        List<SkippedModel> skipped = new ArrayList<>();
        List<Forecaster> forecasters = forecasters(seasonality, split, skipped);

        List<ModelResult> models = new ArrayList<>(forecasters.size());
        for (Forecaster forecaster : forecasters) {
            models.add(evaluate(forecaster, train, values, split, runLog));
        }
        for (SkippedModel s : skipped) {
            runLog.warn("Skipped {}: {}", s.getName(), s.getReason());
        }

        models.sort(BY_RMSE);
        ModelResult best = models.get(0);
        runLog.info("Best model: {} rmse={} mae={} mape={}%", best.getName(),
            fmt(best.getMetrics().getRmse()), fmt(best.getMetrics().getMae()), fmt(best.getMetrics().getMape()));
        for (int i = 0; i < models.size(); i++) {
            log.debug("  {}. {} rmse={}", i + 1, models.get(i).getName(), fmt(models.get(i).getMetrics().getRmse()));
        }

        return new AnalysisResult(Instant.now(), config, series, split, stats, seasonality,
            models, skipped, residuals(values, best), runLog.entries());
    }

    /** Baseline models always run; the Holt-Winters pair needs a period shorter than half the training window. */
    private List<Forecaster> forecasters(SeasonalityResult seasonality, Split split, List<SkippedModel> skipped) {
        List<Forecaster> out = new ArrayList<>(baselineForecasters());

        OptionalInt period = seasonality.getPeriod();
        for (HoltWinters.Seasonality kind : HoltWinters.Seasonality.values()) {
            if (period.isEmpty()) {
                skipped.add(new SkippedModel(kind.getModelName(), "no seasonal period detected"));
            } else if (period.getAsInt() >= split.getTrainSize() / 2.0) {
                skipped.add(new SkippedModel(kind.getModelName(),
                    "period " + period.getAsInt() + " is not shorter than half the training window ("
                        + split.getTrainSize() + ")"));
            } else {
                out.add(new HoltWinters(kind, config.getAlpha(), config.getBeta(), config.getGamma(), period.getAsInt()));
            }
        }
        return out;
    }

    /** Models run on every series, in ranking tie-break order. */
    List<Forecaster> baselineForecasters() {
        return List.of(
            new MovingAverage(config.getMovingAverageWindow()),
            new LinearTrend(),
            new SimpleExponentialSmoothing(config.getAlpha()),
            new HoltLinearTrend(config.getAlpha(), config.getBeta()));
    }

    private ModelResult evaluate(Forecaster forecaster, double[] train, double[] values, Split split, RunLog runLog) {
        double[] predictions;
        try {
            predictions = forecaster.fitAndPredict(train, values);
        } catch (RuntimeException e) {
            throw new ModelFailedException(forecaster.getName(), e);
        }
        MetricSet metrics = ForecastMetrics.evaluate(split.test(values), split.test(predictions));
        runLog.info("{} - rmse={} aic={}", forecaster.getName(), fmt(metrics.getRmse()), fmt(metrics.getAic()));
        return new ModelResult(forecaster.getName(), forecaster.getFamily(), predictions, metrics);
    }

    static double[] residuals(double[] actual, ModelResult model) {
        double[] out = new double[actual.length];
        int n = 0;
        for (int i = 0; i < actual.length; i++) {
            OptionalDouble predicted = model.getPrediction(i);
            if (predicted.isPresent()) {
                out[n++] = actual[i] - predicted.getAsDouble();
            }
        }
        return Arrays.copyOf(out, n);
    }

    private static String fmt(double v) {
        return String.format("%.4f", v);
    }

    private static String fmt(OptionalDouble v) {
        return v.isPresent() ? fmt(v.getAsDouble()) : "undefined";
    }
}
