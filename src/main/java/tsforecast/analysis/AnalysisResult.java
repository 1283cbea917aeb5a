package tsforecast.analysis;

import tsforecast.ml.DescriptiveSummary;
import tsforecast.ml.SeasonalityResult;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one analysis run. Built once by {@link ForecastAnalyzer} and never modified;
 * the next run produces a new instance.
 */
public final class AnalysisResult {

    private final Instant createdAt;
    private final AnalysisConfig config;
    private final Series series;
    private final Split split;
    private final DescriptiveSummary statistics;
    private final SeasonalityResult seasonality;
    private final List<ModelResult> models;
    private final List<SkippedModel> skippedModels;
    private final double[] residuals;
    private final List<RunLog.Entry> log;

    AnalysisResult(Instant createdAt, AnalysisConfig config, Series series, Split split,
                   DescriptiveSummary statistics, SeasonalityResult seasonality,
                   List<ModelResult> models, List<SkippedModel> skippedModels, double[] residuals,
                   List<RunLog.Entry> log) {
        if (models.isEmpty()) throw new IllegalArgumentException("at least one ranked model required");
        this.createdAt = createdAt;
        this.config = config;
        this.series = series;
        this.split = split;
        this.statistics = statistics;
        this.seasonality = seasonality;
        this.models = Collections.unmodifiableList(models);
        this.skippedModels = Collections.unmodifiableList(skippedModels);
        this.residuals = residuals.clone();
        this.log = Collections.unmodifiableList(log);
    }

    public Instant getCreatedAt() { return createdAt; }
    public AnalysisConfig getConfig() { return config; }
    public Series getSeries() { return series; }
    public int getTrainSize() { return split.getTrainSize(); }
    public int getTestSize() { return split.getTestSize(); }

    /** Computed over the entire series. */
    public DescriptiveSummary getStatistics() { return statistics; }

    public SeasonalityResult getSeasonality() { return seasonality; }

    /** Ranked ascending by test RMSE; ties keep the order in which the models were run. */
    public List<ModelResult> getModels() { return models; }

    public List<SkippedModel> getSkippedModels() { return skippedModels; }

    public ModelResult getBestModel() { return models.get(0); }

    /**
     * actual − predicted of the best model, over the whole series, in order, at the positions
     * where it has a prediction.
     */
    public double[] getResiduals() { return residuals.clone(); }

    /** Progress lines recorded while the run executed, oldest first. */
    public List<RunLog.Entry> getLog() { return log; }
}
