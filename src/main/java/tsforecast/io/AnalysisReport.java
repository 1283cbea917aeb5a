package tsforecast.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import tsforecast.analysis.AnalysisConfig;
import tsforecast.analysis.AnalysisResult;
import tsforecast.analysis.ModelResult;
import tsforecast.analysis.Observation;
import tsforecast.analysis.RunLog;
import tsforecast.analysis.SkippedModel;
import tsforecast.ml.Autocorrelation;
import tsforecast.ml.DescriptiveSummary;
import tsforecast.ml.MetricSet;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * JSON export of an {@link AnalysisResult}. Undefined numbers are written as {@code null}.
 */
public final class AnalysisReport {

    private static final Gson GSON = new GsonBuilder()
        .serializeNulls()
        .setPrettyPrinting()
        .create();

    private AnalysisReport() {
    }

    public static String toJson(AnalysisResult result) {
        return GSON.toJson(toMap(result, false));
    }

    public static void write(AnalysisResult result, Path path) throws IOException {
        Files.writeString(path, toJson(result), StandardCharsets.UTF_8);
    }

    /**
     * Report as nested maps and lists, ready for any JSON writer.
     *
     * @param withPredictions also include every model's prediction series and the actual values
     */
    public static Map<String, Object> toMap(AnalysisResult result, boolean withPredictions) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("session", result.getCreatedAt().toString());
        out.put("configuration", configuration(result));
        out.put("statistics", statistics(result.getStatistics()));

        Map<String, Object> seasonality = new LinkedHashMap<>();
        seasonality.put("detected", result.getSeasonality().isDetected());
        seasonality.put("period", result.getSeasonality().isDetected() ? result.getSeasonality().getPeriod().getAsInt() : null);
        List<Map<String, Object>> acf = new ArrayList<>();
        for (Autocorrelation a : result.getSeasonality().getAutocorrelogram()) {
            Map<String, Object> point = new LinkedHashMap<>();
            point.put("lag", a.getLag());
            point.put("value", orNull(a.getValue()));
            acf.add(point);
        }
        seasonality.put("autocorrelation", acf);
        out.put("seasonality", seasonality);

        List<Map<String, Object>> models = new ArrayList<>();
        for (ModelResult m : result.getModels()) {
            Map<String, Object> model = new LinkedHashMap<>();
            model.put("name", m.getName());
            model.put("type", m.getFamily().getLabel());
            model.put("metrics", metrics(m.getMetrics()));
            if (withPredictions) model.put("predictions", m.getPredictions());
            models.add(model);
        }
        out.put("models", models);

        List<Map<String, Object>> skipped = new ArrayList<>();
        for (SkippedModel s : result.getSkippedModels()) {
            Map<String, Object> model = new LinkedHashMap<>();
            model.put("name", s.getName());
            model.put("reason", s.getReason());
            skipped.add(model);
        }
        out.put("skipped_models", skipped);

        ModelResult best = result.getBestModel();
        Map<String, Object> bestModel = new LinkedHashMap<>();
        bestModel.put("name", best.getName());
        bestModel.put("metrics", metrics(best.getMetrics()));
        bestModel.put("predictions", best.getPredictions());
        bestModel.put("residuals", toList(result.getResiduals()));
        out.put("best_model", bestModel);

        List<Map<String, Object>> log = new ArrayList<>();
        for (RunLog.Entry e : result.getLog()) {
            Map<String, Object> line = new LinkedHashMap<>();
            line.put("time", e.getTime().toString());
            line.put("level", e.getLevel().name().toLowerCase(Locale.ROOT));
            line.put("message", e.getMessage());
            log.add(line);
        }
        out.put("log", log);

        if (withPredictions) {
            out.put("timestamps", result.getSeries().getObservations().stream()
                .map(Observation::getTimestamp).collect(Collectors.toList()));
            out.put("actual", toList(result.getSeries().values()));
        }
        return out;
    }

    private static Map<String, Object> configuration(AnalysisResult result) {
        AnalysisConfig config = result.getConfig();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("data_points", result.getSeries().size());
        out.put("train_size", result.getTrainSize());
        out.put("test_size", result.getTestSize());
        out.put("train_ratio", config.getTrainRatio());
        out.put("alpha", config.getAlpha());
        out.put("beta", config.getBeta());
        out.put("gamma", config.getGamma());
        out.put("max_lag", config.getMaxLag());
        out.put("moving_average_window", config.getMovingAverageWindow());
        return out;
    }

    private static Map<String, Object> statistics(DescriptiveSummary s) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("mean", s.getMean());
        out.put("variance", s.getVariance());
        out.put("std", s.getStd());
        out.put("median", s.getMedian());
        out.put("min", s.getMin());
        out.put("max", s.getMax());
        out.put("skewness", orNull(s.getSkewness()));
        out.put("kurtosis", orNull(s.getKurtosis()));
        return out;
    }

    private static Map<String, Object> metrics(MetricSet m) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("mse", orNull(m.getMse()));
        out.put("rmse", orNull(m.getRmse()));
        out.put("mae", orNull(m.getMae()));
        out.put("mape", orNull(m.getMape()));
        out.put("aic", orNull(m.getAic()));
        out.put("bic", orNull(m.getBic()));
        out.put("n", m.getValidCount());
        return out;
    }

    private static Double orNull(OptionalDouble v) {
        return v.isPresent() ? v.getAsDouble() : null;
    }

    private static List<Double> toList(double[] a) {
        List<Double> list = new ArrayList<>(a.length);
        for (double v : a) list.add(v);
        return list;
    }
}
