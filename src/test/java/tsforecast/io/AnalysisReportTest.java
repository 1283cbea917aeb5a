package tsforecast.io;

import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tsforecast.analysis.AnalysisResult;
import tsforecast.analysis.ForecastAnalyzer;
import tsforecast.analysis.Series;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisReportTest {

    private static final double[] TRENDING = {10, 12, 13, 12, 15, 16, 14, 17, 19, 18, 20, 22};

    private final AnalysisResult result = new ForecastAnalyzer().analyze(Series.of(TRENDING));

    @Test
    void reportLayout() {
        JsonObject json = JsonParser.parseString(AnalysisReport.toJson(result)).getAsJsonObject();

        JsonObject configuration = json.getAsJsonObject("configuration");
        assertThat(configuration.get("data_points").getAsInt()).isEqualTo(12);
        assertThat(configuration.get("train_size").getAsInt()).isEqualTo(9);
        assertThat(configuration.get("train_ratio").getAsDouble()).isEqualTo(0.8);

        JsonObject seasonality = json.getAsJsonObject("seasonality");
        assertThat(seasonality.get("detected").getAsBoolean()).isFalse();
        assertThat(seasonality.get("period").isJsonNull()).isTrue();
        assertThat(seasonality.getAsJsonArray("autocorrelation")).hasSize(6);

        JsonArray models = json.getAsJsonArray("models");
        assertThat(models).hasSize(4);
        assertThat(models.get(0).getAsJsonObject().get("name").getAsString()).isEqualTo("Linear Regression");
        assertThat(models.get(0).getAsJsonObject().get("type").getAsString()).isEqualTo("classical");
        assertThat(models.get(0).getAsJsonObject().has("predictions")).isFalse();

        assertThat(json.getAsJsonArray("skipped_models")).hasSize(2);
        assertThat(json.getAsJsonObject("best_model").get("name").getAsString()).isEqualTo("Linear Regression");
        assertThat(json.getAsJsonObject("best_model").getAsJsonArray("residuals")).hasSize(12);

        JsonArray log = json.getAsJsonArray("log");
        assertThat(log.size()).isEqualTo(result.getLog().size()).isPositive();
        JsonObject first = log.get(0).getAsJsonObject();
        assertThat(first.get("level").getAsString()).isEqualTo("info");
        assertThat(first.get("message").getAsString()).startsWith("Analysis started");
        assertThat(first.get("time").getAsString()).isNotEmpty();
    }

    @Test
    void undefinedPredictionsBecomeNull() {
        Map<String, Object> map = AnalysisReport.toMap(result, true);
        JsonObject json = JsonParser.parseString(new GsonBuilder().serializeNulls().create().toJson(map))
            .getAsJsonObject();

        JsonObject movingAverage = null;
        for (JsonElement element : json.getAsJsonArray("models")) {
            if (element.getAsJsonObject().get("name").getAsString().equals("Moving Average")) {
                movingAverage = element.getAsJsonObject();
            }
        }
        assertThat(movingAverage).isNotNull();
        JsonArray predictions = movingAverage.getAsJsonArray("predictions");
        assertThat(predictions).hasSize(12);
        assertThat(predictions.get(0).isJsonNull()).isTrue();
        assertThat(predictions.get(1).isJsonNull()).isTrue();
        assertThat(predictions.get(2).getAsDouble()).isEqualTo((10 + 12 + 13) / 3.0);
        assertThat(json.getAsJsonArray("actual")).hasSize(12);
    }

    @Test
    void constantSeriesReportsNullShapeStatistics() {
        double[] flat = new double[12];
        Arrays.fill(flat, 5);
        AnalysisResult flatResult = new ForecastAnalyzer().analyze(Series.of(flat));

        JsonObject json = JsonParser.parseString(AnalysisReport.toJson(flatResult)).getAsJsonObject();
        assertThat(json.getAsJsonObject("statistics").get("skewness").isJsonNull()).isTrue();
        assertThat(json.getAsJsonObject("statistics").get("kurtosis").isJsonNull()).isTrue();
        assertThat(json.getAsJsonObject("statistics").get("mean").getAsDouble()).isEqualTo(5);
        for (JsonElement point : json.getAsJsonObject("seasonality").getAsJsonArray("autocorrelation")) {
            assertThat(point.getAsJsonObject().get("value").isJsonNull()).isTrue();
        }
        // perfect fit on a flat line: aic undefined
        assertThat(json.getAsJsonObject("best_model").getAsJsonObject("metrics").get("aic").isJsonNull()).isTrue();
    }

    @Test
    void writesFile(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("report.json");
        AnalysisReport.write(result, out);

        String content = Files.readString(out, StandardCharsets.UTF_8);
        assertThat(JsonParser.parseString(content).getAsJsonObject().has("session")).isTrue();
    }
}
