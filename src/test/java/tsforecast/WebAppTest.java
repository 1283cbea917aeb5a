package tsforecast;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.javalin.testtools.JavalinTest;
import okhttp3.Response;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WebAppTest {

    @Test
    void health() {
        JavalinTest.test(WebApp.create(), (server, client) -> {
            Response response = client.get("/api/health");
            assertThat(response.code()).isEqualTo(200);
            JsonObject body = JsonParser.parseString(response.body().string()).getAsJsonObject();
            assertThat(body.get("status").getAsString()).isEqualTo("ok");
        });
    }

    @Test
    void sample() {
        JavalinTest.test(WebApp.create(), (server, client) -> {
            Response response = client.get("/api/sample");
            JsonObject body = JsonParser.parseString(response.body().string()).getAsJsonObject();
            assertThat(body.getAsJsonArray("values")).hasSize(48);
        });
    }

    @Test
    void analyzeRanksModels() {
        JavalinTest.test(WebApp.create(), (server, client) -> {
            String request = "{\"values\": [10,12,13,12,15,16,14,17,19,18,20,22], \"trainRatio\": 0.8}";
            Response response = client.post("/api/analyze", request);

            assertThat(response.code()).isEqualTo(200);
            JsonObject body = JsonParser.parseString(response.body().string()).getAsJsonObject();
            assertThat(body.getAsJsonArray("models")).hasSize(4);
            assertThat(body.getAsJsonObject("best_model").get("name").getAsString()).isEqualTo("Linear Regression");
            assertThat(body.getAsJsonArray("models").get(0).getAsJsonObject().getAsJsonArray("predictions")).hasSize(12);
        });
    }

    @Test
    void trainRatioIsClamped() {
        JavalinTest.test(WebApp.create(), (server, client) -> {
            String request = "{\"values\": [10,12,13,12,15,16,14,17,19,18,20,22], \"trainRatio\": 0.99}";
            Response response = client.post("/api/analyze", request);

            assertThat(response.code()).isEqualTo(200);
            JsonObject body = JsonParser.parseString(response.body().string()).getAsJsonObject();
            assertThat(body.getAsJsonObject("configuration").get("train_ratio").getAsDouble()).isEqualTo(0.9);
            assertThat(body.getAsJsonObject("configuration").get("train_size").getAsInt()).isEqualTo(10);
        });
    }

    @Test
    void tooFewValuesIsBadRequest() {
        JavalinTest.test(WebApp.create(), (server, client) -> {
            Response response = client.post("/api/analyze", "{\"values\": [1,2,3,4,5,6,7,8,9]}");

            assertThat(response.code()).isEqualTo(400);
            JsonObject body = JsonParser.parseString(response.body().string()).getAsJsonObject();
            assertThat(body.get("error").getAsString()).contains("Insufficient data");
        });
    }

    @Test
    void invalidSmoothingFactorIsBadRequest() {
        JavalinTest.test(WebApp.create(), (server, client) -> {
            String request = "{\"values\": [10,12,13,12,15,16,14,17,19,18,20,22], \"alpha\": 1.5}";
            Response response = client.post("/api/analyze", request);

            assertThat(response.code()).isEqualTo(400);
            assertThat(response.body().string()).contains("alpha");
        });
    }

    @Test
    void missingValuesIsBadRequest() {
        JavalinTest.test(WebApp.create(), (server, client) -> {
            assertThat(client.post("/api/analyze", "{}").code()).isEqualTo(400);
            assertThat(client.post("/api/analyze", "not json").code()).isEqualTo(400);
        });
    }
}
