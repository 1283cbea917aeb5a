package tsforecast;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tsforecast.analysis.AnalysisConfig;
import tsforecast.analysis.AnalysisResult;
import tsforecast.analysis.ForecastAnalyzer;
import tsforecast.analysis.InsufficientDataException;
import tsforecast.analysis.ModelFailedException;
import tsforecast.analysis.Series;
import tsforecast.io.AnalysisReport;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON API over the forecast comparison.
 * Run with: mvn exec:java -Dexec.mainClass="tsforecast.WebApp"
 * <ul>
 *   <li>POST /api/analyze: {@code {values: [...], timestamps?, trainRatio?, alpha?, beta?, gamma?, maxLag?, window?}}</li>
 *   <li>GET /api/sample: built-in sample series</li>
 *   <li>GET /api/health</li>
 * </ul>
 */
public class WebApp {

    private static final Logger log = LoggerFactory.getLogger(WebApp.class);

    private static final Gson GSON = new GsonBuilder().serializeNulls().create();

    /** Body of POST /api/analyze. Unset fields fall back to {@link AnalysisConfig} defaults. */
    static class AnalyzeRequest {
        List<Double> values;
        List<String> timestamps;
        Double trainRatio;
        Double alpha;
        Double beta;
        Double gamma;
        Integer maxLag;
        Integer window;
    }

    private static int getPort() {
        String env = System.getenv("PORT");
        if (env != null && !env.isBlank()) {
            try {
                return Integer.parseInt(env.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring invalid PORT value '{}'", env);
            }
        }
        return 7000;
    }

    public static void main(String[] args) {
        int port = getPort();
        create().start("0.0.0.0", port);
        log.info("Forecast web app: http://localhost:{}", port);
    }

    /** Application with every route registered, not yet started. */
    public static Javalin create() {
        Javalin app = Javalin.create();

        app.post("/api/analyze", WebApp::analyze);

        app.get("/api/sample", ctx -> {
            Map<String, Object> out = new HashMap<>();
            out.put("values", Main.sampleMonthlySeries());
            sendJson(ctx, 200, out);
        });

        app.get("/api/health", ctx -> {
            Map<String, Object> h = new HashMap<>();
            h.put("status", "ok");
            h.put("port", ctx.port());
            sendJson(ctx, 200, h);
        });
        return app;
    }

    private static void analyze(Context ctx) {
        Map<String, Object> out = new HashMap<>();
        try {
            String body = ctx.body();
            if (body == null || body.isBlank()) {
                out.put("error", "Missing request body");
                sendJson(ctx, 400, out);
                return;
            }
            AnalyzeRequest req = GSON.fromJson(body, AnalyzeRequest.class);
            if (req == null || req.values == null) {
                out.put("error", "Missing or invalid 'values' array");
                sendJson(ctx, 400, out);
                return;
            }
            double[] values = new double[req.values.size()];
            for (int i = 0; i < values.length; i++) {
                Double v = req.values.get(i);
                if (v == null || !Double.isFinite(v)) {
                    out.put("error", "All values must be finite numbers (index " + i + ")");
                    sendJson(ctx, 400, out);
                    return;
                }
                values[i] = v;
            }
            Series series = req.timestamps != null ? Series.of(req.timestamps, values) : Series.of(values);

            AnalysisConfig.Builder config = AnalysisConfig.builder();
            if (req.trainRatio != null) config.trainRatio(AnalysisConfig.clampTrainRatio(req.trainRatio));
            if (req.alpha != null) config.alpha(req.alpha);
            if (req.beta != null) config.beta(req.beta);
            if (req.gamma != null) config.gamma(req.gamma);
            if (req.maxLag != null) config.maxLag(req.maxLag);
            if (req.window != null) config.movingAverageWindow(req.window);

            AnalysisResult result = new ForecastAnalyzer(config.build()).analyze(series);
            sendJson(ctx, 200, AnalysisReport.toMap(result, true));
        } catch (JsonParseException | IllegalArgumentException | InsufficientDataException e) {
            out.put("error", message(e));
            sendJson(ctx, 400, out);
        } catch (ModelFailedException e) {
            log.error("Analysis failed", e);
            out.put("error", message(e));
            sendJson(ctx, 500, out);
        }
    }

    private static String message(Exception e) {
        String msg = e.getMessage();
        return msg != null && !msg.isEmpty() ? msg : e.getClass().getSimpleName();
    }

    private static void sendJson(Context ctx, int status, Object body) {
        ctx.status(status).contentType("application/json").result(GSON.toJson(body));
    }
}
