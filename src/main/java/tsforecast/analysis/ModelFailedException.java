package tsforecast.analysis;

/**
 * A forecaster that was expected to run threw. Distinct from a skipped model, which is
 * reported in {@link AnalysisResult#getSkippedModels()} and does not abort the run.
 */
public class ModelFailedException extends AnalysisException {

    private final String modelName;

    public ModelFailedException(String modelName, Throwable cause) {
        super("Model '" + modelName + "' failed: " + cause.getMessage(), cause);
        this.modelName = modelName;
    }

    public String getModelName() { return modelName; }
}
