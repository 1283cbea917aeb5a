package tsforecast.analysis;

/** An {@link AnalysisConfig} value outside its allowed range. */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
