package tsforecast.analysis;

/** The series is too short to be analysed. No result is produced. */
public class InsufficientDataException extends AnalysisException {

    private final int observations;
    private final int required;

    public InsufficientDataException(int observations, int required) {
        super("Insufficient data: " + observations + " observations, at least " + required + " required");
        this.observations = observations;
        this.required = required;
    }

    public int getObservations() { return observations; }
    public int getRequired() { return required; }
}
