package tsforecast.analysis;

/** Raised when an analysis is requested while another one is still running on the same analyzer. */
public class AnalysisInProgressException extends AnalysisException {

    public AnalysisInProgressException() {
        super("An analysis is already running");
    }
}
