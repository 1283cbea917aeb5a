package tsforecast.analysis;

/** A model left out of a run because its precondition did not hold. */
public final class SkippedModel {

    private final String name;
    private final String reason;

    public SkippedModel(String name, String reason) {
        this.name = name;
        this.reason = reason;
    }

    public String getName() { return name; }
    public String getReason() { return reason; }

    @Override
    public String toString() {
        return name + " (" + reason + ")";
    }
}
