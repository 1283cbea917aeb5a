package tsforecast.analysis;

/** One observation of a series: its position, an opaque timestamp label and a finite value. */
public final class Observation {

    private final int index;
    private final String timestamp;
    private final double value;

    public Observation(int index, String timestamp, double value) {
        if (index < 0) throw new IllegalArgumentException("index must be >= 0, got " + index);
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value at index " + index + " is not finite: " + value);
        }
        this.index = index;
        this.timestamp = timestamp;
        this.value = value;
    }

    public int getIndex() { return index; }
    public String getTimestamp() { return timestamp; }
    public double getValue() { return value; }

    @Override
    public String toString() {
        return index + ":" + timestamp + "=" + value;
    }
}
