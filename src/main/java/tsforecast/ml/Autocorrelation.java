package tsforecast.ml;

import java.util.OptionalDouble;

/** One point of an autocorrelogram. */
public final class Autocorrelation {

    private final int lag;
    private final double value;

    public Autocorrelation(int lag, double value) {
        this.lag = lag;
        this.value = value;
    }

    public int getLag() { return lag; }

    /** Empty when the coefficient is undefined (constant series). */
    public OptionalDouble getValue() { return DescriptiveSummary.finite(value); }

    /** Raw coefficient, NaN when undefined. */
    double coefficient() { return value; }

    @Override
    public String toString() {
        return "acf(" + lag + ")=" + value;
    }
}
