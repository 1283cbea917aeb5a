package tsforecast.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable ordered sequence of observations. Never empty; every value is finite.
 * Observation indices always equal their position in the series.
 */
public final class Series {

    private final List<Observation> observations;
    private final double[] values;

    private Series(List<Observation> observations) {
        if (observations.isEmpty()) throw new IllegalArgumentException("A series needs at least one observation");
        this.observations = Collections.unmodifiableList(observations);
        this.values = new double[observations.size()];
        for (int i = 0; i < values.length; i++) values[i] = observations.get(i).getValue();
    }

    /** Series whose timestamps are the positional index. */
    public static Series of(double... values) {
        if (values == null) throw new IllegalArgumentException("values required");
        List<Observation> out = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            out.add(new Observation(i, String.valueOf(i), values[i]));
        }
        return new Series(out);
    }

    public static Series of(List<String> timestamps, double[] values) {
        if (timestamps == null || values == null || timestamps.size() != values.length) {
            throw new IllegalArgumentException("timestamps and values must be non-null and of the same length");
        }
        List<Observation> out = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            out.add(new Observation(i, timestamps.get(i), values[i]));
        }
        return new Series(out);
    }

    public int size() { return observations.size(); }

    public Observation get(int index) { return observations.get(index); }

    public List<Observation> getObservations() { return observations; }

    /** Copy of the values, in order. */
    public double[] values() { return values.clone(); }
}
