package tsforecast.ml;

import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/** Detected seasonal period (if any) together with the autocorrelogram it was picked from. */
public final class SeasonalityResult {

    private final Integer period;
    private final List<Autocorrelation> autocorrelogram;

    SeasonalityResult(Integer period, List<Autocorrelation> autocorrelogram) {
        this.period = period;
        this.autocorrelogram = Collections.unmodifiableList(autocorrelogram);
    }

    public OptionalInt getPeriod() {
        return period == null ? OptionalInt.empty() : OptionalInt.of(period);
    }

    public boolean isDetected() { return period != null; }

    /** Ordered by lag, starting at lag 1. */
    public List<Autocorrelation> getAutocorrelogram() { return autocorrelogram; }
}
