package tsforecast.ml;

/**
 * Fixed-size ring of seasonal indices, one slot per position within the season.
 * Any time position t maps to slot {@code t mod season}.
 */
final class SeasonalIndices {

    private final double[] slots;

    SeasonalIndices(int season) {
        if (season < 1) throw new IllegalArgumentException("season must be >= 1, got " + season);
        this.slots = new double[season];
    }

    double get(int t) {
        return slots[Math.floorMod(t, slots.length)];
    }

    void set(int t, double value) {
        slots[Math.floorMod(t, slots.length)] = value;
    }
}
