package tsforecast.ml;

/** Numeric guards shared by the smoothing models. */
public final class SafeMath {

    private SafeMath() {
    }

    /** {@code numerator / denominator}, dividing by 1 instead when the denominator is exactly zero. */
    public static double safeDivide(double numerator, double denominator) {
        return safeDivide(numerator, denominator, 1.0);
    }

    /** {@code numerator / denominator}, dividing by {@code substitute} when the denominator is exactly zero. */
    public static double safeDivide(double numerator, double denominator, double substitute) {
        return numerator / (denominator == 0 ? substitute : denominator);
    }
}
