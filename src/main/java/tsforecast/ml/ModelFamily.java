package tsforecast.ml;

/** Broad family a forecasting model belongs to, as shown in reports. */
public enum ModelFamily {
    CLASSICAL("classical"),
    SMOOTHING("smoothing");

    private final String label;

    ModelFamily(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }
}
