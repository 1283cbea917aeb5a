package tsforecast.ml;

import java.util.OptionalDouble;

/**
 * Error metrics of one model over the held-out window.
 * A metric that is not a finite real (no valid pairs, or ln(0) for a perfect fit) is empty.
 */
public final class MetricSet {

    private final int validCount;
    private final double mse;
    private final double rmse;
    private final double mae;
    private final double mape;
    private final double aic;
    private final double bic;

    MetricSet(int validCount, double mse, double rmse, double mae, double mape, double aic, double bic) {
        this.validCount = validCount;
        this.mse = mse;
        this.rmse = rmse;
        this.mae = mae;
        this.mape = mape;
        this.aic = aic;
        this.bic = bic;
    }

    /** Number of (actual, predicted) pairs that entered the sums. */
    public int getValidCount() { return validCount; }

    public OptionalDouble getMse() { return DescriptiveSummary.finite(mse); }
    public OptionalDouble getRmse() { return DescriptiveSummary.finite(rmse); }
    public OptionalDouble getMae() { return DescriptiveSummary.finite(mae); }
    /** Mean absolute percentage error, in percent. */
    public OptionalDouble getMape() { return DescriptiveSummary.finite(mape); }
    public OptionalDouble getAic() { return DescriptiveSummary.finite(aic); }
    public OptionalDouble getBic() { return DescriptiveSummary.finite(bic); }

    /** RMSE for ranking; models without a finite RMSE sort after every other model. */
    public double rankingScore() {
        return Double.isFinite(rmse) ? rmse : Double.POSITIVE_INFINITY;
    }

    @Override
    public String toString() {
        return String.format("MetricSet{n=%d, mse=%s, rmse=%s, mae=%s, mape=%s, aic=%s, bic=%s}",
            validCount, mse, rmse, mae, mape, aic, bic);
    }
}
