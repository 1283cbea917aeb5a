package tsforecast.ml;

import org.apache.commons.math3.linear.*;

/**
 * Ordinary Least Squares (OLS) regression of a value against its integer position.
 * <p>
 * Model: yᵢ = β₀ + β₁·i
 * <p>
 * Closed-form solution (normal equation): β = (X'X)⁻¹X'y
 * where X is the design matrix [1, i] built from positions 0..n-1 and y is the response vector.
 */
public class LinearRegression {

    private final double intercept;  // β₀
    private final double slope;      // β₁

    /**
     * Fit the trend line over positions 0..y.length-1.
     *
     * @param y response vector, one value per position
     */
    public LinearRegression(double[] y) {
        if (y == null || y.length < 2) {
            throw new IllegalArgumentException("At least two observations are required to fit a trend line");
        }
        int n = y.length;

        double[][] design = new double[n][2];
        for (int i = 0; i < n; i++) {
            design[i][0] = 1.0;
            design[i][1] = i;
        }

        RealMatrix Xm = MatrixUtils.createRealMatrix(design);
        RealVector yv = MatrixUtils.createRealVector(y);

        // β = (X'X)⁻¹ X' y
        RealMatrix Xt = Xm.transpose();
        RealMatrix XtX = Xt.multiply(Xm);
        DecompositionSolver solver = new LUDecomposition(XtX).getSolver();
        if (!solver.isNonSingular()) {
            throw new IllegalArgumentException("Design matrix X'X is singular; cannot compute (X'X)⁻¹");
        }
        double[] beta = solver.solve(Xt.operate(yv)).toArray();
        intercept = beta[0];
        slope = beta[1];
    }

    /** Intercept β₀ (value of the line at position 0) */
    public double getIntercept() { return intercept; }

    /** Slope β₁ (change per position) */
    public double getSlope() { return slope; }

    /** Value of the fitted line at a position; positions beyond the fit range extrapolate. */
    public double predict(int position) {
        return intercept + slope * position;
    }

    /** Fitted line evaluated at {@code length} consecutive positions starting at {@code fromPosition}. */
    public double[] predict(int fromPosition, int length) {
        double[] out = new double[length];
        for (int i = 0; i < length; i++) {
            out[i] = predict(fromPosition + i);
        }
        return out;
    }
}
