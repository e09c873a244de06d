package com.aesentinel.core.forecast;

import com.aesentinel.core.model.QuarterSeries;
import com.aesentinel.core.model.Quarters;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.time.LocalDate;

/**
 * Piecewise-linear trend with quarter-of-year seasonality.
 *
 * <h3>Model</h3>
 * <p>
 * With time scaled to {@code [0, 1]} over the history, the design matrix holds
 * an intercept, a linear trend, one hinge {@code max(0, t - t_k)} per
 * changepoint and, once {@value #MIN_SEASONAL_HISTORY} quarters are
 * available, dummies for quarters two to four. Changepoints are spread evenly
 * over the first 80% of the history, at most {@value #MAX_CHANGEPOINTS}.
 * </p>
 *
 * <h3>Regularisation</h3>
 * <p>
 * Hinge coefficients carry a ridge penalty of
 * {@code CHANGEPOINT_PENALTY / changepointSensitivity}: low sensitivity keeps
 * the trend close to a straight line, high sensitivity lets it bend. The
 * penalty is applied as extra rows of the least-squares system, solved by QR
 * decomposition. Counts are scaled by their maximum before fitting.
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalTrendForecaster extends AbstractForecaster {

    static final int MAX_CHANGEPOINTS = 8;
    static final int MIN_SEASONAL_HISTORY = 8;
    static final double CHANGEPOINT_RANGE = 0.8;
    static final double CHANGEPOINT_PENALTY = 0.05;

    /** Keeps the system full rank without measurably biasing the fit. */
    private static final double STABILITY_PENALTY = 1e-8;

    @Override
    public String getModelName() {
        return ForecasterFactory.SEASONAL_TREND;
    }

    @Override
    protected Fit fit(QuarterSeries series, int horizon, ForecastSettings settings) {
        int n = series.size();
        double[] y = series.countsAsDoubles();
        double scale = 0;
        for (double v : y) {
            scale = Math.max(scale, Math.abs(v));
        }
        if (scale == 0) {
            scale = 1;
        }

        int[] changepoints = changepointIndices(n);
        boolean seasonal = n >= MIN_SEASONAL_HISTORY;
        int columns = 2 + changepoints.length + (seasonal ? 3 : 0);

        double cpWeight = Math.sqrt(CHANGEPOINT_PENALTY / settings.getChangepointSensitivity());
        double stabilityWeight = Math.sqrt(STABILITY_PENALTY);

        // rows 0..n-1 are observations, then one penalty row per non-intercept column
        RealMatrix a = new Array2DRowRealMatrix(n + columns - 1, columns);
        RealVector b = new ArrayRealVector(n + columns - 1);
        for (int i = 0; i < n; i++) {
            a.setRow(i, designRow(i, n, changepoints, seasonal, series.get(i).getPeriod()));
            b.setEntry(i, y[i] / scale);
        }
        for (int c = 1; c < columns; c++) {
            boolean isHinge = c >= 2 && c < 2 + changepoints.length;
            a.setEntry(n + c - 1, c, isHinge ? cpWeight : stabilityWeight);
        }

        RealVector beta = new QRDecomposition(a).getSolver().solve(b);

        double[] estimates = new double[n + horizon];
        double sumSquares = 0;
        LocalDate period = series.getFirstPeriod();
        for (int i = 0; i < n + horizon; i++) {
            double[] row = designRow(i, n, changepoints, seasonal, period);
            double estimate = 0;
            for (int c = 0; c < columns; c++) {
                estimate += row[c] * beta.getEntry(c);
            }
            estimates[i] = estimate * scale;
            if (i < n) {
                double residual = y[i] - estimates[i];
                sumSquares += residual * residual;
            }
            period = Quarters.next(period);
        }

        int freeParameters = 2 + (seasonal ? 3 : 0);
        double residualStd = Math.sqrt(sumSquares / Math.max(1, n - freeParameters));
        return new Fit(estimates, residualStd);
    }

    /**
     * Evenly spaced changepoint indices in {@code [1, 0.8 × (n - 1)]}.
     */
    static int[] changepointIndices(int n) {
        int lastIndex = (int) Math.floor(CHANGEPOINT_RANGE * (n - 1));
        int count = Math.min(MAX_CHANGEPOINTS, lastIndex);
        if (count <= 0) {
            return new int[0];
        }
        int[] indices = new int[count];
        for (int j = 1; j <= count; j++) {
            indices[j - 1] = (int) Math.round(j * (double) lastIndex / count);
        }
        return indices;
    }

    private static double[] designRow(int index, int n, int[] changepoints, boolean seasonal, LocalDate period) {
        double t = scaledTime(index, n);
        double[] row = new double[2 + changepoints.length + (seasonal ? 3 : 0)];
        row[0] = 1;
        row[1] = t;
        for (int k = 0; k < changepoints.length; k++) {
            row[2 + k] = Math.max(0, t - scaledTime(changepoints[k], n));
        }
        if (seasonal) {
            int quarter = Quarters.quarterOfYear(period);
            if (quarter > 1) {
                row[2 + changepoints.length + quarter - 2] = 1;
            }
        }
        return row;
    }

    private static double scaledTime(int index, int n) {
        return (double) index / (n - 1);
    }
}
