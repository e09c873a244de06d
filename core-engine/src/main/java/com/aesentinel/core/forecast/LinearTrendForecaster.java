package com.aesentinel.core.forecast;

import com.aesentinel.core.model.QuarterSeries;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Straight-line trend fit by ordinary least squares.
 *
 * <p>
 * Ignores seasonality and {@code changepointSensitivity}. Useful as a
 * baseline and for short series.
 * </p>
 *
 * @since 1.0.0
 */
public class LinearTrendForecaster extends AbstractForecaster {

    @Override
    public String getModelName() {
        return ForecasterFactory.LINEAR_TREND;
    }

    @Override
    protected Fit fit(QuarterSeries series, int horizon, ForecastSettings settings) {
        int n = series.size();
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < n; i++) {
            regression.addData(i, series.get(i).getCount());
        }

        double[] estimates = new double[n + horizon];
        for (int i = 0; i < estimates.length; i++) {
            estimates[i] = regression.predict(i);
        }

        // two points are fit exactly and leave no residual degrees of freedom
        double residualStd = n > 2 ? Math.sqrt(regression.getMeanSquareError()) : 0;
        return new Fit(estimates, residualStd);
    }
}
