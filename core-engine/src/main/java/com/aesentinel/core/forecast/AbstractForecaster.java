package com.aesentinel.core.forecast;

import com.aesentinel.core.model.ForecastPoint;
import com.aesentinel.core.model.ForecastResult;
import com.aesentinel.core.model.QuarterSeries;
import com.aesentinel.core.model.Quarters;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Shared input checks and prediction-interval construction.
 *
 * <p>
 * Subclasses only produce point estimates for the {@code n + horizon} time
 * indices and the standard deviation of their in-sample residuals. The
 * interval half-width is {@code z × σ} in-sample and
 * {@code z × σ × sqrt(1 + h / n)} for the {@code h}-th future quarter, where
 * {@code z} is the two-sided standard normal quantile for the configured
 * confidence.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class AbstractForecaster implements Forecaster {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractForecaster.class);

    /** Minimum number of quarters a model can be fit on. */
    public static final int MIN_HISTORY = 2;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0, 1);

    @Override
    public final ForecastResult fitAndForecast(QuarterSeries series, int horizon, ForecastSettings settings)
            throws InsufficientDataException {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        if (horizon < 0) {
            throw new IllegalArgumentException("horizon must be >= 0, got: " + horizon);
        }
        if (series.size() < MIN_HISTORY) {
            throw new InsufficientDataException(series.size(), MIN_HISTORY);
        }

        int n = series.size();
        Fit fit = fit(series, horizon, settings);
        if (fit.estimates.length != n + horizon) {
            throw new IllegalStateException(getModelName() + " produced " + fit.estimates.length
                    + " estimates, expected " + (n + horizon));
        }

        double z = STANDARD_NORMAL.inverseCumulativeProbability(0.5 + settings.getConfidence() / 2);
        double sigma = Double.isFinite(fit.residualStd) ? Math.max(fit.residualStd, 0) : 0;

        List<ForecastPoint> points = new ArrayList<>(n + horizon);
        LocalDate period = series.getFirstPeriod();
        for (int i = 0; i < n + horizon; i++) {
            int stepsAhead = Math.max(0, i - (n - 1));
            double halfWidth = z * sigma * Math.sqrt(1.0 + (double) stepsAhead / n);
            double estimate = fit.estimates[i];
            points.add(new ForecastPoint(period, estimate, estimate - halfWidth, estimate + halfWidth));
            period = Quarters.next(period);
        }

        LOG.info("{} fit on {} quarters, forecast {} ahead (residual sd={})",
                getModelName(), n, horizon, String.format("%.3f", sigma));
        return new ForecastResult(getModelName(), series.getLastPeriod(), points);
    }

    /**
     * Fit the model.
     *
     * @param series   at least {@value #MIN_HISTORY} quarters
     * @param horizon  number of future quarters, {@code >= 0}
     * @param settings tuning knobs
     * @return estimates for indices {@code 0 .. n + horizon - 1} and the
     *         in-sample residual standard deviation
     */
    protected abstract Fit fit(QuarterSeries series, int horizon, ForecastSettings settings);

    /**
     * Point estimates plus residual spread.
     */
    protected static final class Fit {
        private final double[] estimates;
        private final double residualStd;

        protected Fit(double[] estimates, double residualStd) {
            this.estimates = Objects.requireNonNull(estimates, "estimates must not be null");
            this.residualStd = residualStd;
        }
    }
}
