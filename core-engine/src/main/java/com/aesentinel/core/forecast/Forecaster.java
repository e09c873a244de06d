package com.aesentinel.core.forecast;

import com.aesentinel.core.model.ForecastResult;
import com.aesentinel.core.model.QuarterSeries;

/**
 * Contract for quarterly report-volume forecasters.
 *
 * <p>
 * Implementations fit a model to the whole series and return a
 * {@link ForecastResult} that covers every historical period (the in-sample
 * fit) followed by exactly {@code horizon} future quarters. For every point
 * {@code lowerBound <= pointEstimate <= upperBound}.
 * </p>
 *
 * <p>
 * Implementations are stateless and may be shared between threads.
 * </p>
 */
public interface Forecaster {

    /**
     * Fit the model and forecast.
     *
     * @param series   the quarterly history; must contain at least two periods
     * @param horizon  number of future quarters, {@code >= 0}
     * @param settings model sensitivity and interval coverage
     * @return fitted history plus {@code horizon} future points
     * @throws InsufficientDataException if {@code series} has fewer than two
     *                                   periods
     * @throws IllegalArgumentException  if {@code horizon} is negative
     */
    ForecastResult fitAndForecast(QuarterSeries series, int horizon, ForecastSettings settings)
            throws InsufficientDataException;

    /**
     * @return the name this forecaster is registered under
     */
    String getModelName();
}
