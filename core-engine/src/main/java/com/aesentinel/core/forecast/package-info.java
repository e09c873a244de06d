/**
 * Quarterly report-volume forecasting.
 *
 * <p>
 * All estimators implement {@link com.aesentinel.core.forecast.Forecaster}
 * and are instantiated via
 * {@link com.aesentinel.core.forecast.ForecasterFactory}:
 * </p>
 * <ul>
 * <li>{@link com.aesentinel.core.forecast.SeasonalTrendForecaster}:
 * piecewise-linear trend with quarterly seasonality (default)</li>
 * <li>{@link com.aesentinel.core.forecast.LinearTrendForecaster}: straight
 * line</li>
 * </ul>
 *
 * <p>
 * A series shorter than two quarters raises
 * {@link com.aesentinel.core.forecast.InsufficientDataException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.aesentinel.core.forecast;
