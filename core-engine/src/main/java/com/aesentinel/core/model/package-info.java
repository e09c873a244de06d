/**
 * Domain model for Adverse Event Sentinel.
 *
 * <p>
 * Every type here is immutable:
 * </p>
 * <ul>
 * <li>{@link com.aesentinel.core.model.RawEvent}: one received report count</li>
 * <li>{@link com.aesentinel.core.model.QuarterSeries}: gap-free quarterly
 * counts</li>
 * <li>{@link com.aesentinel.core.model.ForecastResult}: fitted and predicted
 * quarters</li>
 * <li>{@link com.aesentinel.core.model.AnomalyRecord},
 * {@link com.aesentinel.core.model.SignalRecord},
 * {@link com.aesentinel.core.model.ComparisonRow}: derived findings</li>
 * <li>{@link com.aesentinel.core.model.SummaryDigest}: flat metric digest</li>
 * <li>{@link com.aesentinel.core.model.MonitoringResult}: per-product result
 * bundle</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.aesentinel.core.model;
