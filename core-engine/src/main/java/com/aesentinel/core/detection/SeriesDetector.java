package com.aesentinel.core.detection;

import com.aesentinel.core.model.QuarterSeries;

import java.util.List;

/**
 * Contract for detectors that scan a whole quarterly series.
 *
 * <p>
 * Implementations are <strong>stateless</strong>: thresholds are bound at
 * construction and {@link #detect(QuarterSeries)} may be called concurrently.
 * A series too short to judge yields an empty list, never an exception.
 * </p>
 *
 * @param <R> the record type emitted for each flagged quarter
 */
public interface SeriesDetector<R> {

    /**
     * Scan the series.
     *
     * @param series the quarterly series; must not be {@code null}
     * @return flagged quarters in chronological order, each at most once
     */
    List<R> detect(QuarterSeries series);

    /**
     * @return the name of this detector, used in logs
     */
    String getName();
}
