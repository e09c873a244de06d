package com.aesentinel.core.model;

import java.util.Objects;

/**
 * Output of normalization: the quarterly series plus the number of raw events
 * that were dropped because their timestamp or count could not be used.
 *
 * @since 1.0.0
 */
public final class NormalizationResult {

    private final QuarterSeries series;
    private final int droppedEvents;

    public NormalizationResult(QuarterSeries series, int droppedEvents) {
        this.series = Objects.requireNonNull(series, "series must not be null");
        if (droppedEvents < 0) {
            throw new IllegalArgumentException("droppedEvents must be >= 0, got: " + droppedEvents);
        }
        this.droppedEvents = droppedEvents;
    }

    public QuarterSeries getSeries() {
        return series;
    }

    public int getDroppedEvents() {
        return droppedEvents;
    }

    @Override
    public String toString() {
        return "NormalizationResult{quarters=" + series.size() + ", droppedEvents=" + droppedEvents + '}';
    }
}
