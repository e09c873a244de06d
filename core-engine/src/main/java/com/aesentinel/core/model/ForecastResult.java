package com.aesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fitted history plus future predictions produced by a
 * {@link com.aesentinel.core.forecast.Forecaster}.
 *
 * <p>
 * Points are strictly increasing by period. Points up to and including
 * {@link #getLastObservedPeriod()} are the in-sample fit; later points are the
 * forecast horizon.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecastResult {

    private final String model;
    private final LocalDate lastObservedPeriod;
    private final List<ForecastPoint> points;

    /**
     * @param model              name of the estimator that produced the result
     * @param lastObservedPeriod last period of the series the model was fit on
     * @param points             fitted and future points in chronological order
     * @throws IllegalArgumentException if the points are not strictly increasing
     */
    public ForecastResult(String model, LocalDate lastObservedPeriod, List<ForecastPoint> points) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.lastObservedPeriod = Objects.requireNonNull(lastObservedPeriod, "lastObservedPeriod must not be null");
        Objects.requireNonNull(points, "points must not be null");
        List<ForecastPoint> copy = new ArrayList<>(points.size());
        LocalDate previous = null;
        for (ForecastPoint point : points) {
            Objects.requireNonNull(point, "forecast point must not be null");
            if (previous != null && !point.getPeriod().isAfter(previous)) {
                throw new IllegalArgumentException(
                        "Forecast points must be strictly increasing: " + point.getPeriod() + " after " + previous);
            }
            copy.add(point);
            previous = point.getPeriod();
        }
        this.points = Collections.unmodifiableList(copy);
    }

    public String getModel() {
        return model;
    }

    public LocalDate getLastObservedPeriod() {
        return lastObservedPeriod;
    }

    /**
     * @return unmodifiable list of all points
     */
    public List<ForecastPoint> getPoints() {
        return points;
    }

    /**
     * @return in-sample points (period not after the last observed period)
     */
    @JsonIgnore
    public List<ForecastPoint> getHistorical() {
        return points.stream()
                .filter(p -> !p.getPeriod().isAfter(lastObservedPeriod))
                .toList();
    }

    /**
     * @return horizon points (period after the last observed period)
     */
    @JsonIgnore
    public List<ForecastPoint> getFuture() {
        return points.stream()
                .filter(p -> p.getPeriod().isAfter(lastObservedPeriod))
                .toList();
    }

    /**
     * @param period reference period
     * @return the earliest point strictly after {@code period}, if any
     */
    public Optional<ForecastPoint> firstAfter(LocalDate period) {
        Objects.requireNonNull(period, "period must not be null");
        return points.stream()
                .filter(p -> p.getPeriod().isAfter(period))
                .findFirst();
    }

    @Override
    public String toString() {
        return "ForecastResult{model='" + model + "', lastObservedPeriod=" + lastObservedPeriod
                + ", points=" + points.size() + '}';
    }
}
