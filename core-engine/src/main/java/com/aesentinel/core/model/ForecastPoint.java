package com.aesentinel.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A predicted report count for one quarter with its prediction interval.
 *
 * @since 1.0.0
 */
public final class ForecastPoint {

    private final LocalDate period;
    private final double pointEstimate;
    private final double lowerBound;
    private final double upperBound;

    /**
     * @throws NullPointerException     if {@code period} is {@code null}
     * @throws IllegalArgumentException if the values are not finite or the
     *                                  bounds do not enclose the estimate
     */
    public ForecastPoint(LocalDate period, double pointEstimate, double lowerBound, double upperBound) {
        this.period = Objects.requireNonNull(period, "period must not be null");
        if (!Double.isFinite(pointEstimate) || !Double.isFinite(lowerBound) || !Double.isFinite(upperBound)) {
            throw new IllegalArgumentException("Forecast values must be finite for period " + period);
        }
        if (lowerBound > pointEstimate || pointEstimate > upperBound) {
            throw new IllegalArgumentException(String.format(
                    "Forecast bounds out of order for %s: lower=%f estimate=%f upper=%f",
                    period, lowerBound, pointEstimate, upperBound));
        }
        this.pointEstimate = pointEstimate;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public LocalDate getPeriod() {
        return period;
    }

    public double getPointEstimate() {
        return pointEstimate;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ForecastPoint that))
            return false;
        return Double.compare(pointEstimate, that.pointEstimate) == 0
                && Double.compare(lowerBound, that.lowerBound) == 0
                && Double.compare(upperBound, that.upperBound) == 0
                && period.equals(that.period);
    }

    @Override
    public int hashCode() {
        return Objects.hash(period, pointEstimate, lowerBound, upperBound);
    }

    @Override
    public String toString() {
        return String.format("ForecastPoint{%s: %.2f [%.2f, %.2f]}", period, pointEstimate, lowerBound, upperBound);
    }
}
