package com.aesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A quarter whose count deviates from its trailing window.
 *
 * @since 1.0.0
 */
public final class AnomalyRecord {

    private final LocalDate period;
    private final long count;
    private final double rollingMean;
    private final double rollingStd;
    private final double zScore;

    public AnomalyRecord(LocalDate period, long count, double rollingMean, double rollingStd, double zScore) {
        this.period = Objects.requireNonNull(period, "period must not be null");
        this.count = count;
        this.rollingMean = rollingMean;
        this.rollingStd = rollingStd;
        this.zScore = zScore;
    }

    public LocalDate getPeriod() {
        return period;
    }

    public long getCount() {
        return count;
    }

    public double getRollingMean() {
        return rollingMean;
    }

    public double getRollingStd() {
        return rollingStd;
    }

    @JsonProperty("zScore")
    public double getZScore() {
        return zScore;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyRecord that))
            return false;
        return count == that.count
                && Double.compare(rollingMean, that.rollingMean) == 0
                && Double.compare(rollingStd, that.rollingStd) == 0
                && Double.compare(zScore, that.zScore) == 0
                && period.equals(that.period);
    }

    @Override
    public int hashCode() {
        return Objects.hash(period, count, rollingMean, rollingStd, zScore);
    }

    @Override
    public String toString() {
        return String.format("AnomalyRecord{%s: count=%d, mean=%.2f, std=%.2f, z=%.2f}",
                period, count, rollingMean, rollingStd, zScore);
    }
}
