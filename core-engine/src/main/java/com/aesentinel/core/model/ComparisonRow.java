package com.aesentinel.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Headline figures for one product in a cross-product comparison.
 *
 * @since 1.0.0
 */
public final class ComparisonRow {

    private final String seriesId;
    private final long totalCount;
    private final double recentAverage;
    private final LocalDate peakPeriod;
    private final long peakCount;

    public ComparisonRow(String seriesId, long totalCount, double recentAverage, LocalDate peakPeriod,
            long peakCount) {
        this.seriesId = Objects.requireNonNull(seriesId, "seriesId must not be null");
        this.totalCount = totalCount;
        this.recentAverage = recentAverage;
        this.peakPeriod = Objects.requireNonNull(peakPeriod, "peakPeriod must not be null");
        this.peakCount = peakCount;
    }

    public String getSeriesId() {
        return seriesId;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public double getRecentAverage() {
        return recentAverage;
    }

    public LocalDate getPeakPeriod() {
        return peakPeriod;
    }

    public long getPeakCount() {
        return peakCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ComparisonRow that))
            return false;
        return totalCount == that.totalCount
                && Double.compare(recentAverage, that.recentAverage) == 0
                && peakCount == that.peakCount
                && seriesId.equals(that.seriesId)
                && peakPeriod.equals(that.peakPeriod);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seriesId, totalCount, recentAverage, peakPeriod, peakCount);
    }

    @Override
    public String toString() {
        return "ComparisonRow{seriesId='" + seriesId + "', totalCount=" + totalCount
                + ", recentAverage=" + recentAverage + ", peakPeriod=" + peakPeriod
                + ", peakCount=" + peakCount + '}';
    }
}
