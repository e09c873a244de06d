package com.aesentinel.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Number of reports received in one calendar quarter.
 *
 * @since 1.0.0
 */
public final class QuarterCount {

    private final LocalDate period;
    private final long count;

    /**
     * @param period first day of the quarter
     * @param count  total reports in the quarter
     * @throws NullPointerException     if {@code period} is {@code null}
     * @throws IllegalArgumentException if {@code period} is not a quarter start
     *                                  or {@code count} is negative
     */
    public QuarterCount(LocalDate period, long count) {
        this.period = Objects.requireNonNull(period, "period must not be null");
        if (!Quarters.isQuarterStart(period)) {
            throw new IllegalArgumentException("period must be the first day of a quarter, got: " + period);
        }
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got: " + count);
        }
        this.count = count;
    }

    public LocalDate getPeriod() {
        return period;
    }

    public long getCount() {
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof QuarterCount that))
            return false;
        return count == that.count && period.equals(that.period);
    }

    @Override
    public int hashCode() {
        return Objects.hash(period, count);
    }

    @Override
    public String toString() {
        return period + "=" + count;
    }
}
