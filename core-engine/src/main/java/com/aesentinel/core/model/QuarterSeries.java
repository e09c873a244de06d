package com.aesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Regular quarterly count series for one product.
 *
 * <p>
 * Periods are strictly increasing and contiguous: every quarter between the
 * first and the last period is present, with a count of zero when nothing was
 * reported. The constructor enforces this so that rolling statistics and
 * quarter-over-quarter changes can index neighbours directly.
 * </p>
 *
 * <p>
 * Instances are immutable and safe to share between threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class QuarterSeries implements Iterable<QuarterCount> {

    private static final QuarterSeries EMPTY = new QuarterSeries(List.of());

    private final List<QuarterCount> points;

    /**
     * @param points chronologically ordered, gap-free quarter counts
     * @throws NullPointerException     if {@code points} or an element is
     *                                  {@code null}
     * @throws IllegalArgumentException if the periods are not contiguous
     */
    public QuarterSeries(List<QuarterCount> points) {
        Objects.requireNonNull(points, "points must not be null");
        List<QuarterCount> copy = new ArrayList<>(points.size());
        LocalDate expected = null;
        for (QuarterCount point : points) {
            Objects.requireNonNull(point, "series point must not be null");
            if (expected != null && !expected.equals(point.getPeriod())) {
                throw new IllegalArgumentException(
                        "Quarter series must be contiguous: expected " + expected + " but got " + point.getPeriod());
            }
            copy.add(point);
            expected = Quarters.next(point.getPeriod());
        }
        this.points = Collections.unmodifiableList(copy);
    }

    /**
     * @return the shared empty series
     */
    public static QuarterSeries empty() {
        return EMPTY;
    }

    /**
     * Build a series from consecutive counts starting at {@code firstPeriod}.
     *
     * @param firstPeriod first day of the first quarter
     * @param counts      counts for consecutive quarters
     * @return a new series
     */
    public static QuarterSeries of(LocalDate firstPeriod, long... counts) {
        Objects.requireNonNull(firstPeriod, "firstPeriod must not be null");
        List<QuarterCount> points = new ArrayList<>(counts.length);
        LocalDate period = Quarters.startOf(firstPeriod);
        for (long count : counts) {
            points.add(new QuarterCount(period, count));
            period = Quarters.next(period);
        }
        return new QuarterSeries(points);
    }

    /**
     * @return unmodifiable view of the quarter counts
     */
    @JsonValue
    public List<QuarterCount> getPoints() {
        return points;
    }

    public QuarterCount get(int index) {
        return points.get(index);
    }

    public int size() {
        return points.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * @return first period
     * @throws NoSuchElementException if the series is empty
     */
    @JsonIgnore
    public LocalDate getFirstPeriod() {
        requireNonEmpty();
        return points.get(0).getPeriod();
    }

    /**
     * @return last period
     * @throws NoSuchElementException if the series is empty
     */
    @JsonIgnore
    public LocalDate getLastPeriod() {
        requireNonEmpty();
        return points.get(points.size() - 1).getPeriod();
    }

    /**
     * @return the counts in chronological order as doubles, for statistics
     */
    public double[] countsAsDoubles() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getCount();
        }
        return values;
    }

    /**
     * @param period a quarter start date
     * @return {@code true} if this series has a row for {@code period}
     */
    public boolean containsPeriod(LocalDate period) {
        if (period == null || isEmpty() || !Quarters.isQuarterStart(period)) {
            return false;
        }
        return !period.isBefore(getFirstPeriod()) && !period.isAfter(getLastPeriod());
    }

    @Override
    public Iterator<QuarterCount> iterator() {
        return points.iterator();
    }

    private void requireNonEmpty() {
        if (points.isEmpty()) {
            throw new NoSuchElementException("Quarter series is empty");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof QuarterSeries that))
            return false;
        return points.equals(that.points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return "QuarterSeries" + points;
    }
}
