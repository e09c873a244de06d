package com.aesentinel.core.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A quarter with a sharp increase over the previous quarter.
 *
 * <p>
 * When the previous quarter had no reports the relative change is undefined;
 * {@link #getPercentChange()} is then empty and {@link #isZeroBase()} returns
 * {@code true}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SignalRecord {

    private final LocalDate period;
    private final long count;
    private final long absoluteChange;
    private final Double percentChange;

    private SignalRecord(LocalDate period, long count, long absoluteChange, Double percentChange) {
        this.period = Objects.requireNonNull(period, "period must not be null");
        this.count = count;
        this.absoluteChange = absoluteChange;
        this.percentChange = percentChange;
    }

    /**
     * @return a signal measured against a non-zero previous quarter
     */
    public static SignalRecord withPercentChange(LocalDate period, long count, long absoluteChange,
            double percentChange) {
        return new SignalRecord(period, count, absoluteChange, percentChange);
    }

    /**
     * @return a signal rising from a quarter with zero reports
     */
    public static SignalRecord fromZeroBase(LocalDate period, long count, long absoluteChange) {
        return new SignalRecord(period, count, absoluteChange, null);
    }

    public LocalDate getPeriod() {
        return period;
    }

    public long getCount() {
        return count;
    }

    public long getAbsoluteChange() {
        return absoluteChange;
    }

    public OptionalDouble getPercentChange() {
        return percentChange != null ? OptionalDouble.of(percentChange) : OptionalDouble.empty();
    }

    public boolean isZeroBase() {
        return percentChange == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SignalRecord that))
            return false;
        return count == that.count
                && absoluteChange == that.absoluteChange
                && Objects.equals(percentChange, that.percentChange)
                && period.equals(that.period);
    }

    @Override
    public int hashCode() {
        return Objects.hash(period, count, absoluteChange, percentChange);
    }

    @Override
    public String toString() {
        return "SignalRecord{" + period + ": count=" + count + ", absoluteChange=" + absoluteChange
                + ", percentChange=" + (percentChange != null ? String.format("%.1f%%", percentChange) : "n/a")
                + '}';
    }
}
