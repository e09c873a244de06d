package com.aesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One raw adverse-event observation: a report count received on a date.
 *
 * <p>
 * The timestamp is kept exactly as received. Registries deliver it in
 * different textual forms (openFDA uses {@code yyyyMMdd}), so parsing is
 * deferred to {@link com.aesentinel.core.normalize.SeriesNormalizer}, which
 * drops events whose timestamp cannot be read instead of failing the run.
 * </p>
 *
 * <p>
 * Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RawEvent {

    /** Timestamp as received; may be {@code null} or malformed. */
    private final String timestamp;

    /** Number of reports; missing or negative values are rejected during normalization. */
    private final Long count;

    @JsonCreator
    public RawEvent(
            @JsonProperty("time") @JsonAlias({"receivedate", "timestamp", "date"}) String timestamp,
            @JsonProperty("count") Long count) {
        this.timestamp = timestamp;
        this.count = count;
    }

    /**
     * Create an event from a semantic date.
     *
     * @param date  the report date; must not be {@code null}
     * @param count the report count
     * @return a new event
     */
    public static RawEvent of(LocalDate date, long count) {
        Objects.requireNonNull(date, "date must not be null");
        return new RawEvent(date.toString(), count);
    }

    /**
     * Create an event from a textual timestamp, as delivered by a registry.
     *
     * @param timestamp the raw timestamp; may be {@code null}
     * @param count     the report count
     * @return a new event
     */
    public static RawEvent of(String timestamp, long count) {
        return new RawEvent(timestamp, count);
    }

    /**
     * Placeholder for a record that could not be read at all. Normalization
     * always drops it, so it shows up in the dropped-event count.
     *
     * @return an event with neither timestamp nor count
     */
    public static RawEvent malformed() {
        return new RawEvent(null, null);
    }

    public String getTimestamp() {
        return timestamp;
    }

    /**
     * @return the report count, or {@code null} if the record had none
     */
    public Long getCount() {
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RawEvent that))
            return false;
        return Objects.equals(count, that.count) && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, count);
    }

    @Override
    public String toString() {
        return "RawEvent{timestamp='" + timestamp + "', count=" + count + '}';
    }
}
