package com.aesentinel.core.normalize;

import com.aesentinel.core.model.NormalizationResult;
import com.aesentinel.core.model.QuarterCount;
import com.aesentinel.core.model.QuarterSeries;
import com.aesentinel.core.model.Quarters;
import com.aesentinel.core.model.RawEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Converts irregular raw events into a gap-free quarterly count series.
 *
 * <p>
 * Events are summed per calendar quarter. The output has one row for every
 * quarter from the earliest to the latest event, zero-filled where nothing was
 * reported. Events with a missing or unreadable timestamp, or a missing or
 * negative count, are dropped and counted in
 * {@link NormalizationResult#getDroppedEvents()}.
 * </p>
 *
 * <h3>Accepted timestamps</h3>
 * <ul>
 * <li>{@code yyyy-MM-dd}</li>
 * <li>{@code yyyyMMdd} (openFDA {@code receivedate})</li>
 * <li>ISO date-time, with {@code T} or a space between date and time; only
 * the date part is used</li>
 * </ul>
 *
 * <p>
 * Dates in the last quarter {@link LocalDate} can hold are treated as
 * unreadable, since the quarter after them cannot be represented.
 * </p>
 *
 * <p>
 * Stateless and thread-safe. The result does not depend on input order.
 * </p>
 *
 * @since 1.0.0
 */
public class SeriesNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesNormalizer.class);

    private static final LocalDate LAST_QUARTER = Quarters.startOf(LocalDate.MAX);

    /**
     * Normalize raw events into quarterly counts.
     *
     * @param events raw events in any order; must not be {@code null}
     * @return the quarterly series and the number of dropped events
     */
    public NormalizationResult normalize(Collection<RawEvent> events) {
        Objects.requireNonNull(events, "events must not be null");

        TreeMap<LocalDate, Long> buckets = new TreeMap<>();
        int dropped = 0;
        for (RawEvent event : events) {
            if (event == null || event.getCount() == null || event.getCount() < 0) {
                dropped++;
                continue;
            }
            Optional<LocalDate> date = parseTimestamp(event.getTimestamp());
            if (date.isEmpty()) {
                LOG.trace("Dropping event with unreadable timestamp: {}", event);
                dropped++;
                continue;
            }
            buckets.merge(Quarters.startOf(date.get()), event.getCount(), Long::sum);
        }

        if (dropped > 0) {
            LOG.warn("Dropped {} of {} raw event(s) with a missing/invalid timestamp or count",
                    dropped, events.size());
        }
        if (buckets.isEmpty()) {
            return new NormalizationResult(QuarterSeries.empty(), dropped);
        }

        LocalDate first = buckets.firstKey();
        LocalDate last = buckets.lastKey();
        List<QuarterCount> points = new ArrayList<>();
        for (LocalDate period = first; !period.isAfter(last); period = Quarters.next(period)) {
            points.add(new QuarterCount(period, buckets.getOrDefault(period, 0L)));
        }

        QuarterSeries series = new QuarterSeries(points);
        LOG.debug("Normalized {} event(s) into {} quarter(s) from {} to {}",
                events.size() - dropped, series.size(), first, last);
        return new NormalizationResult(series, dropped);
    }

    /**
     * Parse a raw timestamp.
     *
     * @param raw timestamp text; may be {@code null}
     * @return the date, or empty if {@code raw} is missing or unreadable
     */
    static Optional<LocalDate> parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = raw.trim();
        try {
            LocalDate date;
            if (text.length() == 8 && text.chars().allMatch(Character::isDigit)) {
                date = LocalDate.parse(text, DateTimeFormatter.BASIC_ISO_DATE);
            } else {
                if (text.length() > 10 && (text.charAt(10) == 'T' || text.charAt(10) == ' ')) {
                    text = text.substring(0, 10);
                }
                date = LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE);
            }
            return Quarters.startOf(date).isBefore(LAST_QUARTER) ? Optional.of(date) : Optional.empty();
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
