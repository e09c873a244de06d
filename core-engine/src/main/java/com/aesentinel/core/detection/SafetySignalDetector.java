package com.aesentinel.core.detection;

import com.aesentinel.core.model.QuarterCount;
import com.aesentinel.core.model.QuarterSeries;
import com.aesentinel.core.model.SignalRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Quarter-over-quarter increase detector.
 *
 * <p>
 * A quarter is a safety signal when its count rose by at least
 * {@code minAbsoluteIncrease} reports <strong>and</strong> by more than
 * {@value #MIN_PERCENT_INCREASE}% over the previous quarter. When the previous
 * quarter had no reports the relative change is undefined; any rise meeting
 * the absolute condition is then flagged.
 * </p>
 *
 * @since 1.0.0
 */
public class SafetySignalDetector implements SeriesDetector<SignalRecord> {

    private static final Logger LOG = LoggerFactory.getLogger(SafetySignalDetector.class);

    static final double MIN_PERCENT_INCREASE = 50.0;
    static final int MIN_SERIES_LENGTH = 2;

    private final long minAbsoluteIncrease;

    /**
     * @param minAbsoluteIncrease minimum rise in reports, {@code >= 0}
     * @throws IllegalArgumentException if {@code minAbsoluteIncrease} is negative
     */
    public SafetySignalDetector(long minAbsoluteIncrease) {
        if (minAbsoluteIncrease < 0) {
            throw new IllegalArgumentException("minAbsoluteIncrease must be >= 0, got: " + minAbsoluteIncrease);
        }
        this.minAbsoluteIncrease = minAbsoluteIncrease;
    }

    @Override
    public List<SignalRecord> detect(QuarterSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        if (series.size() < MIN_SERIES_LENGTH) {
            return Collections.emptyList();
        }

        List<SignalRecord> signals = new ArrayList<>();
        for (int i = 1; i < series.size(); i++) {
            QuarterCount previous = series.get(i - 1);
            QuarterCount current = series.get(i);
            long change = current.getCount() - previous.getCount();
            if (change < minAbsoluteIncrease) {
                continue;
            }

            if (previous.getCount() == 0) {
                if (current.getCount() > 0) {
                    LOG.debug("Signal at {}: {} report(s) after an empty quarter", current.getPeriod(), change);
                    signals.add(SignalRecord.fromZeroBase(current.getPeriod(), current.getCount(), change));
                }
                continue;
            }

            double percent = 100.0 * change / previous.getCount();
            if (percent > MIN_PERCENT_INCREASE) {
                LOG.debug("Signal at {}: +{} report(s) ({}%)", current.getPeriod(), change,
                        String.format("%.1f", percent));
                signals.add(SignalRecord.withPercentChange(current.getPeriod(), current.getCount(), change, percent));
            }
        }

        if (!signals.isEmpty()) {
            LOG.info("Detected {} safety signal(s) (min increase {})", signals.size(), minAbsoluteIncrease);
        }
        return Collections.unmodifiableList(signals);
    }

    @Override
    public String getName() {
        return "safety-signal";
    }

    public long getMinAbsoluteIncrease() {
        return minAbsoluteIncrease;
    }
}
