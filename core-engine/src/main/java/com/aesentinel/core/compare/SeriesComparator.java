package com.aesentinel.core.compare;

import com.aesentinel.core.model.ComparisonRow;
import com.aesentinel.core.model.QuarterCount;
import com.aesentinel.core.model.QuarterSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds one {@link ComparisonRow} per product series.
 *
 * <p>
 * Rows follow the iteration order of the input map; products with an empty
 * series are skipped. Sorting for presentation is left to the caller.
 * </p>
 *
 * @since 1.0.0
 */
public class SeriesComparator {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesComparator.class);

    /** Number of trailing quarters averaged for {@code recentAverage}. */
    static final int RECENT_QUARTERS = 4;

    /**
     * @param seriesById product id to its quarterly series; must not be
     *                   {@code null}
     * @return one row per product with data
     */
    public List<ComparisonRow> compare(Map<String, QuarterSeries> seriesById) {
        Objects.requireNonNull(seriesById, "seriesById must not be null");

        List<ComparisonRow> rows = new ArrayList<>(seriesById.size());
        for (Map.Entry<String, QuarterSeries> entry : seriesById.entrySet()) {
            QuarterSeries series = entry.getValue();
            if (series == null || series.isEmpty()) {
                LOG.debug("Skipping '{}': no quarterly data", entry.getKey());
                continue;
            }
            rows.add(row(entry.getKey(), series));
        }
        LOG.info("Compared {} of {} series", rows.size(), seriesById.size());
        return Collections.unmodifiableList(rows);
    }

    private static ComparisonRow row(String id, QuarterSeries series) {
        long total = 0;
        QuarterCount peak = series.get(0);
        for (QuarterCount point : series) {
            total += point.getCount();
            // strict comparison keeps the earliest quarter on ties
            if (point.getCount() > peak.getCount()) {
                peak = point;
            }
        }

        int recentFrom = Math.max(0, series.size() - RECENT_QUARTERS);
        long recentSum = 0;
        for (int i = recentFrom; i < series.size(); i++) {
            recentSum += series.get(i).getCount();
        }
        double recentAverage = (double) recentSum / (series.size() - recentFrom);

        return new ComparisonRow(id, total, recentAverage, peak.getPeriod(), peak.getCount());
    }
}
