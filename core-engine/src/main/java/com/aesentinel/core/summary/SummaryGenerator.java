package com.aesentinel.core.summary;

import com.aesentinel.core.model.ForecastPoint;
import com.aesentinel.core.model.ForecastResult;
import com.aesentinel.core.model.QuarterCount;
import com.aesentinel.core.model.QuarterSeries;
import com.aesentinel.core.model.SummaryDigest;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.Objects;
import java.util.Optional;

/**
 * Produces the {@link SummaryDigest} of a series and its optional forecast.
 *
 * <p>
 * The trend is {@code increasing} only when the last quarter's count is
 * strictly greater than the first quarter's; equal counts read as
 * {@code decreasing}. Forecast metrics come from the earliest forecast point
 * after the last observed quarter and are omitted when there is none.
 * </p>
 *
 * @since 1.0.0
 */
public class SummaryGenerator {

    /**
     * @param series   the quarterly series; must not be {@code null}
     * @param forecast forecast for the same series, if one was produced
     * @return the digest; empty when the series is empty
     */
    public SummaryDigest summarize(QuarterSeries series, Optional<ForecastResult> forecast) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(forecast, "forecast must not be null, use Optional.empty()");
        if (series.isEmpty()) {
            return SummaryDigest.empty();
        }

        DescriptiveStatistics stats = new DescriptiveStatistics(series.countsAsDoubles());
        long total = series.getPoints().stream().mapToLong(QuarterCount::getCount).sum();
        long first = series.get(0).getCount();
        long last = series.get(series.size() - 1).getCount();

        SummaryDigest.Builder digest = SummaryDigest.builder()
                .put(SummaryDigest.TOTAL_REPORTS, total)
                .put(SummaryDigest.AVG_QUARTERLY_REPORTS, stats.getMean())
                .put(SummaryDigest.STD_QUARTERLY_REPORTS, series.size() > 1 ? stats.getStandardDeviation() : 0.0)
                .put(SummaryDigest.TREND, last > first ? SummaryDigest.TREND_INCREASING : SummaryDigest.TREND_DECREASING)
                .put(SummaryDigest.RECENT_QUARTER_REPORTS, last)
                .put(SummaryDigest.DATA_START, series.getFirstPeriod())
                .put(SummaryDigest.DATA_END, series.getLastPeriod());

        Optional<ForecastPoint> next = forecast.flatMap(f -> f.firstAfter(series.getLastPeriod()));
        next.ifPresent(point -> digest
                .put(SummaryDigest.FORECAST_NEXT_QUARTER, point.getPointEstimate())
                .put(SummaryDigest.FORECAST_LOWER_BOUND, point.getLowerBound())
                .put(SummaryDigest.FORECAST_UPPER_BOUND, point.getUpperBound()));

        return digest.build();
    }
}
