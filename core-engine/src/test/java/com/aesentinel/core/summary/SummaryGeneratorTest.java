package com.aesentinel.core.summary;

import com.aesentinel.core.model.ForecastPoint;
import com.aesentinel.core.model.ForecastResult;
import com.aesentinel.core.model.QuarterSeries;
import com.aesentinel.core.model.SummaryDigest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SummaryGenerator}.
 */
class SummaryGeneratorTest {

    private static final LocalDate START = LocalDate.of(2023, 1, 1);

    private final SummaryGenerator generator = new SummaryGenerator();

    @Test
    @DisplayName("Should describe the observed series")
    void shouldDescribeSeries() {
        SummaryDigest digest = generator.summarize(QuarterSeries.of(START, 5, 4, 30), Optional.empty());

        assertThat(digest.get(SummaryDigest.TOTAL_REPORTS)).contains(39L);
        assertThat(digest.getDouble(SummaryDigest.AVG_QUARTERLY_REPORTS).getAsDouble()).isCloseTo(13.0, within(1e-9));
        assertThat(digest.getDouble(SummaryDigest.STD_QUARTERLY_REPORTS).getAsDouble())
                .isCloseTo(Math.sqrt(217.0), within(1e-9));
        assertThat(digest.get(SummaryDigest.TREND)).contains(SummaryDigest.TREND_INCREASING);
        assertThat(digest.get(SummaryDigest.RECENT_QUARTER_REPORTS)).contains(30L);
        assertThat(digest.get(SummaryDigest.DATA_START)).contains(START);
        assertThat(digest.get(SummaryDigest.DATA_END)).contains(LocalDate.of(2023, 7, 1));
        assertThat(digest.contains(SummaryDigest.FORECAST_NEXT_QUARTER)).isFalse();
    }

    @Test
    @DisplayName("Should report the first future forecast point")
    void shouldIncludeNextQuarterForecast() {
        QuarterSeries series = QuarterSeries.of(START, 5, 4, 30);
        ForecastResult forecast = new ForecastResult("test", series.getLastPeriod(), List.of(
                new ForecastPoint(LocalDate.of(2023, 7, 1), 28, 20, 36),
                new ForecastPoint(LocalDate.of(2023, 10, 1), 35, 30, 40),
                new ForecastPoint(LocalDate.of(2024, 1, 1), 41, 33, 49)));

        SummaryDigest digest = generator.summarize(series, Optional.of(forecast));

        assertThat(digest.getDouble(SummaryDigest.FORECAST_NEXT_QUARTER).getAsDouble()).isEqualTo(35.0);
        assertThat(digest.getDouble(SummaryDigest.FORECAST_LOWER_BOUND).getAsDouble()).isEqualTo(30.0);
        assertThat(digest.getDouble(SummaryDigest.FORECAST_UPPER_BOUND).getAsDouble()).isEqualTo(40.0);
    }

    @Test
    @DisplayName("Should omit forecast fields when the forecast has no future points")
    void shouldOmitForecastWithoutFuture() {
        QuarterSeries series = QuarterSeries.of(START, 5, 4);
        ForecastResult forecast = new ForecastResult("test", series.getLastPeriod(), List.of(
                new ForecastPoint(START, 5, 5, 5),
                new ForecastPoint(LocalDate.of(2023, 4, 1), 4, 4, 4)));

        SummaryDigest digest = generator.summarize(series, Optional.of(forecast));

        assertThat(digest.contains(SummaryDigest.FORECAST_NEXT_QUARTER)).isFalse();
        assertThat(digest.contains(SummaryDigest.TOTAL_REPORTS)).isTrue();
    }

    @Test
    @DisplayName("Should call a flat series decreasing")
    void shouldCallTieDecreasing() {
        SummaryDigest digest = generator.summarize(QuarterSeries.of(START, 9, 50, 9), Optional.empty());

        assertThat(digest.get(SummaryDigest.TREND)).contains(SummaryDigest.TREND_DECREASING);
    }

    @Test
    @DisplayName("Should report zero spread for a single quarter")
    void shouldHandleSingleQuarter() {
        SummaryDigest digest = generator.summarize(QuarterSeries.of(START, 12), Optional.empty());

        assertThat(digest.getDouble(SummaryDigest.STD_QUARTERLY_REPORTS).getAsDouble()).isEqualTo(0.0);
        assertThat(digest.getDouble(SummaryDigest.AVG_QUARTERLY_REPORTS).getAsDouble()).isEqualTo(12.0);
    }

    @Test
    @DisplayName("Should return an empty digest for an empty series")
    void shouldHandleEmptySeries() {
        assertThat(generator.summarize(QuarterSeries.empty(), Optional.empty()).isEmpty()).isTrue();
    }
}
