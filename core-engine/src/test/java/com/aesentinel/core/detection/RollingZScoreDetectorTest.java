package com.aesentinel.core.detection;

import com.aesentinel.core.model.AnomalyRecord;
import com.aesentinel.core.model.QuarterSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RollingZScoreDetector}.
 */
class RollingZScoreDetectorTest {

    private static final LocalDate START = LocalDate.of(2022, 1, 1);

    @Test
    @DisplayName("Should flag a jump after a flat stretch")
    void shouldFlagJump() {
        RollingZScoreDetector detector = new RollingZScoreDetector(1.0);

        List<AnomalyRecord> anomalies = detector.detect(QuarterSeries.of(START, 10, 10, 10, 40));

        assertThat(anomalies).hasSize(1);
        AnomalyRecord record = anomalies.get(0);
        assertThat(record.getPeriod()).isEqualTo(LocalDate.of(2022, 10, 1));
        assertThat(record.getCount()).isEqualTo(40);
        assertThat(record.getRollingMean()).isCloseTo(17.5, within(1e-9));
        assertThat(record.getRollingStd()).isCloseTo(15.0, within(1e-9));
        assertThat(record.getZScore()).isCloseTo(1.5, within(1e-6));
    }

    @Test
    @DisplayName("Should flag drops with a negative z-score")
    void shouldFlagDrops() {
        RollingZScoreDetector detector = new RollingZScoreDetector(1.0);

        List<AnomalyRecord> anomalies = detector.detect(QuarterSeries.of(START, 40, 40, 40, 10));

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getZScore()).isCloseTo(-1.5, within(1e-6));
    }

    @Test
    @DisplayName("Should not flag anything on a window of four with the default threshold")
    void shouldNotFlagWithDefaultThreshold() {
        // a trailing window of four bounds |z| by 1.5
        RollingZScoreDetector detector = new RollingZScoreDetector(2.0);

        assertThat(detector.detect(QuarterSeries.of(START, 10, 10, 10, 400, 10, 10, 10, 900))).isEmpty();
    }

    @Test
    @DisplayName("Should not flag a constant series")
    void shouldIgnoreConstantSeries() {
        RollingZScoreDetector detector = new RollingZScoreDetector(0.1);

        assertThat(detector.detect(QuarterSeries.of(START, 7, 7, 7, 7, 7))).isEmpty();
    }

    @Test
    @DisplayName("Should return nothing for series shorter than three quarters")
    void shouldSkipShortSeries() {
        RollingZScoreDetector detector = new RollingZScoreDetector(0.1);

        assertThat(detector.detect(QuarterSeries.of(START, 1, 100))).isEmpty();
        assertThat(detector.detect(QuarterSeries.empty())).isEmpty();
    }

    @Test
    @DisplayName("Should flag a subset of the lower threshold's anomalies when the threshold rises")
    void shouldBeMonotoneInThreshold() {
        QuarterSeries series = QuarterSeries.of(START, 5, 20, 3, 40, 8, 50, 2, 60, 15, 15, 90, 1);
        double[] thresholds = {0.25, 0.5, 0.8, 1.0, 1.2, 1.4, 1.49};

        Set<LocalDate> previous = null;
        for (double threshold : thresholds) {
            Set<LocalDate> flagged = new RollingZScoreDetector(threshold).detect(series).stream()
                    .map(AnomalyRecord::getPeriod)
                    .collect(Collectors.toSet());
            if (previous != null) {
                assertThat(previous).containsAll(flagged);
            }
            previous = flagged;
        }
    }

    @Test
    @DisplayName("Should reject a non-positive threshold")
    void shouldRejectInvalidThreshold() {
        assertThatThrownBy(() -> new RollingZScoreDetector(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RollingZScoreDetector(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
