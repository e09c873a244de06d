package com.aesentinel.core.detection;

import com.aesentinel.core.model.QuarterSeries;
import com.aesentinel.core.model.SignalRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SafetySignalDetector}.
 */
class SafetySignalDetectorTest {

    private static final LocalDate START = LocalDate.of(2023, 1, 1);

    private final SafetySignalDetector detector = new SafetySignalDetector(10);

    @Test
    @DisplayName("Should flag a quarter that rises both absolutely and relatively")
    void shouldFlagSurge() {
        List<SignalRecord> signals = detector.detect(QuarterSeries.of(START, 5, 4, 30));

        assertThat(signals).hasSize(1);
        SignalRecord signal = signals.get(0);
        assertThat(signal.getPeriod()).isEqualTo(LocalDate.of(2023, 7, 1));
        assertThat(signal.getCount()).isEqualTo(30);
        assertThat(signal.getAbsoluteChange()).isEqualTo(26);
        assertThat(signal.getPercentChange().getAsDouble()).isCloseTo(650.0, within(1e-9));
        assertThat(signal.isZeroBase()).isFalse();
    }

    @Test
    @DisplayName("Should require both the absolute and the percent condition")
    void shouldRequireBothConditions() {
        // large absolute rise, small relative rise
        assertThat(detector.detect(QuarterSeries.of(START, 100, 140))).isEmpty();
        // large relative rise, small absolute rise
        assertThat(detector.detect(QuarterSeries.of(START, 2, 8))).isEmpty();
        // both
        assertThat(detector.detect(QuarterSeries.of(START, 20, 31))).hasSize(1);
    }

    @Test
    @DisplayName("Should treat fifty percent as not exceeding the percent threshold")
    void shouldUseStrictPercentThreshold() {
        assertThat(detector.detect(QuarterSeries.of(START, 20, 30))).isEmpty();
    }

    @Test
    @DisplayName("Should flag a rise from zero without a percent change")
    void shouldFlagRiseFromZero() {
        List<SignalRecord> signals = detector.detect(QuarterSeries.of(START, 0, 12));

        assertThat(signals).hasSize(1);
        assertThat(signals.get(0).isZeroBase()).isTrue();
        assertThat(signals.get(0).getPercentChange()).isEmpty();
        assertThat(signals.get(0).getAbsoluteChange()).isEqualTo(12);
    }

    @Test
    @DisplayName("Should not flag small rises from zero or zero to zero")
    void shouldIgnoreSmallZeroBaseChanges() {
        assertThat(detector.detect(QuarterSeries.of(START, 0, 5))).isEmpty();
        assertThat(new SafetySignalDetector(0).detect(QuarterSeries.of(START, 0, 0))).isEmpty();
    }

    @Test
    @DisplayName("Should return nothing for fewer than two quarters")
    void shouldSkipShortSeries() {
        assertThat(detector.detect(QuarterSeries.of(START, 50))).isEmpty();
        assertThat(detector.detect(QuarterSeries.empty())).isEmpty();
    }

    @Test
    @DisplayName("Should reject a negative minimum increase")
    void shouldRejectNegativeMinimum() {
        assertThatThrownBy(() -> new SafetySignalDetector(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
