package com.aesentinel.job;

import com.aesentinel.core.config.AnalysisConfig;
import com.aesentinel.core.model.MonitoringResult;
import com.aesentinel.core.model.RawEvent;
import com.aesentinel.core.pipeline.MonitoringPipeline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LatestResults}.
 */
class LatestResultsTest {

    @Test
    @DisplayName("Should have no snapshot before the first run")
    void shouldStartEmpty() {
        assertThat(new LatestResults().current()).isEmpty();
    }

    @Test
    @DisplayName("Should replace the snapshot on every publish")
    void shouldPublishSnapshots() {
        MonitoringPipeline pipeline = new MonitoringPipeline(AnalysisConfig.defaults());
        Map<String, MonitoringResult> results = new LinkedHashMap<>();
        results.put("ozempic", pipeline.run("ozempic", List.of(
                RawEvent.of(LocalDate.of(2023, 1, 2), 4),
                RawEvent.of(LocalDate.of(2023, 4, 2), 40))));
        results.put("wegovy", pipeline.run("wegovy", List.of()));
        LatestResults latest = new LatestResults();

        latest.publish(Map.of(), Instant.parse("2024-01-01T00:00:00Z"));
        latest.publish(results, Instant.parse("2024-02-01T00:00:00Z"));

        LatestResults.Snapshot snapshot = latest.current().orElseThrow();
        assertThat(snapshot.getLastUpdate()).isEqualTo(Instant.parse("2024-02-01T00:00:00Z"));
        assertThat(snapshot.getProducts()).containsOnlyKeys("ozempic", "wegovy");
        LatestResults.ProductStatus ozempic = snapshot.get("ozempic").orElseThrow();
        assertThat(ozempic.getQuarters()).isEqualTo(2);
        assertThat(ozempic.getSignalsDetected()).isEqualTo(1);
        assertThat(ozempic.getAnomaliesDetected()).isZero();
        assertThat(snapshot.get("wegovy").orElseThrow().getSummary().isEmpty()).isTrue();
        assertThat(snapshot.get("rybelsus")).isEmpty();
    }
}
