package com.aesentinel.job;

import com.aesentinel.core.config.AnalysisConfig;
import com.aesentinel.core.pipeline.MonitoringPipeline;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MonitoringJob}.
 */
class MonitoringJobTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @TempDir
    Path root;

    @Test
    @DisplayName("Should analyse, persist and publish every product with data")
    void shouldRunOnce() throws Exception {
        Path dataDir = Files.createDirectories(root.resolve("data"));
        Path outputsDir = root.resolve("outputs");
        Files.writeString(dataDir.resolve("ozempic_adverse_events.json"),
                "{\"results\":[{\"time\":\"20230115\",\"count\":3},{\"time\":\"20230220\",\"count\":2},"
                        + "{\"time\":\"20230410\",\"count\":4},{\"time\":\"20230701\",\"count\":30}]}");
        Files.writeString(dataDir.resolve("semaglutide_adverse_events.json"),
                "[{\"time\":\"20230105\",\"count\":10},{\"time\":\"20230405\",\"count\":20},"
                        + "{\"time\":\"20230705\",\"count\":5}]");

        JobConfig config = new JobConfig.Builder()
                .targetDrug("ozempic")
                .drugVariants(List.of("semaglutide", "wegovy"))
                .dataDir(dataDir)
                .outputsDir(outputsDir)
                .build();
        LatestResults latest = new LatestResults();
        MonitoringJob job = new MonitoringJob(config, new MonitoringPipeline(AnalysisConfig.defaults()),
                latest, Clock.fixed(NOW, ZoneOffset.UTC));

        LatestResults.Snapshot snapshot = job.runOnce();

        assertThat(snapshot.getLastUpdate()).isEqualTo(NOW);
        assertThat(snapshot.getProducts()).containsOnlyKeys("ozempic", "semaglutide", "wegovy");
        assertThat(snapshot.get("ozempic").orElseThrow().getSignalsDetected()).isEqualTo(1);
        assertThat(latest.current()).contains(snapshot);

        assertThat(outputsDir.resolve("ozempic_analysis.json")).exists();
        assertThat(outputsDir.resolve("semaglutide_analysis.json")).exists();
        assertThat(outputsDir.resolve("wegovy_analysis.json")).doesNotExist();

        JsonNode comparison = JsonMappers.create().readTree(outputsDir.resolve("variant_comparison.json").toFile());
        assertThat(comparison).hasSize(1);
        assertThat(comparison.get(0).get("seriesId").asText()).isEqualTo("semaglutide");
        assertThat(comparison.get(0).get("peakCount").asLong()).isEqualTo(20);
    }

    @Test
    @DisplayName("Should complete without output when no product has data")
    void shouldHandleNoData() {
        Path outputsDir = root.resolve("outputs");
        JobConfig config = new JobConfig.Builder()
                .dataDir(root.resolve("empty"))
                .outputsDir(outputsDir)
                .build();
        MonitoringJob job = new MonitoringJob(config, new MonitoringPipeline(AnalysisConfig.defaults()),
                new LatestResults(), Clock.fixed(NOW, ZoneOffset.UTC));

        LatestResults.Snapshot snapshot = job.runOnce();

        assertThat(snapshot.getProducts()).hasSize(4);
        assertThat(outputsDir).doesNotExist();
    }
}
