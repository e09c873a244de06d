package com.aesentinel.core.config;

import com.aesentinel.core.forecast.ForecasterFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalysisConfigLoader} and {@link AnalysisConfig}.
 */
class AnalysisConfigLoaderTest {

    @Test
    @DisplayName("Should load test config from classpath")
    void shouldLoadFromClasspath() {
        AnalysisConfig config = AnalysisConfigLoader.fromClasspath("test-analysis.yml");

        assertThat(config.getAnomalyThreshold()).isEqualTo(1.2);
        assertThat(config.getMinAbsoluteIncrease()).isEqualTo(5);
        assertThat(config.getForecastHorizon()).isEqualTo(2);
        assertThat(config.getChangepointSensitivity()).isEqualTo(0.2);
        assertThat(config.getConfidence()).isEqualTo(0.8);
        assertThat(config.getForecastModel()).isEqualTo(ForecasterFactory.LINEAR_TREND);
    }

    @Test
    @DisplayName("Should ship defaults in the bundled config")
    void shouldLoadBundledDefaults() {
        AnalysisConfig config = AnalysisConfigLoader.fromClasspath(AnalysisConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getAnomalyThreshold()).isEqualTo(AnalysisConfig.DEFAULT_ANOMALY_THRESHOLD);
        assertThat(config.getMinAbsoluteIncrease()).isEqualTo(AnalysisConfig.DEFAULT_MIN_ABSOLUTE_INCREASE);
        assertThat(config.getForecastHorizon()).isEqualTo(AnalysisConfig.DEFAULT_FORECAST_HORIZON);
        assertThat(config.getForecastModel()).isEqualTo(ForecasterFactory.SEASONAL_TREND);
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument() {
        AnalysisConfig config = AnalysisConfigLoader.fromClasspath("test-empty-analysis.yml");

        assertThat(config.getConfidence()).isEqualTo(AnalysisConfig.DEFAULT_CONFIDENCE);
    }

    @Test
    @DisplayName("Should report every invalid parameter at once")
    void shouldCollectAllErrors() {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromClasspath("test-invalid-analysis.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("anomalyThreshold")
                .hasMessageContaining("confidence")
                .hasMessageContaining("arima");
    }

    @Test
    @DisplayName("Should wrap malformed YAML")
    void shouldRejectMalformedYaml() {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromClasspath("test-malformed-analysis.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should load a config file from disk")
    void shouldLoadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("analysis.yml");
        Files.writeString(file, "minAbsoluteIncrease: 25\nforecastHorizon: 8\n");

        AnalysisConfig config = AnalysisConfigLoader.fromFile(file.toString());

        assertThat(config.getMinAbsoluteIncrease()).isEqualTo(25);
        assertThat(config.getForecastHorizon()).isEqualTo(8);
        assertThat(config.getAnomalyThreshold()).isEqualTo(AnalysisConfig.DEFAULT_ANOMALY_THRESHOLD);
    }

    @Test
    @DisplayName("Should throw when the config file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromFile(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should convert to forecast settings")
    void shouldConvertToForecastSettings() {
        AnalysisConfig config = AnalysisConfig.defaults();
        config.setChangepointSensitivity(0.3);
        config.setConfidence(0.9);

        assertThat(config.toForecastSettings().getChangepointSensitivity()).isEqualTo(0.3);
        assertThat(config.toForecastSettings().getConfidence()).isEqualTo(0.9);
    }
}
