package com.aesentinel.job;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should use defaults when no variables are set")
    void shouldUseDefaults() {
        JobConfig config = JobConfig.fromEnvironment(name -> null);

        assertThat(config.getTargetDrug()).isEqualTo("ozempic");
        assertThat(config.getDrugVariants()).containsExactly("semaglutide", "wegovy", "rybelsus");
        assertThat(config.getDataDir()).isEqualTo(Path.of("./data"));
        assertThat(config.getOutputsDir()).isEqualTo(Path.of("./outputs"));
        assertThat(config.getAnalysisConfigPath()).isEmpty();
        assertThat(config.getParallelism()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should read overrides and clean up the variant list")
    void shouldReadOverrides() {
        Map<String, String> env = Map.of(
                "TARGET_DRUG", "mounjaro",
                "DRUG_VARIANTS", " tirzepatide , zepbound,,tirzepatide",
                "DATA_DIR", "/srv/faers",
                "OUTPUTS_DIR", "/srv/out",
                "JOB_PARALLELISM", "4");

        JobConfig config = JobConfig.fromEnvironment(env::get);

        assertThat(config.getTargetDrug()).isEqualTo("mounjaro");
        assertThat(config.getDrugVariants()).containsExactly("tirzepatide", "zepbound");
        assertThat(config.getDataDir()).isEqualTo(Path.of("/srv/faers"));
        assertThat(config.getOutputsDir()).isEqualTo(Path.of("/srv/out"));
        assertThat(config.getParallelism()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should fail on a non-numeric parallelism")
    void shouldRejectNonNumericParallelism() {
        assertThatThrownBy(() -> JobConfig.fromEnvironment(Map.of("JOB_PARALLELISM", "many")::get))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("numeric");
    }

    @Test
    @DisplayName("Should validate builder values")
    void shouldValidateBuilder() {
        assertThatThrownBy(() -> new JobConfig.Builder().targetDrug(" ").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new JobConfig.Builder().drugVariants(List.of()).build().getDrugVariants()).isEmpty();
    }
}
