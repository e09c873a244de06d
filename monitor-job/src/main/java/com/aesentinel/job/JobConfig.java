package com.aesentinel.job;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Typed, immutable configuration for the monitoring job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job can be driven from a cron entry, a container {@code -e} flag or a
 * shell environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    private final String targetDrug;
    private final List<String> drugVariants;
    private final Path dataDir;
    private final Path outputsDir;
    private final String analysisConfigPath;
    private final int parallelism;

    private JobConfig(Builder b) {
        this.targetDrug = b.targetDrug.trim();
        this.drugVariants = b.drugVariants.stream()
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .distinct()
                .toList();
        this.dataDir = b.dataDir;
        this.outputsDir = b.outputsDir;
        this.analysisConfigPath = b.analysisConfigPath;
        this.parallelism = b.parallelism;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Build a {@link JobConfig} from an arbitrary variable lookup.
     *
     * @param lookup returns the value of a variable, or {@code null}
     * @return fully populated configuration
     */
    static JobConfig fromEnvironment(UnaryOperator<String> lookup) {
        try {
            return new Builder()
                    .targetDrug(env(lookup, "TARGET_DRUG", "ozempic"))
                    .drugVariants(Arrays.asList(env(lookup, "DRUG_VARIANTS", "semaglutide,wegovy,rybelsus").split(",")))
                    .dataDir(Path.of(env(lookup, "DATA_DIR", "./data")))
                    .outputsDir(Path.of(env(lookup, "OUTPUTS_DIR", "./outputs")))
                    .analysisConfigPath(env(lookup, "ANALYSIS_CONFIG_PATH", ""))
                    .parallelism(Integer.parseInt(env(lookup, "JOB_PARALLELISM", "1")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getTargetDrug() {
        return targetDrug;
    }

    public List<String> getDrugVariants() {
        return drugVariants;
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Path getOutputsDir() {
        return outputsDir;
    }

    public String getAnalysisConfigPath() {
        return analysisConfigPath;
    }

    public int getParallelism() {
        return parallelism;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (non-blank target drug, parallelism &gt; 0, directories set).
     * </p>
     */
    public static class Builder {
        private String targetDrug = "ozempic";
        private List<String> drugVariants = List.of("semaglutide", "wegovy", "rybelsus");
        private Path dataDir = Path.of("./data");
        private Path outputsDir = Path.of("./outputs");
        private String analysisConfigPath = "";
        private int parallelism = 1;

        public Builder targetDrug(String v) {
            this.targetDrug = v;
            return this;
        }

        public Builder drugVariants(List<String> v) {
            this.drugVariants = v;
            return this;
        }

        public Builder dataDir(Path v) {
            this.dataDir = v;
            return this;
        }

        public Builder outputsDir(Path v) {
            this.outputsDir = v;
            return this;
        }

        public Builder analysisConfigPath(String v) {
            this.analysisConfigPath = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            if (targetDrug == null || targetDrug.isBlank()) {
                throw new IllegalArgumentException("targetDrug must not be null or blank");
            }
            Objects.requireNonNull(drugVariants, "drugVariants required");
            Objects.requireNonNull(dataDir, "dataDir required");
            Objects.requireNonNull(outputsDir, "outputsDir required");
            if (analysisConfigPath == null) {
                analysisConfigPath = "";
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            return new JobConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(UnaryOperator<String> lookup, String name, String defaultValue) {
        String value = lookup.apply(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "targetDrug='" + targetDrug + '\'' +
                ", drugVariants=" + drugVariants +
                ", dataDir=" + dataDir +
                ", outputsDir=" + outputsDir +
                ", analysisConfigPath='" + analysisConfigPath + '\'' +
                ", parallelism=" + parallelism +
                '}';
    }
}
