package com.aesentinel.job;

import com.aesentinel.core.model.ComparisonRow;
import com.aesentinel.core.model.MonitoringResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Writes result bundles and the comparison table as JSON.
 *
 * <p>
 * Dates are written as ISO strings. The output directory is created on first
 * use.
 * </p>
 */
public class ResultWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ResultWriter.class);

    static final String ANALYSIS_SUFFIX = "_analysis.json";
    static final String COMPARISON_FILE = "variant_comparison.json";

    private final Path outputsDir;
    private final ObjectMapper mapper = JsonMappers.create();

    public ResultWriter(Path outputsDir) {
        this.outputsDir = Objects.requireNonNull(outputsDir, "outputsDir must not be null");
    }

    /**
     * @param result the product's result bundle
     * @return path of the written file
     * @throws UncheckedIOException if the file cannot be written
     */
    public Path writeResult(MonitoringResult result) {
        Objects.requireNonNull(result, "result must not be null");
        return write(outputsDir.resolve(result.getProductId() + ANALYSIS_SUFFIX), result);
    }

    /**
     * @param rows comparison rows
     * @return path of the written file
     * @throws UncheckedIOException if the file cannot be written
     */
    public Path writeComparison(List<ComparisonRow> rows) {
        Objects.requireNonNull(rows, "rows must not be null");
        return write(outputsDir.resolve(COMPARISON_FILE), rows);
    }

    private Path write(Path target, Object value) {
        try {
            Files.createDirectories(outputsDir);
            mapper.writeValue(target.toFile(), value);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
        LOG.info("Saved {}", target);
        return target;
    }
}
