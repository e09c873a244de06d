package com.aesentinel.job;

import com.aesentinel.core.config.AnalysisConfig;
import com.aesentinel.core.config.AnalysisConfigLoader;
import com.aesentinel.core.forecast.ForecasterFactory;
import com.aesentinel.core.model.ComparisonRow;
import com.aesentinel.core.model.MonitoringResult;
import com.aesentinel.core.model.QuarterSeries;
import com.aesentinel.core.model.RawEvent;
import com.aesentinel.core.pipeline.MonitoringPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point for the adverse-event monitoring job.
 *
 * <h3>Run</h3>
 *
 * <pre>
 *   data/&lt;product&gt;_adverse_events.json   (target drug + variants)
 *     → RawEventReader
 *     → MonitoringPipeline.runAll
 *     → outputs/&lt;product&gt;_analysis.json
 *     → MonitoringPipeline.compare (variants with data)
 *     → outputs/variant_comparison.json
 *     → LatestResults snapshot
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Paths and products come from {@link JobConfig}; analysis parameters from
 * {@link AnalysisConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitoringJob {

    private static final Logger LOG = LoggerFactory.getLogger(MonitoringJob.class);

    private final JobConfig config;
    private final MonitoringPipeline pipeline;
    private final RawEventReader reader;
    private final ResultWriter writer;
    private final LatestResults latestResults;
    private final Clock clock;

    public MonitoringJob(JobConfig config, MonitoringPipeline pipeline, LatestResults latestResults, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.latestResults = Objects.requireNonNull(latestResults, "latestResults must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.reader = new RawEventReader(config.getDataDir());
        this.writer = new ResultWriter(config.getOutputsDir());
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting adverse event monitoring with config: {}", config);
        AnalysisConfig analysisConfig = loadAnalysisConfig(config);

        // 2. Run
        ExecutorService executor = Executors.newFixedThreadPool(config.getParallelism(), new WorkerThreadFactory());
        try {
            MonitoringPipeline pipeline = new MonitoringPipeline(analysisConfig,
                    ForecasterFactory.create(analysisConfig.getForecastModel()), executor);
            new MonitoringJob(config, pipeline, new LatestResults(), Clock.systemUTC()).runOnce();
        } finally {
            executor.shutdown();
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Worker pool did not terminate within 30 seconds");
                executor.shutdownNow();
            }
        }
    }

    /**
     * Run one monitoring pass over the target drug and its variants.
     *
     * @return the snapshot published for this run
     */
    public LatestResults.Snapshot runOnce() {
        Set<String> products = new LinkedHashSet<>();
        products.add(config.getTargetDrug());
        products.addAll(config.getDrugVariants());

        Map<String, List<RawEvent>> events = new LinkedHashMap<>();
        for (String product : products) {
            events.put(product, reader.read(product));
        }

        Map<String, MonitoringResult> results = pipeline.runAll(events);
        results.values().forEach(this::persist);

        logTargetSummary(results.get(config.getTargetDrug()));
        compareVariants(results);

        LatestResults.Snapshot snapshot = latestResults.publish(results, clock.instant());
        LOG.info("Monitoring complete for {} product(s) at {}", results.size(), snapshot.getLastUpdate());
        return snapshot;
    }

    private void persist(MonitoringResult result) {
        if (result.hasNoData()) {
            LOG.warn("No adverse event data available for '{}', skipping output", result.getProductId());
            return;
        }
        writer.writeResult(result);
    }

    private void compareVariants(Map<String, MonitoringResult> results) {
        Map<String, QuarterSeries> variantSeries = new LinkedHashMap<>();
        for (String variant : config.getDrugVariants()) {
            MonitoringResult result = results.get(variant);
            if (result != null && !result.hasNoData()) {
                variantSeries.put(variant, result.getSeries());
            }
        }
        if (variantSeries.isEmpty()) {
            LOG.info("No variant data to compare");
            return;
        }
        List<ComparisonRow> rows = pipeline.compare(variantSeries);
        rows.forEach(row -> LOG.info("Variant {}", row));
        writer.writeComparison(rows);
    }

    private static void logTargetSummary(MonitoringResult result) {
        if (result == null || result.hasNoData()) {
            return;
        }
        result.getAnomalies().forEach(a -> LOG.info("Anomaly: {}", a));
        result.getSignals().forEach(s -> LOG.info("Safety signal: {}", s));
        result.getSummary().getMetrics().forEach((key, value) -> LOG.info("  {}: {}", key, value));
    }

    private static AnalysisConfig loadAnalysisConfig(JobConfig config) {
        String path = config.getAnalysisConfigPath();
        if (path != null && !path.isBlank()) {
            return AnalysisConfigLoader.fromFile(path);
        }
        return AnalysisConfigLoader.load();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "monitor-worker-" + sequence.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
