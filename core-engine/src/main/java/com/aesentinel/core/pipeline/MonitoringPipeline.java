package com.aesentinel.core.pipeline;

import com.aesentinel.core.compare.SeriesComparator;
import com.aesentinel.core.config.AnalysisConfig;
import com.aesentinel.core.detection.RollingZScoreDetector;
import com.aesentinel.core.detection.SafetySignalDetector;
import com.aesentinel.core.forecast.ForecastSettings;
import com.aesentinel.core.forecast.Forecaster;
import com.aesentinel.core.forecast.ForecasterFactory;
import com.aesentinel.core.forecast.InsufficientDataException;
import com.aesentinel.core.model.AnomalyRecord;
import com.aesentinel.core.model.ComparisonRow;
import com.aesentinel.core.model.ForecastResult;
import com.aesentinel.core.model.MonitoringResult;
import com.aesentinel.core.model.NormalizationResult;
import com.aesentinel.core.model.QuarterSeries;
import com.aesentinel.core.model.RawEvent;
import com.aesentinel.core.model.SignalRecord;
import com.aesentinel.core.model.SummaryDigest;
import com.aesentinel.core.normalize.SeriesNormalizer;
import com.aesentinel.core.summary.SummaryGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs the monitoring analysis for one or more products.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   raw events
 *     → SeriesNormalizer → QuarterSeries
 *     → RollingZScoreDetector | SafetySignalDetector | Forecaster   (independent)
 *     → SummaryGenerator (needs the forecast)
 *     → MonitoringResult
 * </pre>
 *
 * <p>
 * The three middle stages only read the immutable series, so they are
 * submitted to the configured {@link Executor} together. The default executor
 * runs everything on the calling thread. A series too short to forecast is
 * not a failure: the result simply has no forecast.
 * </p>
 *
 * <p>
 * Instances hold no mutable state and may be shared between threads.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(MonitoringPipeline.class);

    private static final Executor INLINE = Runnable::run;

    private final AnalysisConfig config;
    private final Forecaster forecaster;
    private final Executor executor;

    private final SeriesNormalizer normalizer = new SeriesNormalizer();
    private final RollingZScoreDetector anomalyDetector;
    private final SafetySignalDetector signalDetector;
    private final SeriesComparator comparator = new SeriesComparator();
    private final SummaryGenerator summaryGenerator = new SummaryGenerator();
    private final ForecastSettings forecastSettings;

    /**
     * Create a pipeline that runs on the calling thread with the forecaster
     * named in the configuration.
     *
     * @param config validated analysis configuration
     */
    public MonitoringPipeline(AnalysisConfig config) {
        this(config, ForecasterFactory.create(Objects.requireNonNull(config, "config must not be null")
                .getForecastModel()), INLINE);
    }

    /**
     * @param config     analysis configuration; validated here
     * @param forecaster forecasting capability
     * @param executor   executor for the independent stages and products
     * @throws IllegalStateException if the configuration is invalid
     */
    public MonitoringPipeline(AnalysisConfig config, Forecaster forecaster, Executor executor) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.forecaster = Objects.requireNonNull(forecaster, "forecaster must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        config.validate();

        this.anomalyDetector = new RollingZScoreDetector(config.getAnomalyThreshold());
        this.signalDetector = new SafetySignalDetector(config.getMinAbsoluteIncrease());
        this.forecastSettings = config.toForecastSettings();
        LOG.info("Pipeline ready: {} (threshold {}), {} (min increase {}), {} ({}, horizon {})",
                anomalyDetector.getName(), anomalyDetector.getZThreshold(),
                signalDetector.getName(), signalDetector.getMinAbsoluteIncrease(),
                forecaster.getModelName(), forecastSettings, config.getForecastHorizon());
    }

    /**
     * Run the analysis for one product.
     *
     * @param productId product identifier; must not be {@code null}
     * @param events    raw events as fetched; must not be {@code null}
     * @return the result bundle; never {@code null}
     */
    public MonitoringResult run(String productId, Collection<RawEvent> events) {
        return run(productId, events, executor);
    }

    private MonitoringResult run(String productId, Collection<RawEvent> events, Executor stageExecutor) {
        Objects.requireNonNull(productId, "productId must not be null");
        Objects.requireNonNull(events, "events must not be null");
        LOG.info("Monitoring run for '{}' with {} raw event(s)", productId, events.size());

        NormalizationResult normalized = normalizer.normalize(events);
        QuarterSeries series = normalized.getSeries();
        if (series.isEmpty()) {
            LOG.warn("No adverse event data available for '{}'", productId);
        }

        CompletableFuture<List<AnomalyRecord>> anomalies =
                CompletableFuture.supplyAsync(() -> anomalyDetector.detect(series), stageExecutor);
        CompletableFuture<List<SignalRecord>> signals =
                CompletableFuture.supplyAsync(() -> signalDetector.detect(series), stageExecutor);
        CompletableFuture<Optional<ForecastResult>> forecast =
                CompletableFuture.supplyAsync(() -> forecast(productId, series), stageExecutor);

        Optional<ForecastResult> forecastResult = join(forecast);
        LOG.debug("'{}': {} found {} record(s), {} found {} record(s)", productId,
                anomalyDetector.getName(), join(anomalies).size(), signalDetector.getName(), join(signals).size());
        SummaryDigest summary = summaryGenerator.summarize(series, forecastResult);

        MonitoringResult result = MonitoringResult.builder()
                .productId(productId)
                .series(series)
                .droppedEvents(normalized.getDroppedEvents())
                .anomalies(join(anomalies))
                .signals(join(signals))
                .forecast(forecastResult.orElse(null))
                .summary(summary)
                .build();

        LOG.info("Monitoring run for '{}' finished: {}", productId, result);
        return result;
    }

    /**
     * Run the analysis for several independent products.
     *
     * <p>
     * Products are spread over the executor; the stages of each product then
     * run on that product's worker, so a bounded pool cannot starve itself.
     * </p>
     *
     * @param eventsByProduct product id to its raw events
     * @return product id to result, in the input's iteration order
     */
    public Map<String, MonitoringResult> runAll(Map<String, ? extends Collection<RawEvent>> eventsByProduct) {
        Objects.requireNonNull(eventsByProduct, "eventsByProduct must not be null");

        Map<String, CompletableFuture<MonitoringResult>> futures = new LinkedHashMap<>();
        eventsByProduct.forEach((productId, events) -> futures.put(productId,
                CompletableFuture.supplyAsync(() -> run(productId, events, INLINE), executor)));

        Map<String, MonitoringResult> results = new LinkedHashMap<>();
        futures.forEach((productId, future) -> results.put(productId, join(future)));
        return results;
    }

    /**
     * Compare products whose series are already normalized.
     *
     * @param seriesById product id to quarterly series
     * @return one row per product with data
     */
    public List<ComparisonRow> compare(Map<String, QuarterSeries> seriesById) {
        return comparator.compare(seriesById);
    }

    private Optional<ForecastResult> forecast(String productId, QuarterSeries series) {
        try {
            return Optional.of(forecaster.fitAndForecast(series, config.getForecastHorizon(), forecastSettings));
        } catch (InsufficientDataException e) {
            LOG.info("Forecast unavailable for '{}': {} quarter(s) of data, {} required",
                    productId, e.getAvailable(), e.getRequired());
            return Optional.empty();
        }
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
