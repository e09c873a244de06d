package com.aesentinel.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result bundle of one monitoring run for one product.
 *
 * <p>
 * Handed verbatim to the caching, rendering and persistence collaborators.
 * The forecast is absent when the series was too short to fit a model.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code productId}, {@code series} and
 * {@code summary} are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitoringResult {

    private final String productId;
    private final QuarterSeries series;
    private final int droppedEvents;
    private final List<AnomalyRecord> anomalies;
    private final List<SignalRecord> signals;
    private final ForecastResult forecast;
    private final SummaryDigest summary;

    private MonitoringResult(Builder builder) {
        this.productId = Objects.requireNonNull(builder.productId, "productId must not be null");
        this.series = Objects.requireNonNull(builder.series, "series must not be null");
        this.summary = Objects.requireNonNull(builder.summary, "summary must not be null");
        this.droppedEvents = builder.droppedEvents;
        this.anomalies = builder.anomalies != null ? List.copyOf(builder.anomalies) : Collections.emptyList();
        this.signals = builder.signals != null ? List.copyOf(builder.signals) : Collections.emptyList();
        this.forecast = builder.forecast;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getProductId() {
        return productId;
    }

    public QuarterSeries getSeries() {
        return series;
    }

    public int getDroppedEvents() {
        return droppedEvents;
    }

    public List<AnomalyRecord> getAnomalies() {
        return anomalies;
    }

    public List<SignalRecord> getSignals() {
        return signals;
    }

    public Optional<ForecastResult> getForecast() {
        return Optional.ofNullable(forecast);
    }

    public SummaryDigest getSummary() {
        return summary;
    }

    /**
     * @return {@code true} if the run had no quarterly data to analyse
     */
    public boolean hasNoData() {
        return series.isEmpty();
    }

    /**
     * Fluent builder for {@link MonitoringResult}.
     */
    public static class Builder {
        private String productId;
        private QuarterSeries series;
        private int droppedEvents;
        private List<AnomalyRecord> anomalies;
        private List<SignalRecord> signals;
        private ForecastResult forecast;
        private SummaryDigest summary;

        public Builder productId(String productId) {
            this.productId = productId;
            return this;
        }

        public Builder series(QuarterSeries series) {
            this.series = series;
            return this;
        }

        public Builder droppedEvents(int droppedEvents) {
            this.droppedEvents = droppedEvents;
            return this;
        }

        public Builder anomalies(List<AnomalyRecord> anomalies) {
            this.anomalies = anomalies;
            return this;
        }

        public Builder signals(List<SignalRecord> signals) {
            this.signals = signals;
            return this;
        }

        public Builder forecast(ForecastResult forecast) {
            this.forecast = forecast;
            return this;
        }

        public Builder summary(SummaryDigest summary) {
            this.summary = summary;
            return this;
        }

        /**
         * @return a new {@link MonitoringResult}
         * @throws NullPointerException if a required field is missing
         */
        public MonitoringResult build() {
            return new MonitoringResult(this);
        }
    }

    @Override
    public String toString() {
        return "MonitoringResult{productId='" + productId + '\'' +
                ", quarters=" + series.size() +
                ", droppedEvents=" + droppedEvents +
                ", anomalies=" + anomalies.size() +
                ", signals=" + signals.size() +
                ", forecast=" + (forecast != null ? forecast.getModel() : "none") +
                '}';
    }
}
