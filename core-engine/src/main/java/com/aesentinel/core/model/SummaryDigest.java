package com.aesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Flat digest of named scalar metrics describing a series and its forecast.
 *
 * <p>
 * Values are {@link Number}, {@link String} or {@link java.time.LocalDate};
 * nothing is nested. A digest is built wholesale by
 * {@link com.aesentinel.core.summary.SummaryGenerator} and never patched.
 * </p>
 *
 * @since 1.0.0
 */
public final class SummaryDigest {

    public static final String TOTAL_REPORTS = "total_reports";
    public static final String AVG_QUARTERLY_REPORTS = "avg_quarterly_reports";
    public static final String STD_QUARTERLY_REPORTS = "std_quarterly_reports";
    public static final String TREND = "trend";
    public static final String RECENT_QUARTER_REPORTS = "recent_quarter_reports";
    public static final String DATA_START = "data_start";
    public static final String DATA_END = "data_end";
    public static final String FORECAST_NEXT_QUARTER = "forecast_next_quarter";
    public static final String FORECAST_LOWER_BOUND = "forecast_lower_bound";
    public static final String FORECAST_UPPER_BOUND = "forecast_upper_bound";

    public static final String TREND_INCREASING = "increasing";
    public static final String TREND_DECREASING = "decreasing";

    private static final SummaryDigest EMPTY = new SummaryDigest(new LinkedHashMap<>());

    private final Map<String, Object> metrics;

    private SummaryDigest(Map<String, Object> metrics) {
        this.metrics = Collections.unmodifiableMap(metrics);
    }

    public static SummaryDigest empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return unmodifiable, insertion-ordered view of all metrics
     */
    @JsonValue
    public Map<String, Object> getMetrics() {
        return metrics;
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(metrics.get(key));
    }

    /**
     * @param key metric name
     * @return the metric as a double, or empty if absent or not numeric
     */
    public OptionalDouble getDouble(String key) {
        Object value = metrics.get(key);
        return value instanceof Number n ? OptionalDouble.of(n.doubleValue()) : OptionalDouble.empty();
    }

    public boolean contains(String key) {
        return metrics.containsKey(key);
    }

    public boolean isEmpty() {
        return metrics.isEmpty();
    }

    public int size() {
        return metrics.size();
    }

    /**
     * Fluent builder. Keys keep the order in which they are put.
     */
    public static class Builder {
        private final Map<String, Object> metrics = new LinkedHashMap<>();

        public Builder put(String key, Object value) {
            Objects.requireNonNull(key, "metric key must not be null");
            Objects.requireNonNull(value, "metric value must not be null for key '" + key + "'");
            metrics.put(key, value);
            return this;
        }

        public SummaryDigest build() {
            return new SummaryDigest(new LinkedHashMap<>(metrics));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SummaryDigest that))
            return false;
        return metrics.equals(that.metrics);
    }

    @Override
    public int hashCode() {
        return metrics.hashCode();
    }

    @Override
    public String toString() {
        return "SummaryDigest" + metrics;
    }
}
