package com.aesentinel.job;

import com.aesentinel.core.model.MonitoringResult;
import com.aesentinel.core.model.SummaryDigest;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder for the outcome of the most recent successful run.
 *
 * <p>
 * The snapshot is replaced wholesale by {@link #publish(Map, Instant)} and is
 * read-only in between, so readers never observe a half-updated run.
 * </p>
 */
public class LatestResults {

    private final AtomicReference<Snapshot> current = new AtomicReference<>();

    /**
     * Replace the current snapshot.
     *
     * @param results   per-product results of the run that just finished
     * @param updatedAt completion time of the run
     * @return the published snapshot
     */
    public Snapshot publish(Map<String, MonitoringResult> results, Instant updatedAt) {
        Snapshot snapshot = Snapshot.of(results, updatedAt);
        current.set(snapshot);
        return snapshot;
    }

    /**
     * @return the latest snapshot, or empty before the first run completes
     */
    public Optional<Snapshot> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Immutable view of one run.
     */
    public static final class Snapshot {
        private final Instant lastUpdate;
        private final Map<String, ProductStatus> products;

        private Snapshot(Instant lastUpdate, Map<String, ProductStatus> products) {
            this.lastUpdate = lastUpdate;
            this.products = Collections.unmodifiableMap(products);
        }

        static Snapshot of(Map<String, MonitoringResult> results, Instant updatedAt) {
            Objects.requireNonNull(results, "results must not be null");
            Objects.requireNonNull(updatedAt, "updatedAt must not be null");
            Map<String, ProductStatus> products = new LinkedHashMap<>();
            results.forEach((id, result) -> products.put(id, new ProductStatus(
                    result.getSeries().size(),
                    result.getAnomalies().size(),
                    result.getSignals().size(),
                    result.getSummary())));
            return new Snapshot(updatedAt, products);
        }

        public Instant getLastUpdate() {
            return lastUpdate;
        }

        public Map<String, ProductStatus> getProducts() {
            return products;
        }

        public Optional<ProductStatus> get(String productId) {
            return Optional.ofNullable(products.get(productId));
        }
    }

    /**
     * Per-product headline counts.
     */
    public static final class ProductStatus {
        private final int quarters;
        private final int anomaliesDetected;
        private final int signalsDetected;
        private final SummaryDigest summary;

        ProductStatus(int quarters, int anomaliesDetected, int signalsDetected, SummaryDigest summary) {
            this.quarters = quarters;
            this.anomaliesDetected = anomaliesDetected;
            this.signalsDetected = signalsDetected;
            this.summary = summary;
        }

        public int getQuarters() {
            return quarters;
        }

        public int getAnomaliesDetected() {
            return anomaliesDetected;
        }

        public int getSignalsDetected() {
            return signalsDetected;
        }

        public SummaryDigest getSummary() {
            return summary;
        }
    }
}
