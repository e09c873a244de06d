package com.aesentinel.core.detection;

import com.aesentinel.core.model.AnomalyRecord;
import com.aesentinel.core.model.QuarterCount;
import com.aesentinel.core.model.QuarterSeries;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Statistical outlier detector based on a trailing rolling window.
 *
 * <p>
 * For every quarter the mean and sample standard deviation of the last
 * {@value #WINDOW_SIZE} quarters, the current one included, are computed
 * (fewer at the start of the series; a single-value window has a standard
 * deviation of 0). The quarter is anomalous when
 * {@code |count - mean| / (std + }{@value #EPSILON}{@code )} exceeds the
 * threshold.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * Series shorter than {@value #MIN_SERIES_LENGTH} quarters produce no
 * anomalies.
 * </p>
 *
 * @since 1.0.0
 */
public class RollingZScoreDetector implements SeriesDetector<AnomalyRecord> {

    private static final Logger LOG = LoggerFactory.getLogger(RollingZScoreDetector.class);

    static final int WINDOW_SIZE = 4;
    static final int MIN_SERIES_LENGTH = 3;
    static final double EPSILON = 1e-10;

    private final double zThreshold;

    /**
     * @param zThreshold z-score magnitude that must be exceeded
     * @throws IllegalArgumentException if {@code zThreshold} is not positive
     */
    public RollingZScoreDetector(double zThreshold) {
        if (!(zThreshold > 0)) {
            throw new IllegalArgumentException("zThreshold must be > 0, got: " + zThreshold);
        }
        this.zThreshold = zThreshold;
    }

    @Override
    public List<AnomalyRecord> detect(QuarterSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        if (series.size() < MIN_SERIES_LENGTH) {
            LOG.trace("Series of {} quarter(s) is too short for anomaly detection", series.size());
            return Collections.emptyList();
        }

        DescriptiveStatistics window = new DescriptiveStatistics(WINDOW_SIZE);
        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (QuarterCount point : series) {
            window.addValue(point.getCount());

            double mean = window.getMean();
            double std = window.getN() > 1 ? window.getStandardDeviation() : 0;
            double z = (point.getCount() - mean) / (std + EPSILON);

            if (Math.abs(z) > zThreshold) {
                LOG.debug("Anomaly at {}: count={} mean={} std={} z={}",
                        point.getPeriod(), point.getCount(), mean, std, z);
                anomalies.add(new AnomalyRecord(point.getPeriod(), point.getCount(), mean, std, z));
            }
        }

        if (!anomalies.isEmpty()) {
            LOG.info("Detected {} anomal{} (z > {})", anomalies.size(),
                    anomalies.size() == 1 ? "y" : "ies", zThreshold);
        }
        return Collections.unmodifiableList(anomalies);
    }

    @Override
    public String getName() {
        return "rolling-z-score";
    }

    public double getZThreshold() {
        return zThreshold;
    }
}
