package com.aesentinel.core.config;

import com.aesentinel.core.forecast.ForecastSettings;
import com.aesentinel.core.forecast.ForecasterFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Run-scoped analysis parameters.
 *
 * <p>
 * Expected YAML structure (every key is optional, defaults shown):
 * </p>
 *
 * <pre>
 * anomalyThreshold: 2.0
 * minAbsoluteIncrease: 10
 * forecastHorizon: 4
 * changepointSensitivity: 0.05
 * confidence: 0.95
 * forecastModel: seasonal-trend
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisConfig {

    public static final double DEFAULT_ANOMALY_THRESHOLD = 2.0;
    public static final int DEFAULT_MIN_ABSOLUTE_INCREASE = 10;
    public static final int DEFAULT_FORECAST_HORIZON = 4;
    public static final double DEFAULT_CHANGEPOINT_SENSITIVITY = 0.05;
    public static final double DEFAULT_CONFIDENCE = 0.95;

    /** z-score magnitude above which a quarter is anomalous. */
    private double anomalyThreshold = DEFAULT_ANOMALY_THRESHOLD;

    /** Minimum quarter-over-quarter report increase for a safety signal. */
    private int minAbsoluteIncrease = DEFAULT_MIN_ABSOLUTE_INCREASE;

    /** Number of future quarters to forecast. */
    private int forecastHorizon = DEFAULT_FORECAST_HORIZON;

    /** Trend flexibility of the forecaster, in (0, 1]. */
    private double changepointSensitivity = DEFAULT_CHANGEPOINT_SENSITIVITY;

    /** Prediction interval coverage, in (0, 1). */
    private double confidence = DEFAULT_CONFIDENCE;

    /** Forecaster name understood by {@link ForecasterFactory}. */
    private String forecastModel = ForecasterFactory.SEASONAL_TREND;

    /**
     * @return a configuration holding the documented defaults
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig();
    }

    /**
     * Validate every parameter, collecting all violations.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!(anomalyThreshold > 0)) {
            errors.add("'anomalyThreshold' must be > 0, got: " + anomalyThreshold);
        }
        if (minAbsoluteIncrease < 0) {
            errors.add("'minAbsoluteIncrease' must be >= 0, got: " + minAbsoluteIncrease);
        }
        if (forecastHorizon < 0) {
            errors.add("'forecastHorizon' must be >= 0, got: " + forecastHorizon);
        }
        if (!(changepointSensitivity > 0 && changepointSensitivity <= 1)) {
            errors.add("'changepointSensitivity' must be in (0, 1], got: " + changepointSensitivity);
        }
        if (!(confidence > 0 && confidence < 1)) {
            errors.add("'confidence' must be in (0, 1), got: " + confidence);
        }
        if (forecastModel == null || forecastModel.isBlank()) {
            errors.add("'forecastModel' is required");
        } else if (!ForecasterFactory.isSupported(forecastModel)) {
            errors.add("Unknown forecastModel: '" + forecastModel + "'. Supported: "
                    + String.join(", ", ForecasterFactory.SUPPORTED_MODELS));
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid AnalysisConfig: " + String.join("; ", errors));
        }
    }

    /**
     * @return forecaster settings derived from this configuration
     */
    public ForecastSettings toForecastSettings() {
        return new ForecastSettings(changepointSensitivity, confidence);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required by SnakeYAML)
    // ---------------------------------------------------------------

    public double getAnomalyThreshold() {
        return anomalyThreshold;
    }

    public void setAnomalyThreshold(double anomalyThreshold) {
        this.anomalyThreshold = anomalyThreshold;
    }

    public int getMinAbsoluteIncrease() {
        return minAbsoluteIncrease;
    }

    public void setMinAbsoluteIncrease(int minAbsoluteIncrease) {
        this.minAbsoluteIncrease = minAbsoluteIncrease;
    }

    public int getForecastHorizon() {
        return forecastHorizon;
    }

    public void setForecastHorizon(int forecastHorizon) {
        this.forecastHorizon = forecastHorizon;
    }

    public double getChangepointSensitivity() {
        return changepointSensitivity;
    }

    public void setChangepointSensitivity(double changepointSensitivity) {
        this.changepointSensitivity = changepointSensitivity;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public String getForecastModel() {
        return forecastModel;
    }

    public void setForecastModel(String forecastModel) {
        this.forecastModel = forecastModel;
    }

    @Override
    public String toString() {
        return "AnalysisConfig{" +
                "anomalyThreshold=" + anomalyThreshold +
                ", minAbsoluteIncrease=" + minAbsoluteIncrease +
                ", forecastHorizon=" + forecastHorizon +
                ", changepointSensitivity=" + changepointSensitivity +
                ", confidence=" + confidence +
                ", forecastModel='" + forecastModel + '\'' +
                '}';
    }
}
