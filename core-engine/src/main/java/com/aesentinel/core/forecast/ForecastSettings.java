package com.aesentinel.core.forecast;

/**
 * Forecaster tuning knobs.
 *
 * @since 1.0.0
 */
public final class ForecastSettings {

    private final double changepointSensitivity;
    private final double confidence;

    /**
     * @param changepointSensitivity trend flexibility, in (0, 1]
     * @param confidence             prediction interval coverage, in (0, 1)
     * @throws IllegalArgumentException if either value is out of range
     */
    public ForecastSettings(double changepointSensitivity, double confidence) {
        if (!(changepointSensitivity > 0 && changepointSensitivity <= 1)) {
            throw new IllegalArgumentException(
                    "changepointSensitivity must be in (0, 1], got: " + changepointSensitivity);
        }
        if (!(confidence > 0 && confidence < 1)) {
            throw new IllegalArgumentException("confidence must be in (0, 1), got: " + confidence);
        }
        this.changepointSensitivity = changepointSensitivity;
        this.confidence = confidence;
    }

    public double getChangepointSensitivity() {
        return changepointSensitivity;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return "ForecastSettings{changepointSensitivity=" + changepointSensitivity
                + ", confidence=" + confidence + '}';
    }
}
