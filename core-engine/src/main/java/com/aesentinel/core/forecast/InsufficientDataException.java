package com.aesentinel.core.forecast;

/**
 * Thrown when a series is too short to fit a forecasting model.
 *
 * <p>
 * Recoverable: callers continue the run without a forecast.
 * </p>
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int available;
    private final int required;

    public InsufficientDataException(int available, int required) {
        super("Forecasting requires at least " + required + " quarters, got " + available);
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
