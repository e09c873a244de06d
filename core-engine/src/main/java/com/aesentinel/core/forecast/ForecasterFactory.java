package com.aesentinel.core.forecast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Creates {@link Forecaster} instances by model name.
 *
 * <p>
 * This is the single point of extension when adding a new estimator:
 * register its name here and in {@link #SUPPORTED_MODELS}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecasterFactory {

    private static final Logger LOG = LoggerFactory.getLogger(ForecasterFactory.class);

    public static final String SEASONAL_TREND = "seasonal-trend";
    public static final String LINEAR_TREND = "linear-trend";

    public static final List<String> SUPPORTED_MODELS = List.of(SEASONAL_TREND, LINEAR_TREND);

    private ForecasterFactory() {
        // utility class: not instantiable
    }

    /**
     * Create the forecaster registered under {@code model}.
     *
     * @param model model name, case-insensitive; must not be {@code null}
     * @return a new forecaster
     * @throws NullPointerException     if {@code model} is {@code null}
     * @throws IllegalArgumentException if the model name is unknown
     */
    public static Forecaster create(String model) {
        Objects.requireNonNull(model, "Forecast model must not be null");
        Forecaster forecaster = switch (model.trim().toLowerCase(Locale.ROOT)) {
            case SEASONAL_TREND -> new SeasonalTrendForecaster();
            case LINEAR_TREND -> new LinearTrendForecaster();
            default -> throw new IllegalArgumentException(
                    "Unknown forecast model: '" + model + "'. Supported models: "
                            + String.join(", ", SUPPORTED_MODELS));
        };
        LOG.debug("Created forecaster {}", forecaster.getModelName());
        return forecaster;
    }

    /**
     * @param model model name, case-insensitive
     * @return {@code true} if {@link #create(String)} accepts {@code model}
     */
    public static boolean isSupported(String model) {
        return model != null && SUPPORTED_MODELS.contains(model.trim().toLowerCase(Locale.ROOT));
    }
}
