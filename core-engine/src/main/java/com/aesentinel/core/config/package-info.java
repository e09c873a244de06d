/**
 * Analysis configuration.
 *
 * <p>
 * Parameters are defined in YAML and loaded by
 * {@link com.aesentinel.core.config.AnalysisConfigLoader} into an
 * {@link com.aesentinel.core.config.AnalysisConfig}, validated on load.
 * </p>
 *
 * @since 1.0.0
 */
package com.aesentinel.core.config;
