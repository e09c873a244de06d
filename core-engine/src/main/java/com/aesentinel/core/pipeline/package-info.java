/**
 * Orchestration of one monitoring run.
 *
 * <p>
 * {@link com.aesentinel.core.pipeline.MonitoringPipeline} wires the
 * normalizer, detectors, forecaster and summary generator together and
 * exposes the cross-product comparison.
 * </p>
 *
 * @since 1.0.0
 */
package com.aesentinel.core.pipeline;
