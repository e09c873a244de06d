/**
 * Series-level detectors.
 *
 * <p>
 * Both detectors implement
 * {@link com.aesentinel.core.detection.SeriesDetector}:
 * </p>
 * <ul>
 * <li>{@link com.aesentinel.core.detection.RollingZScoreDetector}: trailing
 * four-quarter mean ± z × σ</li>
 * <li>{@link com.aesentinel.core.detection.SafetySignalDetector}: absolute and
 * relative quarter-over-quarter increase</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.aesentinel.core.detection;
