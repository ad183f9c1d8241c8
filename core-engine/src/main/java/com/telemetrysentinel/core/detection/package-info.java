/**
 * Statistical anomaly detection for performance metrics.
 *
 * <p>
 * {@link com.telemetrysentinel.core.detection.AnomalyDetector} keeps one
 * rolling {@link com.telemetrysentinel.core.detection.Baseline} per
 * (metric, service) pair and flags values whose z-score exceeds the
 * configured threshold. Baselines stay silent until they hold ten samples.
 * </p>
 *
 * @since 1.0.0
 */
package com.telemetrysentinel.core.detection;
