/**
 * Domain model shared by the engine and its hosts.
 *
 * <ul>
 * <li>{@link com.telemetrysentinel.core.model.ErrorReport} and
 * {@link com.telemetrysentinel.core.model.PerformanceMeasurement}: what
 * callers submit</li>
 * <li>{@link com.telemetrysentinel.core.model.ErrorEvent} and
 * {@link com.telemetrysentinel.core.model.PerformanceEvent}: what the engine
 * records and signals</li>
 * <li>{@link com.telemetrysentinel.core.model.ErrorPattern}: the aggregate for
 * one fingerprint</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.telemetrysentinel.core.model;
