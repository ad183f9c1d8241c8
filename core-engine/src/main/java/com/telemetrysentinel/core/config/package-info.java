/**
 * Engine configuration and the YAML classification-rule loader.
 *
 * @since 1.0.0
 */
package com.telemetrysentinel.core.config;
