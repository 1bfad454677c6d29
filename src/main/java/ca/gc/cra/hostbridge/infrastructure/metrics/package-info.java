/**
 * OpenTelemetry-backed {@link ca.gc.cra.hostbridge.application.port.MetricsPort} implementation.
 */
package ca.gc.cra.hostbridge.infrastructure.metrics;
