/**
 * Usage telemetry sinks: OpenTelemetry metrics and structured logging.
 * <p><strong>Metrics:</strong> {@code teleq.usage.events}, {@code teleq.usage.dependency.calls},
 * {@code teleq.usage.dependency.duration}, {@code teleq.usage.exceptions}, {@code teleq.usage.traces}.</p>
 */
package ca.gc.cra.teleq.infrastructure.telemetry;
