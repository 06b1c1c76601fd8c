/**
 * Application layer of TELEQ: the {@link ca.gc.cra.teleq.application.TelemetryQueryClient} facade and the auth,
 * query, and usage telemetry use cases behind it.
 */
package ca.gc.cra.teleq.application;
