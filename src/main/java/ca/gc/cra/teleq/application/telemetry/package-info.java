/**
 * Usage telemetry for the query core: the rate-limiting gate, its sink port, and exception sanitization.
 * <p><strong>Privacy:</strong> Nothing in this package receives raw query text or credentials.</p>
 */
package ca.gc.cra.teleq.application.telemetry;
