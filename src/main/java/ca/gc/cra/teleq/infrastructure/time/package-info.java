/**
 * Time sources implementing {@link ca.gc.cra.teleq.application.port.ClockPort}.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 */
package ca.gc.cra.teleq.infrastructure.time;
