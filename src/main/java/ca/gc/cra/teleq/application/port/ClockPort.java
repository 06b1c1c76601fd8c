package ca.gc.cra.teleq.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to token refresh, cache expiry, and telemetry rate
 * limiting.
 * <p><strong>Why:</strong> Every time-dependent decision in the query core (token margin, entry TTL, per-second
 * buckets, error cooldown) goes through this port so tests can drive time explicitly.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see ca.gc.cra.teleq.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z; subject to system clock adjustments
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
