package ca.gc.cra.teleq.application.telemetry;

import java.util.Map;

/**
 * Port receiving usage telemetry after it has passed the {@link UsageTelemetryGate}.
 *
 * <p>Implementations may throw; the gate contains every failure.</p>
 *
 * @since 0.1.0
 */
public interface UsageTelemetrySink {

  /**
   * Records a named usage event.
   *
   * @param name event name
   * @param properties string dimensions; never {@code null}
   * @param measurements numeric values; never {@code null}
   */
  void trackEvent(String name, Map<String, String> properties, Map<String, Double> measurements);

  /**
   * Records an outbound call.
   *
   * @param call dependency outcome
   */
  void trackDependency(DependencyCall call);

  /**
   * Records a failure.
   *
   * @param error failure; only its type and sanitized properties are exported
   * @param properties sanitized dimensions
   */
  void trackException(Throwable error, Map<String, String> properties);

  /**
   * Records a diagnostic message.
   *
   * @param message sanitized message
   * @param properties string dimensions
   */
  void trackTrace(String message, Map<String, String> properties);

  /** Pushes buffered telemetry to its destination. */
  default void flush() {}

  /** Sink that discards everything. */
  UsageTelemetrySink NO_OP = new UsageTelemetrySink() {
    @Override public void trackEvent(String name, Map<String, String> properties, Map<String, Double> measurements) {}

    @Override public void trackDependency(DependencyCall call) {}

    @Override public void trackException(Throwable error, Map<String, String> properties) {}

    @Override public void trackTrace(String message, Map<String, String> properties) {}
  };
}
