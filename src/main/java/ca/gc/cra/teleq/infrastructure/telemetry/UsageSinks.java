package ca.gc.cra.teleq.infrastructure.telemetry;

import ca.gc.cra.teleq.application.telemetry.UsageTelemetrySink;
import java.util.function.Function;

/**
 * Chooses the usage telemetry sink for the process from the OpenTelemetry exporter setting.
 */
public final class UsageSinks {

  private UsageSinks() {}

  /**
   * Builds the configured sink.
   *
   * @param env environment lookup
   * @return {@link UsageTelemetrySink#NO_OP} for {@code none}, a {@link LoggingUsageSink} for {@code logging},
   *     otherwise an {@link OpenTelemetryUsageSink}
   */
  public static UsageTelemetrySink fromEnvironment(Function<String, String> env) {
    return switch (OpenTelemetryBootstrap.exporterMode(env)) {
      case NONE -> UsageTelemetrySink.NO_OP;
      case LOGGING -> new LoggingUsageSink();
      case OTLP -> new OpenTelemetryUsageSink(env);
    };
  }
}
