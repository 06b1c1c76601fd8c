package ca.gc.cra.teleq.infrastructure.telemetry;

import ca.gc.cra.teleq.application.telemetry.DependencyCall;
import ca.gc.cra.teleq.application.telemetry.UsageTelemetrySink;
import java.util.Map;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes usage telemetry to the application log.
 *
 * <p>Selected with {@code OTEL_METRICS_EXPORTER=logging} for local troubleshooting.</p>
 */
public final class LoggingUsageSink implements UsageTelemetrySink {
  private static final Logger log = LoggerFactory.getLogger(LoggingUsageSink.class);

  @Override
  public void trackEvent(String name, Map<String, String> properties, Map<String, Double> measurements) {
    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("name=" + name);
    if (!properties.isEmpty()) {
      joiner.add("properties=" + format(properties));
    }
    if (!measurements.isEmpty()) {
      joiner.add("measurements=" + format(measurements));
    }
    log.info("usage.event {}", joiner);
  }

  @Override
  public void trackDependency(DependencyCall call) {
    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("name=" + call.name());
    joiner.add("data=" + call.data());
    joiner.add("durationMs=" + call.durationMillis());
    joiner.add("success=" + call.success());
    joiner.add("resultCode=" + call.resultCode());
    if (!call.properties().isEmpty()) {
      joiner.add("properties=" + format(call.properties()));
    }
    log.info("usage.dependency {}", joiner);
  }

  @Override
  public void trackException(Throwable error, Map<String, String> properties) {
    log.info("usage.exception type={} category={} stackHash={} message={}",
        properties.get("errorType"),
        properties.get("errorCategory"),
        properties.get("stackHash"),
        properties.get("errorMessage"));
  }

  @Override
  public void trackTrace(String message, Map<String, String> properties) {
    if (properties.isEmpty()) {
      log.info("usage.trace {}", message);
    } else {
      log.info("usage.trace {} {}", message, format(properties));
    }
  }

  private static String format(Map<String, ?> values) {
    StringJoiner joiner = new StringJoiner(";", "[", "]");
    for (Map.Entry<String, ?> entry : values.entrySet()) {
      joiner.add(entry.getKey() + '=' + entry.getValue());
    }
    return joiner.toString();
  }
}
