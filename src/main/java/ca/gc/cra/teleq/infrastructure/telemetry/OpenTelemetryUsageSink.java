package ca.gc.cra.teleq.infrastructure.telemetry;

import ca.gc.cra.teleq.application.telemetry.DependencyCall;
import ca.gc.cra.teleq.application.telemetry.UsageTelemetrySink;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Usage telemetry sink that records OpenTelemetry metrics.
 *
 * <p>Events, exceptions and traces become counters; dependencies become a call counter plus a duration histogram
 * in milliseconds. Only low-cardinality dimensions are exported: event name, dependency name, success flag, result
 * code, cache-hit flag, error type and category.</p>
 */
public final class OpenTelemetryUsageSink implements UsageTelemetrySink, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryUsageSink.class);

  static final AttributeKey<String> EVENT_NAME = AttributeKey.stringKey("teleq.event.name");
  static final AttributeKey<String> DEPENDENCY_NAME = AttributeKey.stringKey("teleq.dependency.name");
  static final AttributeKey<Boolean> SUCCESS = AttributeKey.booleanKey("teleq.success");
  static final AttributeKey<String> RESULT_CODE = AttributeKey.stringKey("teleq.result.code");
  static final AttributeKey<Boolean> CACHE_HIT = AttributeKey.booleanKey("teleq.cache.hit");
  static final AttributeKey<String> ERROR_TYPE = AttributeKey.stringKey("teleq.error.type");
  static final AttributeKey<String> ERROR_CATEGORY = AttributeKey.stringKey("teleq.error.category");

  private final OpenTelemetryBootstrap.MeterHandle bootstrap;
  private final LongCounter events;
  private final LongCounter dependencyCalls;
  private final DoubleHistogram dependencyDuration;
  private final LongCounter exceptions;
  private final LongCounter traces;

  /**
   * Creates a sink wired to the environment-configured exporter.
   *
   * @param env environment lookup for {@code OTEL_*} variables
   */
  public OpenTelemetryUsageSink(Function<String, String> env) {
    this(OpenTelemetryBootstrap.initialize(env));
  }

  OpenTelemetryUsageSink(OpenTelemetryBootstrap.MeterHandle bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry usage sink running in noop mode");
    }
    Meter meter = bootstrap.meter();
    this.events = meter.counterBuilder("teleq.usage.events")
        .setUnit("1")
        .setDescription("Usage events admitted by the telemetry gate")
        .build();
    this.dependencyCalls = meter.counterBuilder("teleq.usage.dependency.calls")
        .setUnit("1")
        .setDescription("Outbound query calls")
        .build();
    this.dependencyDuration = meter.histogramBuilder("teleq.usage.dependency.duration")
        .setUnit("ms")
        .setDescription("Outbound query call duration")
        .build();
    this.exceptions = meter.counterBuilder("teleq.usage.exceptions")
        .setUnit("1")
        .setDescription("Failures reported through usage telemetry")
        .build();
    this.traces = meter.counterBuilder("teleq.usage.traces")
        .setUnit("1")
        .setDescription("Diagnostic traces reported through usage telemetry")
        .build();
  }

  @Override
  public void trackEvent(String name, Map<String, String> properties, Map<String, Double> measurements) {
    events.add(1, Attributes.of(EVENT_NAME, name == null ? "unknown" : name));
  }

  @Override
  public void trackDependency(DependencyCall call) {
    Attributes attributes = Attributes.builder()
        .put(DEPENDENCY_NAME, call.name())
        .put(SUCCESS, call.success())
        .put(RESULT_CODE, call.resultCode())
        .put(CACHE_HIT, Boolean.parseBoolean(call.properties().get("cacheHit")))
        .build();
    dependencyCalls.add(1, attributes);
    dependencyDuration.record(call.durationMillis(),
        Attributes.of(DEPENDENCY_NAME, call.name(), SUCCESS, call.success()));
  }

  @Override
  public void trackException(Throwable error, Map<String, String> properties) {
    String type = properties.getOrDefault("errorType", error.getClass().getSimpleName());
    String category = properties.getOrDefault("errorCategory", type);
    exceptions.add(1, Attributes.of(ERROR_TYPE, type, ERROR_CATEGORY, category));
  }

  @Override
  public void trackTrace(String message, Map<String, String> properties) {
    traces.add(1);
  }

  @Override
  public void flush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }
}
