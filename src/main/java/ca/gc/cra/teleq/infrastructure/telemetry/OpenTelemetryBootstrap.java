package ca.gc.cra.teleq.infrastructure.telemetry;

import ca.gc.cra.teleq.validation.Strings;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider backing {@link OpenTelemetryUsageSink}.
 *
 * <p>The exporter is chosen from {@code otel.metrics.exporter} / {@code OTEL_METRICS_EXPORTER}: {@code otlp}
 * (default), {@code logging} or {@code none}. The OTLP endpoint comes from {@code otel.exporter.otlp.endpoint} /
 * {@code OTEL_EXPORTER_OTLP_ENDPOINT}.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.teleq";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

  private OpenTelemetryBootstrap() {}

  static ExporterMode exporterMode(Function<String, String> env) {
    return ExporterMode.from(Strings.firstNonBlank(
        System.getProperty("otel.metrics.exporter"), env.apply("OTEL_METRICS_EXPORTER")));
  }

  /**
   * Starts an OTLP meter provider, or returns an inert handle when OTLP is not selected or startup fails.
   *
   * @param env environment lookup
   * @return meter handle; never {@code null}
   */
  static MeterHandle initialize(Function<String, String> env) {
    if (exporterMode(env) != ExporterMode.OTLP) {
      log.info("OpenTelemetry usage metrics exporter disabled");
      return MeterHandle.inert();
    }
    String endpoint = Strings.firstNonBlank(
        System.getProperty("otel.exporter.otlp.endpoint"), env.apply("OTEL_EXPORTER_OTLP_ENDPOINT"), DEFAULT_ENDPOINT);
    try {
      MetricReader reader = PeriodicMetricReader
          .builder(OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      MeterHandle handle = start(reader);
      log.info("OpenTelemetry usage metrics exporting to {}", endpoint);
      return handle;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; usage telemetry will be dropped", ex);
      return MeterHandle.inert();
    }
  }

  static MeterHandle forTesting(MetricReader reader) {
    return start(Objects.requireNonNull(reader, "reader"));
  }

  private static MeterHandle start(MetricReader reader) {
    String version = Strings.firstNonBlank(
        OpenTelemetryBootstrap.class.getPackage().getImplementationVersion(), "0.0.0-dev");
    Resource resource = Resource.getDefault().merge(Resource.create(Attributes.of(
        AttributeKey.stringKey("service.name"), "teleq",
        AttributeKey.stringKey("service.namespace"), "ca.gc.cra",
        AttributeKey.stringKey("service.version"), version)));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    return new MeterHandle(provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build(),
        provider);
  }

  enum ExporterMode {
    OTLP,
    LOGGING,
    NONE;

    static ExporterMode from(String raw) {
      String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      switch (value) {
        case "", "otlp":
          return OTLP;
        case "logging", "console":
          return LOGGING;
        case "none":
          return NONE;
        default:
          log.warn("Unknown OTEL_METRICS_EXPORTER value '{}'; using otlp", raw);
          return OTLP;
      }
    }
  }

  /** Meter plus the SDK provider that owns it; the provider is {@code null} for the inert handle. */
  static final class MeterHandle implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private MeterHandle(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static MeterHandle inert() {
      return new MeterHandle(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider::forceFlush, "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider::shutdown, "shutdown");
      }
    }

    private static void await(Supplier<CompletableResultCode> operation, String name) {
      try {
        CompletableResultCode result = operation.get().join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (!result.isSuccess()) {
          log.warn("OpenTelemetry meter provider {} did not complete within {}s", name, SHUTDOWN_TIMEOUT_SECONDS);
        }
      } catch (RuntimeException ex) {
        log.warn("OpenTelemetry meter provider {} failed", name, ex);
      }
    }
  }
}
