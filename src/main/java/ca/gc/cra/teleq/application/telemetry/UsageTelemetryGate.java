package ca.gc.cra.teleq.application.telemetry;

import ca.gc.cra.teleq.application.port.ClockPort;
import ca.gc.cra.teleq.config.TelemetrySettings;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Rate limiter in front of a {@link UsageTelemetrySink}.
 * <p><strong>Limits:</strong></p>
 * <ul>
 *   <li>{@code maxEventsPerSession} tracked items over the lifetime of the gate;</li>
 *   <li>{@code maxEventsPerMinute} tracked items over the trailing sixty seconds, counted in one-second buckets;</li>
 *   <li>{@code maxIdenticalErrors} exceptions per signature (error type plus sanitized stack hash). The next
 *       occurrence throttles the signature, emits one {@value #THROTTLED_EVENT} marker, and suppresses the
 *       signature until {@code errorCooldownMs} after the throttle instant.</li>
 * </ul>
 * <p>Cooldown is evaluated when the next exception with that signature arrives; the gate starts no threads.</p>
 * <p><strong>Thread-safety:</strong> Counters are guarded by the gate's monitor; sink calls happen outside it.
 * Sink failures are logged at DEBUG and never reach the caller.</p>
 *
 * @since 0.1.0
 */
public final class UsageTelemetryGate implements UsageTelemetrySink {
  private static final Logger log = LoggerFactory.getLogger(UsageTelemetryGate.class);

  /** Marker event emitted once when a signature is throttled. */
  public static final String THROTTLED_EVENT = "UsageTelemetry.ErrorThrottled";

  private static final long WINDOW_MILLIS = 60_000L;
  private static final long BUCKET_MILLIS = 1_000L;

  private final UsageTelemetrySink sink;
  private final TelemetrySettings settings;
  private final ClockPort clock;

  private final Deque<long[]> buckets = new ArrayDeque<>();
  private final Map<String, SignatureState> signatures = new HashMap<>();
  private long sessionCount;

  /**
   * Creates a gate.
   *
   * @param sink destination for admitted telemetry
   * @param settings limits and enablement
   * @param clock time source
   */
  public UsageTelemetryGate(UsageTelemetrySink sink, TelemetrySettings settings, ClockPort clock) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
  }

  /**
   * Creates a gate that drops everything.
   *
   * @return disabled gate
   */
  public static UsageTelemetryGate disabled() {
    return new UsageTelemetryGate(UsageTelemetrySink.NO_OP, TelemetrySettings.DEFAULTS.disabled(), ClockPort.SYSTEM);
  }

  /**
   * Reports whether the gate forwards anything at all.
   *
   * @return {@code true} when enabled
   */
  public boolean isEnabled() {
    return settings.enabled();
  }

  @Override
  public void trackEvent(String name, Map<String, String> properties, Map<String, Double> measurements) {
    if (!settings.enabled() || !admit()) {
      return;
    }
    Map<String, String> props = properties == null ? Map.of() : properties;
    Map<String, Double> values = measurements == null ? Map.of() : measurements;
    deliver("event", () -> sink.trackEvent(name, props, values));
  }

  @Override
  public void trackDependency(DependencyCall call) {
    if (!settings.enabled() || !admit()) {
      return;
    }
    deliver("dependency", () -> sink.trackDependency(call));
  }

  @Override
  public void trackTrace(String message, Map<String, String> properties) {
    if (!settings.enabled() || !admit()) {
      return;
    }
    Map<String, String> props = properties == null ? Map.of() : properties;
    deliver("trace", () -> sink.trackTrace(message, props));
  }

  /**
   * Tracks a failure, adding sanitized exception dimensions and applying the per-signature limit.
   *
   * @param error failure to report
   * @param properties caller dimensions; merged over the sanitized defaults
   */
  @Override
  public void trackException(Throwable error, Map<String, String> properties) {
    if (!settings.enabled() || error == null) {
      return;
    }
    Map<String, String> props;
    try {
      props = new LinkedHashMap<>(TelemetrySanitizer.exceptionProperties(error));
    } catch (RuntimeException ex) {
      log.debug("Could not describe {} for usage telemetry", error.getClass().getName(), ex);
      return;
    }
    if (properties != null) {
      props.putAll(properties);
    }
    String errorType = props.get("errorType");
    String signature = TelemetrySanitizer.signature(errorType, props.get("stackHash"));

    Decision decision = decide(signature);
    switch (decision.outcome) {
      case SUPPRESSED -> log.trace("Suppressed throttled exception {}", signature);
      case THROTTLED -> {
        Map<String, String> marker = new LinkedHashMap<>();
        marker.put("errorType", errorType);
        marker.put("errorKey", signature);
        marker.put("occurrences", Long.toString(decision.occurrences));
        deliver("throttle marker", () -> sink.trackEvent(THROTTLED_EVENT, marker, Map.of()));
      }
      case FORWARD -> deliver("exception", () -> sink.trackException(error, props));
      case DROPPED -> log.trace("Exception {} dropped by global limits", signature);
      default -> throw new IllegalStateException("Unexpected outcome " + decision.outcome);
    }
  }

  @Override
  public void flush() {
    deliver("flush", sink::flush);
  }

  /**
   * Returns how many items were admitted since the gate was created.
   *
   * @return session count
   */
  public synchronized long sessionEventCount() {
    return sessionCount;
  }

  private synchronized Decision decide(String signature) {
    long now = clock.nowMillis();
    SignatureState state = signatures.get(signature);
    if (state != null && state.throttledAt >= 0 && now - state.throttledAt >= settings.errorCooldownMs()) {
      signatures.remove(signature);
      state = null;
    }
    if (state == null) {
      state = new SignatureState();
      signatures.put(signature, state);
    }
    if (state.throttledAt >= 0) {
      return new Decision(Outcome.SUPPRESSED, state.count);
    }
    if (state.count >= settings.maxIdenticalErrors()) {
      state.throttledAt = now;
      log.debug("Throttling exception signature {} after {} occurrences", signature, state.count);
      return new Decision(admitLocked(now) ? Outcome.THROTTLED : Outcome.DROPPED, state.count);
    }
    state.count++;
    return new Decision(admitLocked(now) ? Outcome.FORWARD : Outcome.DROPPED, state.count);
  }

  private synchronized boolean admit() {
    return admitLocked(clock.nowMillis());
  }

  private boolean admitLocked(long now) {
    if (sessionCount >= settings.maxEventsPerSession()) {
      return false;
    }
    while (!buckets.isEmpty() && buckets.peekFirst()[0] <= now - WINDOW_MILLIS) {
      buckets.pollFirst();
    }
    long recent = 0;
    for (long[] bucket : buckets) {
      recent += bucket[1];
    }
    if (recent >= settings.maxEventsPerMinute()) {
      return false;
    }
    sessionCount++;
    long[] last = buckets.peekLast();
    if (last != null && now - last[0] < BUCKET_MILLIS) {
      last[1]++;
    } else {
      buckets.addLast(new long[] {now, 1});
    }
    return true;
  }

  private void deliver(String kind, Runnable call) {
    try {
      call.run();
    } catch (RuntimeException ex) {
      log.debug("Usage telemetry sink failed to record {}", kind, ex);
    }
  }

  private enum Outcome { FORWARD, THROTTLED, SUPPRESSED, DROPPED }

  private record Decision(Outcome outcome, long occurrences) {}

  private static final class SignatureState {
    private long count;
    private long throttledAt = -1;
  }
}
