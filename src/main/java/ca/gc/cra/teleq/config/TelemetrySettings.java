package ca.gc.cra.teleq.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Usage telemetry policy carried by a profile.
 *
 * <p>Configured as {@code {"enabled": true, "rateLimiting": {"maxIdenticalErrors": 10, ...}}}.</p>
 *
 * @param enabled whether usage telemetry is emitted at all
 * @param maxIdenticalErrors exceptions per signature before throttling
 * @param maxEventsPerSession hard cap for the lifetime of the gate
 * @param maxEventsPerMinute cap over the trailing sixty seconds
 * @param errorCooldownMs time after throttling before a signature may emit again
 * @since 0.1.0
 */
public record TelemetrySettings(
    boolean enabled,
    int maxIdenticalErrors,
    int maxEventsPerSession,
    int maxEventsPerMinute,
    long errorCooldownMs) {

  /** Default policy. */
  public static final TelemetrySettings DEFAULTS = new TelemetrySettings(true, 10, 1000, 100, 60_000L);

  /** Validates ranges. */
  public TelemetrySettings {
    if (maxIdenticalErrors < 1) {
      throw new ConfigException(ConfigException.Kind.MALFORMED_CONFIG, "maxIdenticalErrors must be at least 1");
    }
    if (maxEventsPerSession < 0 || maxEventsPerMinute < 0) {
      throw new ConfigException(ConfigException.Kind.MALFORMED_CONFIG, "event limits must not be negative");
    }
    if (errorCooldownMs < 0) {
      throw new ConfigException(ConfigException.Kind.MALFORMED_CONFIG, "errorCooldownMs must not be negative");
    }
  }

  /**
   * Returns a copy with telemetry switched off.
   *
   * @return disabled settings with the same limits
   */
  public TelemetrySettings disabled() {
    return new TelemetrySettings(false, maxIdenticalErrors, maxEventsPerSession, maxEventsPerMinute, errorCooldownMs);
  }

  /**
   * Reads a {@code telemetry} block, falling back to {@link #DEFAULTS} for absent fields.
   *
   * @param block raw block; {@code null} or empty yields defaults
   * @return parsed settings
   */
  public static TelemetrySettings fromMap(Map<String, Object> block) {
    if (block == null || block.isEmpty()) {
      return DEFAULTS;
    }
    Map<String, Object> limits = Map.of();
    Object rateLimiting = block.get("rateLimiting");
    if (rateLimiting instanceof Map<?, ?> map) {
      limits = ConfigMerger.asObject(map);
    } else if (rateLimiting != null) {
      throw new ConfigException(ConfigException.Kind.MALFORMED_CONFIG, "telemetry.rateLimiting must be an object");
    }
    return new TelemetrySettings(
        ConfigValues.bool(block.get("enabled"), DEFAULTS.enabled, "telemetry.enabled"),
        ConfigValues.integer(limits.get("maxIdenticalErrors"), DEFAULTS.maxIdenticalErrors,
            "telemetry.rateLimiting.maxIdenticalErrors"),
        ConfigValues.integer(limits.get("maxEventsPerSession"), DEFAULTS.maxEventsPerSession,
            "telemetry.rateLimiting.maxEventsPerSession"),
        ConfigValues.integer(limits.get("maxEventsPerMinute"), DEFAULTS.maxEventsPerMinute,
            "telemetry.rateLimiting.maxEventsPerMinute"),
        ConfigValues.number(limits.get("errorCooldownMs"), DEFAULTS.errorCooldownMs,
            "telemetry.rateLimiting.errorCooldownMs"));
  }

  /**
   * Renders the block in configuration form.
   *
   * @return mutable map suitable for {@link #fromMap(Map)}
   */
  public Map<String, Object> toMap() {
    Map<String, Object> limits = new LinkedHashMap<>();
    limits.put("maxIdenticalErrors", maxIdenticalErrors);
    limits.put("maxEventsPerSession", maxEventsPerSession);
    limits.put("maxEventsPerMinute", maxEventsPerMinute);
    limits.put("errorCooldownMs", errorCooldownMs);
    Map<String, Object> block = new LinkedHashMap<>();
    block.put("enabled", enabled);
    block.put("rateLimiting", limits);
    return block;
  }
}
