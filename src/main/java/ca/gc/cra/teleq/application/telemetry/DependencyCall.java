package ca.gc.cra.teleq.application.telemetry;

import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one outbound call, as reported to usage telemetry.
 *
 * @param name dependency target name, for example {@code Kusto}
 * @param data non-sensitive description of the operation; never raw query text
 * @param durationMillis elapsed wall time
 * @param success whether the call produced a usable result
 * @param resultCode coarse result code: {@code 200}, an HTTP status, or {@code error}
 * @param properties additional dimensions such as correlation id and cache-hit flag
 */
public record DependencyCall(
    String name,
    String data,
    long durationMillis,
    boolean success,
    String resultCode,
    Map<String, String> properties) {

  /** Validates and copies components. */
  public DependencyCall {
    Objects.requireNonNull(name, "name");
    data = data == null ? "" : data;
    resultCode = resultCode == null ? "" : resultCode;
    if (durationMillis < 0) {
      durationMillis = 0;
    }
    properties = properties == null ? Map.of() : Map.copyOf(properties);
  }
}
