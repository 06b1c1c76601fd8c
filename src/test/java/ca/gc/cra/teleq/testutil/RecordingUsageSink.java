package ca.gc.cra.teleq.testutil;

import ca.gc.cra.teleq.application.telemetry.DependencyCall;
import ca.gc.cra.teleq.application.telemetry.UsageTelemetrySink;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Test double capturing every signal that reaches the sink.
 */
public final class RecordingUsageSink implements UsageTelemetrySink {
  public final List<Event> events = new ArrayList<>();
  public final List<DependencyCall> dependencies = new ArrayList<>();
  public final List<Map<String, String>> exceptions = new ArrayList<>();
  public final List<String> traces = new ArrayList<>();
  public int flushes;
  private boolean failing;

  public record Event(String name, Map<String, String> properties) {}

  /** Makes every subsequent call throw. */
  public void failAll() {
    failing = true;
  }

  public int total() {
    return events.size() + dependencies.size() + exceptions.size() + traces.size();
  }

  public long eventsNamed(String name) {
    return events.stream().filter(event -> event.name().equals(name)).count();
  }

  @Override
  public synchronized void trackEvent(String name, Map<String, String> properties, Map<String, Double> measurements) {
    check();
    events.add(new Event(name, Map.copyOf(properties)));
  }

  @Override
  public synchronized void trackDependency(DependencyCall call) {
    check();
    dependencies.add(call);
  }

  @Override
  public synchronized void trackException(Throwable error, Map<String, String> properties) {
    check();
    exceptions.add(Map.copyOf(properties));
  }

  @Override
  public synchronized void trackTrace(String message, Map<String, String> properties) {
    check();
    traces.add(message);
  }

  @Override
  public synchronized void flush() {
    check();
    flushes++;
  }

  private void check() {
    if (failing) {
      throw new IllegalStateException("sink unavailable");
    }
  }
}
