package ca.gc.cra.teleq.testutil;

import ca.gc.cra.teleq.application.port.ClockPort;
import ca.gc.cra.teleq.application.port.QueryCache;
import ca.gc.cra.teleq.application.query.CacheEntry;
import ca.gc.cra.teleq.application.query.CacheStats;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Map-backed cache honouring TTLs against a supplied clock.
 */
public final class InMemoryQueryCache implements QueryCache {
  public final Map<String, CacheEntry> entries = new LinkedHashMap<>();
  public int puts;
  private final ClockPort clock;
  private boolean failWrites;

  public InMemoryQueryCache(ClockPort clock) {
    this.clock = clock;
  }

  public void failWrites() {
    failWrites = true;
  }

  @Override
  public synchronized Optional<CacheEntry> get(String fingerprint) {
    CacheEntry entry = entries.get(fingerprint);
    if (entry == null || entry.isExpired(clock.nowMillis())) {
      return Optional.empty();
    }
    return Optional.of(entry);
  }

  @Override
  public synchronized void put(String fingerprint, Object data, long ttlSeconds) {
    if (failWrites) {
      throw new UncheckedIOException(new IOException("disk full"));
    }
    puts++;
    if (ttlSeconds > 0) {
      entries.put(fingerprint, new CacheEntry(fingerprint, data, clock.nowMillis(), ttlSeconds));
    }
  }

  @Override
  public synchronized CacheStats stats() {
    int expired = (int) entries.values().stream().filter(entry -> entry.isExpired(clock.nowMillis())).count();
    return new CacheStats(entries.size(), expired, 0L, "memory");
  }

  @Override
  public synchronized int clear() {
    int removed = entries.size();
    entries.clear();
    return removed;
  }

  @Override
  public synchronized int purgeExpired() {
    int before = entries.size();
    entries.values().removeIf(entry -> entry.isExpired(clock.nowMillis()));
    return before - entries.size();
  }
}
