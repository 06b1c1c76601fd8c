package ca.gc.cra.teleq.application.port;

import ca.gc.cra.teleq.application.query.CacheEntry;
import ca.gc.cra.teleq.application.query.CacheStats;
import java.util.Optional;

/**
 * <strong>What:</strong> Port for the content-addressed, TTL-bound store of query results.
 * <p><strong>Contract:</strong> lookups never create storage; expired and unreadable entries are misses; a store
 * replaces any previous entry for the fingerprint.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent access to distinct fingerprints;
 * concurrent stores to one fingerprint resolve last-writer-wins.</p>
 *
 * @since 0.1.0
 */
public interface QueryCache {

  /**
   * Returns the live entry for a fingerprint.
   *
   * @param fingerprint content address
   * @return entry when present and not expired
   */
  Optional<CacheEntry> get(String fingerprint);

  /**
   * Stores a result.
   *
   * @param fingerprint content address
   * @param data normalized result
   * @param ttlSeconds lifetime
   */
  void put(String fingerprint, Object data, long ttlSeconds);

  /**
   * Summarizes stored entries.
   *
   * @return statistics
   */
  CacheStats stats();

  /**
   * Deletes every entry.
   *
   * @return number of entries removed
   */
  int clear();

  /**
   * Deletes expired and unreadable entries.
   *
   * @return number of entries removed
   */
  int purgeExpired();
}
