package ca.gc.cra.teleq.application.query;

/**
 * Stored query result.
 *
 * @param fingerprint content address
 * @param data normalized result as produced by {@link QueryResult#toMap()}
 * @param createdAtMillis epoch millis when stored
 * @param ttlSeconds lifetime
 */
public record CacheEntry(String fingerprint, Object data, long createdAtMillis, long ttlSeconds) {

  /**
   * Reports whether the entry is past its lifetime.
   *
   * @param nowMillis current epoch millis
   * @return {@code true} once {@code now - createdAt >= ttl}; lifetimes too long to express in millis never expire
   */
  public boolean isExpired(long nowMillis) {
    long ttlMillis;
    try {
      ttlMillis = Math.multiplyExact(ttlSeconds, 1000L);
    } catch (ArithmeticException ex) {
      return false;
    }
    return nowMillis - createdAtMillis >= ttlMillis;
  }
}
