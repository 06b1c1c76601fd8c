package ca.gc.cra.teleq.application.query;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CacheEntryTest {
  private static final long CREATED = 1_700_000_000_000L;

  @Test
  void expiresOnceTheLifetimeHasElapsed() {
    CacheEntry entry = new CacheEntry("fp", Map.of(), CREATED, 60L);

    assertFalse(entry.isExpired(CREATED + 59_999L));
    assertTrue(entry.isExpired(CREATED + 60_000L));
  }

  @Test
  void zeroLifetimeIsExpiredImmediately() {
    assertTrue(new CacheEntry("fp", Map.of(), CREATED, 0L).isExpired(CREATED));
  }

  @Test
  void hugeLifetimeDoesNotWrapIntoThePast() {
    CacheEntry entry = new CacheEntry("fp", Map.of(), CREATED, Long.MAX_VALUE / 1000L + 1L);

    assertFalse(entry.isExpired(CREATED + 1L));
    assertFalse(entry.isExpired(Long.MAX_VALUE));
    assertFalse(new CacheEntry("fp", Map.of(), CREATED, Long.MAX_VALUE).isExpired(CREATED + 86_400_000L));
  }
}
