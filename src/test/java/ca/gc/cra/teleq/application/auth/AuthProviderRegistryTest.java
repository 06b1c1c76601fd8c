package ca.gc.cra.teleq.application.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.teleq.config.ResolvedProfile;
import ca.gc.cra.teleq.testutil.CountingTokenStrategy;
import ca.gc.cra.teleq.testutil.MutableClock;
import ca.gc.cra.teleq.testutil.Profiles;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class AuthProviderRegistryTest {
  private final MutableClock clock = new MutableClock(0L);
  private final Map<String, CountingTokenStrategy> strategies = new ConcurrentHashMap<>();
  private final AuthProviderRegistry registry = new AuthProviderRegistry(profile -> strategies.computeIfAbsent(
      profile.name(), name -> new CountingTokenStrategy(profile.authFlow(), name, clock, Duration.ofHours(1))),
      clock);

  @Test
  void tokensAreIsolatedPerProfile() {
    ResolvedProfile prod = Profiles.azureCli("prod", Path.of("/ws"));
    ResolvedProfile dev = Profiles.azureCli("dev", Path.of("/ws"));

    assertEquals("prod-1", registry.forProfile(prod).getAccessToken());
    assertEquals("dev-1", registry.forProfile(dev).getAccessToken());
    assertEquals("prod-1", registry.forProfile(prod).getAccessToken());
    assertNotSame(registry.forProfile(prod), registry.forProfile(dev));
    assertEquals(2, registry.size());
  }

  @Test
  void sameIdentityResolvedTwiceSharesProvider() {
    ResolvedProfile first = Profiles.azureCli("prod", Path.of("/ws"));
    ResolvedProfile second = Profiles.with("prod", Path.of("/other"), Map.of("removePII", true));

    assertSame(registry.forProfile(first), registry.forProfile(second));
  }

  @Test
  void changedTenantGetsAFreshProvider() {
    ResolvedProfile first = Profiles.azureCli("prod", Path.of("/ws"));
    ResolvedProfile moved = Profiles.with("prod", Path.of("/ws"), Map.of("tenantId", "other-tenant"));

    assertNotSame(registry.forProfile(first), registry.forProfile(moved));
  }

  @Test
  void rotatedClientSecretReplacesTheProvider() {
    ResolvedProfile before = Profiles.with("prod", Path.of("/ws"),
        Map.of("authFlow", "client_credentials", "clientId", "cid", "clientSecret", "old-secret"));
    ResolvedProfile after = Profiles.with("prod", Path.of("/ws"),
        Map.of("authFlow", "client_credentials", "clientId", "cid", "clientSecret", "new-secret"));
    AuthProvider first = registry.forProfile(before);
    assertEquals("prod-1", first.getAccessToken());

    AuthProvider second = registry.forProfile(after);

    assertNotSame(first, second);
    assertEquals("new-secret", second.profile().clientSecret());
    assertEquals("prod-2", second.getAccessToken());
    assertEquals(1, registry.size());
    assertSame(second, registry.forProfile(after));
  }

  @Test
  void concurrentCallersNeverSeeAnotherProfilesToken() throws Exception {
    ResolvedProfile prod = Profiles.azureCli("prod", Path.of("/ws"));
    ResolvedProfile dev = Profiles.azureCli("dev", Path.of("/ws"));
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<String>> prodTokens = new ArrayList<>();
    List<Future<String>> devTokens = new ArrayList<>();
    try {
      for (int i = 0; i < 20; i++) {
        prodTokens.add(pool.submit(() -> {
          start.await();
          return registry.forProfile(prod).getAccessToken();
        }));
        devTokens.add(pool.submit(() -> {
          start.await();
          return registry.forProfile(dev).getAccessToken();
        }));
      }
      start.countDown();
      for (Future<String> token : prodTokens) {
        assertEquals("prod-1", token.get(10, TimeUnit.SECONDS));
      }
      for (Future<String> token : devTokens) {
        assertEquals("dev-1", token.get(10, TimeUnit.SECONDS));
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(1, strategies.get("prod").calls());
    assertEquals(1, strategies.get("dev").calls());
    assertEquals(2, registry.size());
    assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
  }

  @Test
  void clearDropsEveryProvider() {
    ResolvedProfile prod = Profiles.azureCli("prod", Path.of("/ws"));
    registry.forProfile(prod).getAccessToken();

    registry.clear();

    assertEquals(0, registry.size());
    assertEquals("prod-2", registry.forProfile(prod).getAccessToken());
  }
}
