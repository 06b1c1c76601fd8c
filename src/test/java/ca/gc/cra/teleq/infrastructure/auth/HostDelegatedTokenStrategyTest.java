package ca.gc.cra.teleq.infrastructure.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.teleq.application.auth.AuthException;
import ca.gc.cra.teleq.application.auth.AuthResult;
import ca.gc.cra.teleq.config.ResolvedProfile;
import ca.gc.cra.teleq.testutil.MutableClock;
import ca.gc.cra.teleq.testutil.Profiles;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HostDelegatedTokenStrategyTest {
  private final Map<String, String> env = new HashMap<>();
  private final MutableClock clock = new MutableClock(0L);
  private final HostDelegatedTokenStrategy strategy = new HostDelegatedTokenStrategy(env::get, clock);
  private final ResolvedProfile profile =
      Profiles.with("host", Path.of("/ws"), Map.of("authFlow", "vscode_auth"));

  @Test
  void usesInjectedToken() {
    env.put(HostDelegatedTokenStrategy.TOKEN_ENV, " injected ");

    AuthResult result = strategy.acquire(profile);

    assertEquals("injected", result.accessToken());
    assertEquals("Host Session", result.user());
    assertEquals(Instant.ofEpochSecond(3600), result.expiresOn());
  }

  @Test
  void missingTokenExplainsHowToFixIt() {
    AuthException ex = assertThrows(AuthException.class, () -> strategy.acquire(profile));

    assertEquals(AuthException.Kind.TOKEN_UNAVAILABLE, ex.kind());
    assertTrue(ex.getMessage().startsWith("BCTB_ACCESS_TOKEN environment variable not set."), ex.getMessage());
    assertTrue(ex.remediation().contains("azure_cli"), ex.remediation());
  }
}
