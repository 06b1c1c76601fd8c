package ca.gc.cra.teleq.application.auth;

import ca.gc.cra.teleq.application.port.ClockPort;
import ca.gc.cra.teleq.config.ResolvedProfile;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Holds the token session for exactly one profile.
 * <p><strong>States:</strong> unauthenticated until the first successful sign-in; authenticated while the token is
 * more than five minutes from expiry; a call inside that margin signs in again. Tokens whose expiry is unknown are
 * assumed to live one hour.</p>
 * <p><strong>Thread-safety:</strong> All state transitions hold this instance's monitor, so concurrent callers for
 * the same profile share one sign-in. Providers for different profiles never share state; see
 * {@link AuthProviderRegistry}.</p>
 *
 * @since 0.1.0
 */
public final class AuthProvider {
  private static final Logger log = LoggerFactory.getLogger(AuthProvider.class);

  /** Time before expiry at which a token is replaced. */
  public static final Duration REFRESH_MARGIN = Duration.ofMinutes(5);
  /** Lifetime assumed for tokens whose expiry is not reported. */
  public static final Duration DEFAULT_LIFETIME = Duration.ofHours(1);

  private final ResolvedProfile profile;
  private final TokenStrategy strategy;
  private final ClockPort clock;

  private AuthSession session;

  /**
   * Creates a provider.
   *
   * @param profile profile this provider serves
   * @param strategy strategy selected from {@code profile.authFlow()}
   * @param clock time source for expiry checks
   */
  public AuthProvider(ResolvedProfile profile, TokenStrategy strategy, ClockPort clock) {
    this.profile = Objects.requireNonNull(profile, "profile");
    this.strategy = Objects.requireNonNull(strategy, "strategy");
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    if (strategy.flow() != profile.authFlow()) {
      throw new IllegalArgumentException(
          "Strategy " + strategy.flow() + " does not match profile auth flow " + profile.authFlow());
    }
  }

  /**
   * Returns a valid token, signing in when there is no session or the session is inside the refresh margin.
   *
   * @return bearer token
   * @throws AuthException when sign-in fails
   */
  public synchronized String getAccessToken() {
    Instant now = now();
    if (session != null && !session.needsRefresh(now, REFRESH_MARGIN)) {
      return session.accessToken();
    }
    if (session != null) {
      log.debug("Token for profile {} expires at {}; refreshing", profile.name(), session.expiresOn());
    }
    return signIn().accessToken();
  }

  /**
   * Discards any session and signs in again.
   *
   * @return result of the fresh sign-in
   * @throws AuthException when sign-in fails
   */
  public synchronized AuthResult authenticate() {
    session = null;
    return signIn().toResult();
  }

  /**
   * Describes the current session without signing in.
   *
   * @return current session, or an unauthenticated result
   */
  public synchronized AuthResult status() {
    if (session == null || !now().isBefore(session.expiresOn())) {
      return AuthResult.unauthenticated();
    }
    return session.toResult();
  }

  /** Drops the current session. */
  public synchronized void clear() {
    session = null;
  }

  /**
   * Returns the profile this provider serves.
   *
   * @return profile
   */
  public ResolvedProfile profile() {
    return profile;
  }

  private AuthSession signIn() {
    log.debug("Authenticating profile {} with {}", profile.name(), strategy.flow().configValue());
    AuthResult result;
    try {
      result = strategy.acquire(profile);
    } catch (AuthException ex) {
      session = null;
      throw ex;
    } catch (RuntimeException ex) {
      session = null;
      throw new AuthException(AuthException.Kind.AUTH_FAILED,
          "Authentication failed for profile '" + profile.name() + "': " + ex.getMessage(),
          null, ex);
    }
    if (result == null || !result.authenticated() || result.accessToken() == null
        || result.accessToken().isBlank()) {
      session = null;
      throw new AuthException(AuthException.Kind.AUTH_FAILED,
          "Authentication for profile '" + profile.name() + "' returned no access token",
          "Run 'teleq test-auth' to diagnose the " + strategy.flow().configValue() + " flow.");
    }
    Instant expiresOn = result.expiresOn() != null ? result.expiresOn() : now().plus(DEFAULT_LIFETIME);
    session = new AuthSession(result.accessToken(), result.user(), expiresOn);
    log.info("Authenticated profile {} via {}; token valid until {}",
        profile.name(), strategy.flow().configValue(), expiresOn);
    return session;
  }

  private Instant now() {
    return Instant.ofEpochMilli(clock.nowMillis());
  }
}
