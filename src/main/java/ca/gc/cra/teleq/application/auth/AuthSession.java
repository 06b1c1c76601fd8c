package ca.gc.cra.teleq.application.auth;

import ca.gc.cra.teleq.logging.Logs;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Token held by one {@link AuthProvider}.
 *
 * @param accessToken bearer token
 * @param user signed-in principal, when known
 * @param expiresOn expiry instant
 */
record AuthSession(String accessToken, String user, Instant expiresOn) {

  AuthSession {
    Objects.requireNonNull(accessToken, "accessToken");
    Objects.requireNonNull(expiresOn, "expiresOn");
  }

  /**
   * Reports whether the session is inside its refresh margin.
   *
   * @param now current instant
   * @param margin time before expiry at which the token is replaced
   * @return {@code true} once {@code now >= expiresOn - margin}
   */
  boolean needsRefresh(Instant now, Duration margin) {
    return !now.isBefore(expiresOn.minus(margin));
  }

  AuthResult toResult() {
    return new AuthResult(true, accessToken, user, expiresOn);
  }

  @Override
  public String toString() {
    return "AuthSession{accessToken=" + Logs.redact(accessToken) + ", user=" + user + ", expiresOn=" + expiresOn + '}';
  }
}
