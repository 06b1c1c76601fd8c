package ca.gc.cra.teleq.application.auth;

import ca.gc.cra.teleq.logging.Logs;
import java.time.Instant;

/**
 * Outcome of one sign-in attempt by a {@link TokenStrategy}.
 *
 * @param authenticated whether a token was obtained
 * @param accessToken bearer token; {@code null} when not authenticated; never printed
 * @param user display name of the signed-in principal, when known
 * @param expiresOn token expiry; {@code null} when the strategy cannot tell
 */
public record AuthResult(boolean authenticated, String accessToken, String user, Instant expiresOn) {

  /**
   * Returns the result describing an absent session.
   *
   * @return unauthenticated result
   */
  public static AuthResult unauthenticated() {
    return new AuthResult(false, null, null, null);
  }

  @Override
  public String toString() {
    return "AuthResult{authenticated=" + authenticated
        + ", accessToken=" + Logs.redact(accessToken)
        + ", user=" + user
        + ", expiresOn=" + expiresOn
        + '}';
  }
}
