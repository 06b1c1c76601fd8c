package ca.gc.cra.teleq.application.auth;

import ca.gc.cra.teleq.config.AuthFlow;
import ca.gc.cra.teleq.config.ResolvedProfile;

/**
 * One way of obtaining a bearer token for the telemetry query API.
 *
 * <p>Implementations perform a fresh sign-in on every call; caching belongs to {@link AuthProvider}.</p>
 *
 * @since 0.1.0
 */
public interface TokenStrategy {

  /**
   * Returns the flow this strategy implements.
   *
   * @return auth flow
   */
  AuthFlow flow();

  /**
   * Signs in and returns a token.
   *
   * @param profile profile supplying tenant and client settings
   * @return authenticated result
   * @throws AuthException when no token can be obtained
   */
  AuthResult acquire(ResolvedProfile profile);
}
