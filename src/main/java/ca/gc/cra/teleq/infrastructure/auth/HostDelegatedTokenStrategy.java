package ca.gc.cra.teleq.infrastructure.auth;

import ca.gc.cra.teleq.application.auth.AuthException;
import ca.gc.cra.teleq.application.auth.AuthProvider;
import ca.gc.cra.teleq.application.auth.AuthResult;
import ca.gc.cra.teleq.application.auth.TokenStrategy;
import ca.gc.cra.teleq.application.port.ClockPort;
import ca.gc.cra.teleq.config.AuthFlow;
import ca.gc.cra.teleq.config.ResolvedProfile;
import ca.gc.cra.teleq.validation.Strings;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * Uses a token injected by the host process through {@code BCTB_ACCESS_TOKEN}.
 *
 * <p>Injected tokens are assumed to live one hour from the moment they are read.</p>
 */
public final class HostDelegatedTokenStrategy implements TokenStrategy {
  /** Environment variable carrying the injected token. */
  public static final String TOKEN_ENV = "BCTB_ACCESS_TOKEN";

  static final String MISSING_TOKEN_MESSAGE = String.join(System.lineSeparator(),
      TOKEN_ENV + " environment variable not set.",
      "",
      "This happens when:",
      "- the host editor has not been configured to pass authentication tokens to this process",
      "- the process was started outside the host that manages tokens for it",
      "",
      "Solutions:",
      "1. Start the process from the host so it can inject " + TOKEN_ENV,
      "2. Export " + TOKEN_ENV + " with a valid token before starting",
      "3. Switch the profile to the azure_cli or device_code auth flow");

  private final Function<String, String> env;
  private final ClockPort clock;

  /**
   * Creates the strategy.
   *
   * @param env environment lookup
   * @param clock time source for the assumed expiry
   */
  public HostDelegatedTokenStrategy(Function<String, String> env, ClockPort clock) {
    this.env = Objects.requireNonNull(env, "env");
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
  }

  @Override
  public AuthFlow flow() {
    return AuthFlow.VSCODE_AUTH;
  }

  @Override
  public AuthResult acquire(ResolvedProfile profile) {
    String token = Strings.trimToNull(env.apply(TOKEN_ENV));
    if (token == null) {
      throw new AuthException(AuthException.Kind.TOKEN_UNAVAILABLE, MISSING_TOKEN_MESSAGE,
          "Set authFlow to \"azure_cli\" in the configuration file for unattended use.");
    }
    Instant expiresOn = Instant.ofEpochMilli(clock.nowMillis()).plus(AuthProvider.DEFAULT_LIFETIME);
    return new AuthResult(true, token, "Host Session", expiresOn);
  }
}
