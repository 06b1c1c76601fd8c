package ca.gc.cra.teleq.infrastructure.auth;

import ca.gc.cra.teleq.application.auth.AuthException;
import ca.gc.cra.teleq.application.auth.AuthResult;
import ca.gc.cra.teleq.application.auth.TokenStrategy;
import ca.gc.cra.teleq.config.AuthFlow;
import ca.gc.cra.teleq.config.ResolvedProfile;
import ca.gc.cra.teleq.validation.Strings;
import com.microsoft.aad.msal4j.DeviceCodeFlowParameters;
import com.microsoft.aad.msal4j.IAuthenticationResult;
import com.microsoft.aad.msal4j.PublicClientApplication;
import java.net.MalformedURLException;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interactive device-code sign-in through MSAL.
 *
 * <p>The sign-in instructions are handed to the prompt consumer; the call then blocks until the user completes or
 * abandons the flow in a browser.</p>
 */
public final class DeviceCodeTokenStrategy implements TokenStrategy {
  private static final Logger log = LoggerFactory.getLogger(DeviceCodeTokenStrategy.class);

  /** Well-known public client used when the profile does not name one. */
  static final String DEFAULT_CLIENT_ID = "04b07795-8ddb-461a-bbee-02f9e1bf7b46";

  private final Consumer<String> prompt;

  /**
   * Creates the strategy.
   *
   * @param prompt receives the sign-in message to show the user
   */
  public DeviceCodeTokenStrategy(Consumer<String> prompt) {
    this.prompt = Objects.requireNonNull(prompt, "prompt");
  }

  @Override
  public AuthFlow flow() {
    return AuthFlow.DEVICE_CODE;
  }

  @Override
  public AuthResult acquire(ResolvedProfile profile) {
    String clientId = Strings.firstNonBlank(profile.clientId(), DEFAULT_CLIENT_ID);
    String authority = MsalTokens.authority(profile.tenantId());
    PublicClientApplication app;
    try {
      app = PublicClientApplication.builder(clientId).authority(authority).build();
    } catch (MalformedURLException ex) {
      throw new AuthException(AuthException.Kind.AUTH_FAILED, "Invalid authority URL " + authority,
          "Check the tenantId in the profile.", ex);
    }
    DeviceCodeFlowParameters parameters = DeviceCodeFlowParameters
        .builder(MsalTokens.SCOPES, deviceCode -> prompt.accept(deviceCode.message()))
        .build();
    log.info("Starting device code sign-in for profile {}", profile.name());
    IAuthenticationResult result = MsalTokens.await(app.acquireToken(parameters), "Device code");
    return MsalTokens.toResult(result, "Device Code User");
  }
}
