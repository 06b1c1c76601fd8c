package ca.gc.cra.teleq.infrastructure.auth;

import ca.gc.cra.teleq.application.auth.AuthException;
import ca.gc.cra.teleq.application.auth.AuthResult;
import ca.gc.cra.teleq.application.auth.TokenStrategy;
import ca.gc.cra.teleq.config.AuthFlow;
import ca.gc.cra.teleq.config.ResolvedProfile;
import ca.gc.cra.teleq.validation.Strings;
import com.microsoft.aad.msal4j.ClientCredentialFactory;
import com.microsoft.aad.msal4j.ClientCredentialParameters;
import com.microsoft.aad.msal4j.ConfidentialClientApplication;
import com.microsoft.aad.msal4j.IAuthenticationResult;
import java.net.MalformedURLException;

/**
 * Service principal sign-in through an MSAL confidential client.
 *
 * <p>Missing credentials are reported before any network call.</p>
 */
public final class ClientCredentialsTokenStrategy implements TokenStrategy {
  private static final String REMEDIATION =
      "Set tenantId, clientId and clientSecret in the profile, for example clientSecret: \"${BCTB_CLIENT_SECRET}\".";

  @Override
  public AuthFlow flow() {
    return AuthFlow.CLIENT_CREDENTIALS;
  }

  @Override
  public AuthResult acquire(ResolvedProfile profile) {
    if (Strings.isBlank(profile.clientId()) || Strings.isBlank(profile.clientSecret())) {
      throw new AuthException(AuthException.Kind.MISSING_CREDENTIALS,
          "Client credentials flow requires clientId and clientSecret", REMEDIATION);
    }
    if (Strings.isBlank(profile.tenantId())) {
      throw new AuthException(AuthException.Kind.MISSING_CREDENTIALS,
          "Client credentials flow requires tenantId", REMEDIATION);
    }
    String authority = MsalTokens.authority(profile.tenantId());
    ConfidentialClientApplication app;
    try {
      app = ConfidentialClientApplication
          .builder(profile.clientId(), ClientCredentialFactory.createFromSecret(profile.clientSecret()))
          .authority(authority)
          .build();
    } catch (MalformedURLException ex) {
      throw new AuthException(AuthException.Kind.AUTH_FAILED, "Invalid authority URL " + authority,
          "Check the tenantId in the profile.", ex);
    }
    ClientCredentialParameters parameters = ClientCredentialParameters.builder(MsalTokens.SCOPES).build();
    IAuthenticationResult result = MsalTokens.await(app.acquireToken(parameters), "Client credentials");
    return MsalTokens.toResult(result, "ServicePrincipal:" + profile.clientId());
  }
}
