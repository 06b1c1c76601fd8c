package ca.gc.cra.teleq.infrastructure.auth;

import ca.gc.cra.teleq.application.auth.AuthException;
import ca.gc.cra.teleq.application.auth.AuthResult;
import ca.gc.cra.teleq.application.telemetry.TelemetrySanitizer;
import com.microsoft.aad.msal4j.IAuthenticationResult;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/** MSAL constants and result conversion shared by the device-code and client-credentials strategies. */
final class MsalTokens {
  static final Set<String> SCOPES = Set.of("https://api.applicationinsights.io/.default");
  static final String AUTHORITY_BASE = "https://login.microsoftonline.com/";

  private MsalTokens() {}

  static String authority(String tenantId) {
    return AUTHORITY_BASE + (tenantId == null || tenantId.isBlank() ? "organizations" : tenantId.trim());
  }

  static IAuthenticationResult await(CompletableFuture<IAuthenticationResult> future, String flow) {
    try {
      IAuthenticationResult result = future.join();
      if (result == null) {
        throw new AuthException(AuthException.Kind.AUTH_FAILED, flow + " sign-in returned no result", null);
      }
      return result;
    } catch (CompletionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      throw new AuthException(AuthException.Kind.AUTH_FAILED,
          flow + " sign-in failed: " + TelemetrySanitizer.sanitizeErrorMessage(cause.getMessage()),
          "Check the tenantId and clientId in the profile and try again.", cause);
    }
  }

  static AuthResult toResult(IAuthenticationResult result, String fallbackUser) {
    String user = result.account() != null && result.account().username() != null
        ? result.account().username()
        : fallbackUser;
    Instant expiresOn = result.expiresOnDate() == null ? null : result.expiresOnDate().toInstant();
    return new AuthResult(true, result.accessToken(), user, expiresOn);
  }
}
