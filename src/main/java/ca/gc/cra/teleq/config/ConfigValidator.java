package ca.gc.cra.teleq.config;

import ca.gc.cra.teleq.validation.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reports settings a resolved profile still lacks before it can authenticate and query.
 *
 * <p>Never throws for incomplete profiles; callers decide whether problems are fatal.</p>
 */
public final class ConfigValidator {

  private ConfigValidator() {}

  /**
   * Lists human-readable problems with a profile.
   *
   * @param profile resolved profile
   * @return problems in a stable order; empty when the profile is usable
   */
  public static List<String> validate(ResolvedProfile profile) {
    Objects.requireNonNull(profile, "profile");
    List<String> errors = new ArrayList<>();
    if (Strings.isBlank(profile.workspacePath())) {
      errors.add("workspacePath is required - set it in the config file or via "
          + ConfigStore.WORKSPACE_ENV);
    }
    boolean needsTenant = profile.authFlow() != AuthFlow.AZURE_CLI && profile.authFlow() != AuthFlow.VSCODE_AUTH;
    if (needsTenant && Strings.isBlank(profile.tenantId())) {
      errors.add("tenantId is required for the " + profile.authFlow().configValue() + " auth flow");
    }
    if (Strings.isBlank(profile.applicationInsightsAppId())) {
      errors.add("applicationInsightsAppId is required");
    }
    if (Strings.isBlank(profile.kustoClusterUrl())) {
      errors.add("kustoClusterUrl is required");
    }
    if (profile.authFlow() == AuthFlow.CLIENT_CREDENTIALS) {
      if (Strings.isBlank(profile.clientId())) {
        errors.add("clientId is required for the client_credentials auth flow");
      }
      if (Strings.isBlank(profile.clientSecret())) {
        errors.add("clientSecret is required for the client_credentials auth flow");
      }
    }
    return List.copyOf(errors);
  }
}
