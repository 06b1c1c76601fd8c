package ca.gc.cra.teleq.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Closed set of authentication strategies a profile may select.
 *
 * @since 0.1.0
 */
public enum AuthFlow {
  /** Token from the locally signed-in Azure CLI. */
  AZURE_CLI("azure_cli"),
  /** Interactive device-code sign-in. */
  DEVICE_CODE("device_code"),
  /** Service principal with client id and secret. */
  CLIENT_CREDENTIALS("client_credentials"),
  /** Token injected by a host process through the environment. */
  VSCODE_AUTH("vscode_auth");

  private final String configValue;

  AuthFlow(String configValue) {
    this.configValue = configValue;
  }

  /**
   * Returns the spelling used in configuration files.
   *
   * @return lower-case flow name
   */
  public String configValue() {
    return configValue;
  }

  /**
   * Parses a configuration value; blank input selects {@link #AZURE_CLI}.
   *
   * @param value configured flow name
   * @return matching flow
   * @throws ConfigException with {@link ConfigException.Kind#MALFORMED_CONFIG} for unknown names
   */
  public static AuthFlow fromConfig(String value) {
    if (value == null || value.isBlank()) {
      return AZURE_CLI;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    for (AuthFlow flow : values()) {
      if (flow.configValue.equals(normalized)) {
        return flow;
      }
    }
    throw new ConfigException(ConfigException.Kind.MALFORMED_CONFIG,
        "Unknown authFlow '" + value + "'. Expected one of: "
            + Arrays.stream(values()).map(AuthFlow::configValue).collect(Collectors.joining(", ")));
  }
}
