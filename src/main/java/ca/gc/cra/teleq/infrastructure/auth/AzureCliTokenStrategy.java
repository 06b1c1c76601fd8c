package ca.gc.cra.teleq.infrastructure.auth;

import ca.gc.cra.teleq.application.auth.AuthException;
import ca.gc.cra.teleq.application.auth.AuthResult;
import ca.gc.cra.teleq.application.auth.TokenStrategy;
import ca.gc.cra.teleq.application.json.JsonSupport;
import ca.gc.cra.teleq.application.telemetry.TelemetrySanitizer;
import ca.gc.cra.teleq.config.AuthFlow;
import ca.gc.cra.teleq.config.ResolvedProfile;
import ca.gc.cra.teleq.infrastructure.exec.CommandRunner;
import ca.gc.cra.teleq.infrastructure.exec.CommandRunner.CommandResult;
import ca.gc.cra.teleq.logging.Logs;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Obtains a token from the locally signed-in Azure CLI.
 *
 * <p>Runs {@code az account get-access-token --resource https://api.applicationinsights.io --output json}.
 * Expiry comes from {@code expires_on} (epoch seconds) when present, otherwise from the local-time
 * {@code expiresOn} field.</p>
 */
public final class AzureCliTokenStrategy implements TokenStrategy {
  private static final Logger log = LoggerFactory.getLogger(AzureCliTokenStrategy.class);

  static final String RESOURCE = "https://api.applicationinsights.io";
  static final List<String> COMMAND =
      List.of("az", "account", "get-access-token", "--resource", RESOURCE, "--output", "json");
  private static final Duration TIMEOUT = Duration.ofSeconds(60);
  private static final DateTimeFormatter EXPIRES_ON =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSSSSS]", Locale.ROOT);
  private static final String INSTALL_HINT =
      "Install the Azure CLI from https://learn.microsoft.com/cli/azure/install-azure-cli and make sure 'az' is on"
          + " the PATH.";
  private static final String LOGIN_HINT = "Run 'az login' in a terminal and try again.";

  private final CommandRunner runner;
  private final JsonSupport json;
  private final ZoneId zone;

  /**
   * Creates the strategy.
   *
   * @param runner process runner
   */
  public AzureCliTokenStrategy(CommandRunner runner) {
    this(runner, ZoneId.systemDefault());
  }

  AzureCliTokenStrategy(CommandRunner runner, ZoneId zone) {
    this.runner = Objects.requireNonNull(runner, "runner");
    this.zone = Objects.requireNonNull(zone, "zone");
    this.json = new JsonSupport();
  }

  @Override
  public AuthFlow flow() {
    return AuthFlow.AZURE_CLI;
  }

  @Override
  public AuthResult acquire(ResolvedProfile profile) {
    CommandResult result;
    try {
      result = runner.run(COMMAND, TIMEOUT);
    } catch (IOException ex) {
      throw new AuthException(AuthException.Kind.CLI_NOT_INSTALLED,
          "Azure CLI could not be started: " + ex.getMessage(), INSTALL_HINT, ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new AuthException(AuthException.Kind.AUTH_FAILED,
          "Interrupted while waiting for the Azure CLI", null, ex);
    }
    if (result.exitCode() != 0) {
      throw classifyFailure(result);
    }
    if (!result.stderr().isBlank()) {
      log.debug("Azure CLI stderr: {}", Logs.truncate(result.stderr().trim(), 512));
    }
    return parse(result.stdout());
  }

  AuthResult parse(String stdout) {
    Map<String, Object> response;
    try {
      response = json.parseObject(stdout);
    } catch (IllegalArgumentException ex) {
      throw new AuthException(AuthException.Kind.AUTH_FAILED,
          "Azure CLI returned output that is not a token response", LOGIN_HINT, ex);
    }
    Object token = response.get("accessToken");
    if (!(token instanceof String accessToken) || accessToken.isBlank()) {
      throw new AuthException(AuthException.Kind.AUTH_FAILED, "No access token returned from Azure CLI", LOGIN_HINT);
    }
    Object subscription = response.get("subscription");
    String user = subscription == null ? "Azure CLI User" : subscription.toString();
    log.debug("Azure CLI token acquired for tenant {}", response.get("tenant"));
    return new AuthResult(true, accessToken, user, expiry(response));
  }

  private Instant expiry(Map<String, Object> response) {
    Object epoch = response.get("expires_on");
    if (epoch instanceof Number seconds) {
      return Instant.ofEpochSecond(seconds.longValue());
    }
    if (epoch instanceof String text && !text.isBlank()) {
      try {
        return Instant.ofEpochSecond(Long.parseLong(text.trim()));
      } catch (NumberFormatException ex) {
        log.debug("Ignoring non-numeric expires_on value", ex);
      }
    }
    Object local = response.get("expiresOn");
    if (local instanceof String text && !text.isBlank()) {
      try {
        return LocalDateTime.parse(text.trim(), EXPIRES_ON).atZone(zone).toInstant();
      } catch (DateTimeParseException ex) {
        log.debug("Unable to parse Azure CLI expiresOn value; assuming default lifetime", ex);
      }
    }
    return null;
  }

  private static AuthException classifyFailure(CommandResult result) {
    String stderr = result.stderr();
    String lower = stderr.toLowerCase(Locale.ROOT);
    if (result.exitCode() == 127 || lower.contains("command not found") || lower.contains("not recognized")) {
      return new AuthException(AuthException.Kind.CLI_NOT_INSTALLED,
          "Azure CLI is not installed or not on the PATH", INSTALL_HINT);
    }
    if (lower.contains("az login") || lower.contains("please run 'az login'") || lower.contains("not logged in")) {
      return new AuthException(AuthException.Kind.CLI_NOT_LOGGED_IN,
          "Azure CLI has no signed-in account", LOGIN_HINT);
    }
    String detail = Logs.truncate(TelemetrySanitizer.sanitizeErrorMessage(stderr.trim()), 512);
    return new AuthException(AuthException.Kind.AUTH_FAILED,
        "Azure CLI exited with status " + result.exitCode() + (detail.isEmpty() ? "" : ": " + detail),
        LOGIN_HINT);
  }
}
