package ca.gc.cra.teleq.api;

import ca.gc.cra.teleq.application.TelemetryQueryClient;
import ca.gc.cra.teleq.application.auth.AuthResult;
import ca.gc.cra.teleq.application.telemetry.UsageTelemetryGate;
import ca.gc.cra.teleq.config.CompositionRoot;
import ca.gc.cra.teleq.config.ResolvedProfile;
import ca.gc.cra.teleq.logging.LoggingConfigurator;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code teleq test-auth}: forces a sign-in with the profile's auth flow and reports who was authenticated.
 * The token itself is never printed.
 *
 * @since 0.1.0
 */
public final class TestAuthCli {
  private static final Logger log = LoggerFactory.getLogger(TestAuthCli.class);
  private static final String SUMMARY_USAGE = "usage: teleq test-auth [config=PATH] [profile=NAME]";
  private static final String HELP_TEXT = """
      Test authentication for a profile

      Usage:
        teleq test-auth [config=PATH] [profile=NAME]

      Optional:
        config=PATH                       Configuration file (default: discovery)
        profile=NAME                      Profile to use
        metricsExporter=otlp|logging|none Usage telemetry exporter (default otlp)
        otelEndpoint=URL                  OTLP endpoint when exporter=otlp
        --verbose                         Enable DEBUG logging
        --help                            Show this message
      """;

  private TestAuthCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Path configPath;
    String profileName;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      configPath = ConfigCliUtils.extractConfigPath(kv);
      profileName = ConfigCliUtils.extractProfile(kv);
      TelemetryConfigurator.configureMetrics(kv);
      ConfigCliUtils.rejectUnknown(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = CliSupport.root()) {
      ResolvedProfile profile = root.resolveProfile(configPath, profileName);
      TelemetryQueryClient client = root.client(profile.telemetry());
      UsageTelemetryGate usage = client.usageTelemetry();
      try {
        AuthResult result = client.authenticate(profile);
        CliPrinter.printLines(
            "Authenticated profile '" + profile.name() + "' using " + profile.authFlow().configValue(),
            "User           : " + (result.user() == null ? "<unknown>" : result.user()),
            "Token expires  : " + (result.expiresOn() == null ? "<unknown>" : result.expiresOn()));
        usage.trackEvent("Auth.Succeeded", Map.of("authFlow", profile.authFlow().configValue()), Map.of());
        return ExitCode.SUCCESS;
      } catch (RuntimeException ex) {
        usage.trackException(ex, Map.of("command", "test-auth", "authFlow", profile.authFlow().configValue()));
        throw ex;
      } finally {
        usage.flush();
      }
    } catch (RuntimeException ex) {
      return CliSupport.fail(log, "test-auth", ex);
    }
  }
}
