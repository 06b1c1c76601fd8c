package ca.gc.cra.teleq.api;

import ca.gc.cra.teleq.config.CompositionRoot;
import ca.gc.cra.teleq.config.ConfigValidator;
import ca.gc.cra.teleq.config.ResolvedProfile;
import ca.gc.cra.teleq.logging.LoggingConfigurator;
import ca.gc.cra.teleq.logging.Logs;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code teleq validate}: resolves a profile and reports missing or inconsistent settings.
 *
 * @since 0.1.0
 */
public final class ValidateCli {
  private static final Logger log = LoggerFactory.getLogger(ValidateCli.class);
  private static final String SUMMARY_USAGE = "usage: teleq validate [config=PATH] [profile=NAME]";
  private static final String HELP_TEXT = """
      Validate a configuration profile

      Usage:
        teleq validate [config=PATH] [profile=NAME]

      Optional:
        config=PATH    Configuration file (default: discovery)
        profile=NAME   Profile to check (default: BCTB_PROFILE, then defaultProfile)
        --verbose      Enable DEBUG logging
        --help         Show this message
      """;

  private ValidateCli() {}

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
      ConfigCliUtils.rejectUnknown(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = CliSupport.root()) {
      ResolvedProfile profile = root.resolveProfile(configPath, profileName);
      printProfile(profile);
      List<String> problems = ConfigValidator.validate(profile);
      if (!problems.isEmpty()) {
        CliPrinter.println("Configuration has " + problems.size() + " problem(s):");
        for (String problem : problems) {
          CliPrinter.println("  - " + problem);
        }
        return ExitCode.CONFIG_ERROR;
      }
      CliPrinter.println("Configuration is valid.");
      return ExitCode.SUCCESS;
    } catch (RuntimeException ex) {
      return CliSupport.fail(log, "validate", ex);
    }
  }

  private static void printProfile(ResolvedProfile profile) {
    CliPrinter.printLines(
        "Profile        : " + profile.name(),
        "Connection     : " + profile.connectionName(),
        "Auth flow      : " + profile.authFlow().configValue(),
        "Tenant         : " + orUnset(profile.tenantId()),
        "Client secret  : " + Logs.redact(profile.clientSecret()),
        "App id         : " + orUnset(profile.applicationInsightsAppId()),
        "Cluster        : " + orUnset(profile.kustoClusterUrl()),
        "Workspace      : " + profile.workspacePath(),
        "Cache          : " + (profile.cacheEnabled() ? "enabled, ttl " + profile.cacheTtlSeconds() + "s" : "disabled"),
        "Remove PII     : " + profile.removePii());
  }

  private static String orUnset(String value) {
    return value == null || value.isBlank() ? "<unset>" : value;
  }
}
