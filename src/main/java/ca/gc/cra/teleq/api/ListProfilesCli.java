package ca.gc.cra.teleq.api;

import ca.gc.cra.teleq.config.CompositionRoot;
import ca.gc.cra.teleq.config.ProfileSummary;
import ca.gc.cra.teleq.logging.LoggingConfigurator;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code teleq list-profiles}: prints the profiles a configuration declares.
 */
public final class ListProfilesCli {
  private static final Logger log = LoggerFactory.getLogger(ListProfilesCli.class);
  private static final String SUMMARY_USAGE = "usage: teleq list-profiles [config=PATH]";
  private static final String HELP_TEXT = """
      List configuration profiles

      Usage:
        teleq list-profiles [config=PATH]

      The default profile is marked with '*'.
      """;

  private ListProfilesCli() {}

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
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      configPath = ConfigCliUtils.extractConfigPath(kv);
      ConfigCliUtils.rejectUnknown(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = CliSupport.root()) {
      List<ProfileSummary> profiles =
          root.profileResolver().listProfiles(root.configStore().load(configPath));
      for (ProfileSummary profile : profiles) {
        StringBuilder line = new StringBuilder()
            .append(profile.isDefault() ? "* " : "  ")
            .append(profile.name())
            .append("  (").append(profile.connectionName()).append(')');
        if (profile.parent() != null) {
          line.append("  extends ").append(profile.parent());
        }
        CliPrinter.println(line.toString());
      }
      return ExitCode.SUCCESS;
    } catch (RuntimeException ex) {
      return CliSupport.fail(log, "list-profiles", ex);
    }
  }
}
