package ca.gc.cra.teleq.api;

import ca.gc.cra.teleq.application.port.QueryCache;
import ca.gc.cra.teleq.application.query.CacheStats;
import ca.gc.cra.teleq.config.CompositionRoot;
import ca.gc.cra.teleq.config.ResolvedProfile;
import ca.gc.cra.teleq.logging.LoggingConfigurator;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code teleq cache}: inspects or empties the query cache of a profile's workspace.
 */
public final class CacheCli {
  private static final Logger log = LoggerFactory.getLogger(CacheCli.class);
  private static final String SUMMARY_USAGE =
      "usage: teleq cache <stats|clear|purge> [config=PATH] [profile=NAME]";
  private static final String HELP_TEXT = """
      Manage the query cache

      Usage:
        teleq cache <stats|clear|purge> [config=PATH] [profile=NAME]

      Actions:
        stats   Show entry count, expired entries, size and location
        clear   Delete every cached result
        purge   Delete expired and unreadable entries only
      """;

  private CacheCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String[] remainder = input.keyValueArgs();
    if (remainder.length == 0 || remainder[0].contains("=")) {
      log.error("Missing cache action");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String action = remainder[0].toLowerCase(Locale.ROOT);
    if (!action.equals("stats") && !action.equals("clear") && !action.equals("purge")) {
      log.error("Unknown cache action: {}", action);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Path configPath;
    String profileName;
    try {
      Map<String, String> kv = new LinkedHashMap<>(
          CliArgsParser.toMap(Arrays.copyOfRange(remainder, 1, remainder.length)));
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
      QueryCache cache = root.cacheFor(profile);
      switch (action) {
        case "stats" -> {
          CacheStats stats = cache.stats();
          CliPrinter.printLines(
              "Location : " + stats.location(),
              "Entries  : " + stats.entries(),
              "Expired  : " + stats.expired(),
              "Size     : " + stats.totalBytes() + " bytes");
        }
        case "clear" -> CliPrinter.println("Removed " + cache.clear() + " cached result(s).");
        default -> CliPrinter.println("Removed " + cache.purgeExpired() + " expired result(s).");
      }
      return ExitCode.SUCCESS;
    } catch (RuntimeException ex) {
      return CliSupport.fail(log, "cache", ex);
    }
  }
}
