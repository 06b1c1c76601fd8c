package ca.gc.cra.teleq.api;

import ca.gc.cra.teleq.config.CompositionRoot;
import ca.gc.cra.teleq.config.ConfigStore;
import ca.gc.cra.teleq.logging.LoggingConfigurator;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code teleq init}: writes a starter multi-profile configuration file.
 *
 * @since 0.1.0
 */
public final class InitCli {
  private static final Logger log = LoggerFactory.getLogger(InitCli.class);
  private static final String SUMMARY_USAGE = "usage: teleq init [output=PATH]";
  private static final String HELP_TEXT = """
      Create a configuration template

      Usage:
        teleq init [output=PATH]

      Optional:
        output=PATH   File to create (default ./.bctb-config.json); existing files are never overwritten
        --verbose     Enable DEBUG logging
        --help        Show this message
      """;

  private InitCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Path output;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      String value = ConfigCliUtils.remove(kv, "output");
      ConfigCliUtils.rejectUnknown(kv);
      output = Path.of(value == null ? ConfigStore.FILE_NAME : value);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = CliSupport.root()) {
      Path written = root.configStore().writeTemplate(output);
      CliPrinter.printLines(
          "Created configuration template: " + written,
          "Edit applicationInsightsAppId and authFlow, then run 'teleq validate'.");
      return ExitCode.SUCCESS;
    } catch (RuntimeException ex) {
      return CliSupport.fail(log, "init", ex);
    }
  }
}
