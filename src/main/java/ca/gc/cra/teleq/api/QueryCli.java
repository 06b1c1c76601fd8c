package ca.gc.cra.teleq.api;

import ca.gc.cra.teleq.application.TelemetryQueryClient;
import ca.gc.cra.teleq.application.json.JsonSupport;
import ca.gc.cra.teleq.application.query.QueryResult;
import ca.gc.cra.teleq.application.query.SavedQuery;
import ca.gc.cra.teleq.application.telemetry.UsageTelemetryGate;
import ca.gc.cra.teleq.config.CompositionRoot;
import ca.gc.cra.teleq.config.ConfigException;
import ca.gc.cra.teleq.config.ConfigValidator;
import ca.gc.cra.teleq.config.ResolvedProfile;
import ca.gc.cra.teleq.logging.LoggingConfigurator;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code teleq query}: resolves a profile, signs in, and runs one query through the cache.
 *
 * <p>Results print as a pipe-separated table, or as JSON with {@code --json}.</p>
 *
 * @since 0.1.0
 */
public final class QueryCli {
  private static final Logger log = LoggerFactory.getLogger(QueryCli.class);
  private static final String SUMMARY_USAGE =
      "usage: teleq query <kql=TEXT|saved=NAME> [limit=N] [name=LABEL] [config=PATH] [profile=NAME] [--json]";
  private static final String HELP_TEXT = """
      Run a telemetry query

      Usage:
        teleq query kql="traces | take 10" [options]

      Required (one of):
        kql=TEXT                          Query text
        saved=NAME                        Name or file of a saved query (see teleq queries)

      Optional:
        limit=N                           Maximum rows to return (0 = unlimited)
        name=LABEL                        Label reported to usage telemetry (default: the saved query name)
        config=PATH                       Configuration file (default: discovery)
        profile=NAME                      Profile to use
        metricsExporter=otlp|logging|none Usage telemetry exporter (default otlp)
        otelEndpoint=URL                  OTLP endpoint when exporter=otlp
        --json                            Print the result as JSON
        --verbose                         Enable DEBUG logging
        --help                            Show this message
      """;

  private QueryCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    boolean json = input.hasFlag("--json");

    Path configPath;
    String profileName;
    String query;
    String savedName;
    String queryName;
    int limit;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      configPath = ConfigCliUtils.extractConfigPath(kv);
      profileName = ConfigCliUtils.extractProfile(kv);
      query = ConfigCliUtils.remove(kv, "kql");
      savedName = ConfigCliUtils.remove(kv, "saved");
      queryName = ConfigCliUtils.remove(kv, "name");
      limit = ConfigCliUtils.parseNonNegativeInt(kv, "limit", 0);
      TelemetryConfigurator.configureMetrics(kv);
      ConfigCliUtils.rejectUnknown(kv);
      if (query == null && savedName == null) {
        throw new IllegalArgumentException("kql or saved is required");
      }
      if (query != null && savedName != null) {
        throw new IllegalArgumentException("kql and saved are mutually exclusive");
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = CliSupport.root()) {
      ResolvedProfile profile = root.resolveProfile(configPath, profileName);
      List<String> problems = ConfigValidator.validate(profile);
      if (!problems.isEmpty()) {
        throw new ConfigException(ConfigException.Kind.INVALID_INPUT,
            "Profile '" + profile.name() + "' is incomplete: " + String.join("; ", problems));
      }
      if (savedName != null) {
        SavedQuery saved = root.libraryFor(profile).find(savedName)
            .orElseThrow(() -> new IllegalArgumentException("No saved query named '" + savedName + "'"));
        query = saved.kql();
        queryName = queryName == null ? saved.name() : queryName;
      }
      TelemetryQueryClient client = root.client(profile.telemetry());
      UsageTelemetryGate usage = client.usageTelemetry();
      String correlationId = UUID.randomUUID().toString();
      try {
        String token = client.getAccessToken(profile);
        QueryResult result = client.runQuery(profile, query, token, correlationId, limit, queryName);
        print(result, json);
        return ExitCode.SUCCESS;
      } catch (RuntimeException ex) {
        usage.trackException(ex, Map.of("command", "query", "correlationId", correlationId));
        throw ex;
      } finally {
        usage.flush();
      }
    } catch (RuntimeException ex) {
      return CliSupport.fail(log, "query", ex);
    }
  }

  static void print(QueryResult result, boolean json) {
    if (json) {
      Map<String, Object> document = result.toMap();
      document.put("cached", result.cached());
      CliPrinter.println(new JsonSupport().write(document, true));
      return;
    }
    CliPrinter.println(result.summary() + (result.cached() ? " (cached)" : ""));
    CliPrinter.printTable(result.columns(), result.rows());
  }
}
