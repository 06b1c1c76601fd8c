package ca.gc.cra.teleq.api;

import ca.gc.cra.teleq.application.port.QueryLibrary;
import ca.gc.cra.teleq.application.query.SavedQuery;
import ca.gc.cra.teleq.config.CompositionRoot;
import ca.gc.cra.teleq.config.ResolvedProfile;
import ca.gc.cra.teleq.logging.LoggingConfigurator;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code teleq queries}: lists, searches, shows and saves the {@code .kql} files in a profile's queries folder.
 */
public final class QueriesCli {
  private static final Logger log = LoggerFactory.getLogger(QueriesCli.class);
  private static final Set<String> ACTIONS = Set.of("list", "search", "show", "save", "categories");
  private static final List<String> COLUMNS = List.of("Category", "Name", "File", "Tags");
  private static final String SUMMARY_USAGE =
      "usage: teleq queries <list|search|show|save|categories> [options] [config=PATH] [profile=NAME]";
  private static final String HELP_TEXT = """
      Manage saved queries

      Usage:
        teleq queries <action> [options] [config=PATH] [profile=NAME]

      Actions:
        list [category=NAME]              List saved queries
        search terms="a,b"                Rank saved queries by name, tags, purpose and text
        show name=NAME                    Print one saved query
        save name=NAME kql=TEXT           Save a query; optional purpose=, useCase=, tags=a,b and category=
        categories                        List category folders

      Queries live under <workspacePath>/<queriesFolder> (default: queries). Run one with
      teleq query saved=NAME.
      """;

  private QueriesCli() {}

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
      log.error("Missing queries action");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String action = remainder[0].toLowerCase(Locale.ROOT);
    if (!ACTIONS.contains(action)) {
      log.error("Unknown queries action: {}", action);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Path configPath;
    String profileName;
    Map<String, String> options;
    try {
      Map<String, String> kv = new LinkedHashMap<>(
          CliArgsParser.toMap(Arrays.copyOfRange(remainder, 1, remainder.length)));
      configPath = ConfigCliUtils.extractConfigPath(kv);
      profileName = ConfigCliUtils.extractProfile(kv);
      options = takeOptions(action, kv);
      ConfigCliUtils.rejectUnknown(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = CliSupport.root()) {
      ResolvedProfile profile = root.resolveProfile(configPath, profileName);
      QueryLibrary library = root.libraryFor(profile);
      switch (action) {
        case "list" -> {
          String category = options.get("category");
          List<SavedQuery> queries = new ArrayList<>();
          for (SavedQuery query : library.list()) {
            if (category == null || query.category().equalsIgnoreCase(category)) {
              queries.add(query);
            }
          }
          printQueries(queries);
        }
        case "search" -> printQueries(library.search(SavedQuery.splitTags(options.get("terms"))));
        case "show" -> {
          Optional<SavedQuery> query = library.find(options.get("name"));
          if (query.isEmpty()) {
            log.error("No saved query named '{}'", options.get("name"));
            return ExitCode.INVALID_ARGS;
          }
          CliPrinter.println(query.get().kql());
        }
        case "save" -> {
          SavedQuery saved = library.save(new QueryLibrary.Draft(options.get("name"), options.get("kql"),
              options.get("purpose"), options.get("useCase"),
              options.containsKey("tags") ? SavedQuery.splitTags(options.get("tags")) : List.of(),
              options.get("category")));
          CliPrinter.println("Saved '" + saved.name() + "' as " + saved.category() + "/" + saved.fileName());
        }
        default -> {
          List<String> categories = library.categories();
          if (categories.isEmpty()) {
            CliPrinter.println("No categories.");
          } else {
            categories.forEach(CliPrinter::println);
          }
        }
      }
      return ExitCode.SUCCESS;
    } catch (RuntimeException ex) {
      return CliSupport.fail(log, "queries", ex);
    }
  }

  private static Map<String, String> takeOptions(String action, Map<String, String> kv) {
    Map<String, String> options = new LinkedHashMap<>();
    if (action.equals("list")) {
      take(kv, options, "category");
    } else if (action.equals("search")) {
      require(kv, options, "terms");
    } else if (action.equals("show")) {
      require(kv, options, "name");
    } else if (action.equals("save")) {
      require(kv, options, "name");
      require(kv, options, "kql");
      take(kv, options, "purpose");
      take(kv, options, "useCase");
      take(kv, options, "tags");
      take(kv, options, "category");
    }
    return options;
  }

  private static void take(Map<String, String> kv, Map<String, String> options, String key) {
    String value = ConfigCliUtils.remove(kv, key);
    if (value != null) {
      options.put(key, value);
    }
  }

  private static void require(Map<String, String> kv, Map<String, String> options, String key) {
    take(kv, options, key);
    if (!options.containsKey(key)) {
      throw new IllegalArgumentException(key + " is required");
    }
  }

  private static void printQueries(List<SavedQuery> queries) {
    if (queries.isEmpty()) {
      CliPrinter.println("No saved queries.");
      return;
    }
    List<List<String>> rows = new ArrayList<>();
    for (SavedQuery query : queries) {
      rows.add(List.of(query.category(), query.name(), query.fileName(), String.join(", ", query.tags())));
    }
    CliPrinter.println(queries.size() + " saved quer" + (queries.size() == 1 ? "y" : "ies") + ":");
    CliPrinter.printTable(COLUMNS, rows);
  }
}
