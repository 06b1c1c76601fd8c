package ca.gc.cra.teleq.api;

import ca.gc.cra.teleq.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TELEQ CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: teleq <init|validate|list-profiles|test-auth|query|queries|cache> [options]";
  private static final String HELP_TEXT = """
      TELEQ telemetry query client

      Usage:
        teleq <command> [key=value ...] [flags]

      Commands:
        init           Create a configuration template
        validate       Resolve a profile and check its settings
        list-profiles  List configured profiles
        test-auth      Sign in with a profile's auth flow
        query          Run a query (query --help for details)
        queries        List, search, show or save saved queries
        cache          Show or clear cached results (stats|clear|purge)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand

      Environment:
        BCTB_WORKSPACE_PATH  Workspace root for discovery, ${workspaceFolder} and the cache
        BCTB_PROFILE         Profile used when profile= is not given
        BCTB_ACCESS_TOKEN    Token injected by a host for authFlow vscode_auth
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    String[] safe = args == null ? new String[0] : args;
    int commandIndex = firstCommandIndex(safe);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safe);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    List<String> delegate = new ArrayList<>();
    for (int i = 0; i < safe.length; i++) {
      if (i != commandIndex) {
        delegate.add(safe[i]);
      }
    }
    if (CliInput.parse(delegate.toArray(String[]::new)).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = safe[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = delegate.toArray(String[]::new);
    return switch (command) {
      case "init" -> InitCli.run(delegateArgs);
      case "validate" -> ValidateCli.run(delegateArgs);
      case "list-profiles" -> ListProfilesCli.run(delegateArgs);
      case "test-auth" -> TestAuthCli.run(delegateArgs);
      case "query" -> QueryCli.run(delegateArgs);
      case "queries" -> QueriesCli.run(delegateArgs);
      case "cache" -> CacheCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int firstCommandIndex(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i] == null ? "" : args[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-") && !arg.contains("=") && !arg.equalsIgnoreCase("help")) {
        return i;
      }
    }
    return -1;
  }
}
