package ca.gc.cra.teleq.api;

import ca.gc.cra.teleq.config.CompositionRoot;
import ca.gc.cra.teleq.config.ConfigStore;
import ca.gc.cra.teleq.infrastructure.exec.CommandRunner;
import ca.gc.cra.teleq.infrastructure.exec.CommandRunner.CommandResult;
import ca.gc.cra.teleq.testutil.CannedQueryTransport;
import ca.gc.cra.teleq.testutil.MutableClock;
import ca.gc.cra.teleq.testutil.RecordingUsageSink;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Wires the CLI to an in-process composition root backed by test doubles and a temporary workspace.
 */
final class CliHarness implements AutoCloseable {
  static final long START_MILLIS = 1_700_000_000_000L;
  static final String CLI_TOKEN_JSON =
      "{\"accessToken\":\"cli-token\",\"expires_on\":1700003600,\"subscription\":\"Contoso Sub\"}";
  static final String TABLE_JSON = "{\"tables\":[{\"name\":\"PrimaryResult\","
      + "\"columns\":[{\"name\":\"name\"},{\"name\":\"count_\"}],"
      + "\"rows\":[[\"PageView\",12],[\"Error\",3]]}]}";

  final Path cwd;
  final Path workspace;
  final Path home;
  final Map<String, String> env = new HashMap<>();
  final CannedQueryTransport transport = new CannedQueryTransport();
  final RecordingUsageSink sink = new RecordingUsageSink();
  final MutableClock clock = new MutableClock(START_MILLIS);
  final StringWriter output = new StringWriter();
  CommandResult azureCli = new CommandResult(0, CLI_TOKEN_JSON, "");
  int azureCliCalls;
  int rootsCreated;

  CliHarness(Path temp) {
    try {
      this.cwd = Files.createDirectories(temp.resolve("cwd"));
      this.workspace = Files.createDirectories(temp.resolve("workspace"));
      this.home = Files.createDirectories(temp.resolve("home"));
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    CliPrinter.setWriterForTesting(new PrintWriter(output, true));
    CliSupport.setRootForTesting(this::newRoot);
  }

  private CompositionRoot newRoot() {
    rootsCreated++;
    CommandRunner runner = (command, timeout) -> {
      azureCliCalls++;
      return azureCli;
    };
    return new CompositionRoot(env::get, new ConfigStore(cwd, workspace, home), transport, () -> sink, runner,
        clock, message -> CliPrinter.println(message));
  }

  /** Writes the standard two-profile configuration into the working directory. */
  Path writeDefaultConfig() {
    return writeConfig(ConfigStore.FILE_NAME, "{"
        + "\"defaultProfile\":\"prod\","
        + "\"profiles\":{"
        + "\"prod\":{\"connectionName\":\"Production\",\"authFlow\":\"azure_cli\","
        + "\"applicationInsightsAppId\":\"app-prod\","
        + "\"kustoClusterUrl\":\"https://ade.applicationinsights.io/subscriptions/x\","
        + "\"clientSecret\":\"${BC_SECRET}\",\"cacheTTLSeconds\":600},"
        + "\"dev\":{\"extends\":\"prod\",\"connectionName\":\"Development\",\"applicationInsightsAppId\":\"\"}"
        + "}}");
  }

  Path writeConfig(String name, String json) {
    Path file = cwd.resolve(name);
    try {
      Files.writeString(file, json, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    return file;
  }

  String output() {
    return output.toString();
  }

  @Override
  public void close() {
    CliPrinter.clearTestWriter();
    CliSupport.clearRootForTesting();
  }
}
