package ca.gc.cra.teleq.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.teleq.application.json.JsonSupport;
import ca.gc.cra.teleq.application.telemetry.DependencyCall;
import ca.gc.cra.teleq.infrastructure.cache.FileQueryCache;
import ca.gc.cra.teleq.infrastructure.exec.CommandRunner.CommandResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class QueryCliTest {
  @TempDir Path temp;

  private CliHarness harness;

  @BeforeEach
  void setUp() {
    harness = new CliHarness(temp);
    harness.writeDefaultConfig();
  }

  @AfterEach
  void tearDown() {
    harness.close();
  }

  @Test
  void printsTableAndCachesResult() {
    harness.transport.respond(200, CliHarness.TABLE_JSON);

    assertEquals(ExitCode.SUCCESS, QueryCli.run(new String[] {"kql=customEvents | summarize count() by name"}));

    String expected = String.join(System.lineSeparator(),
        "Returned 2 row(s) with 2 column(s)",
        "name | count_",
        "PageView | 12",
        "Error | 3") + System.lineSeparator();
    assertEquals(expected, harness.output());
    assertEquals("cli-token", harness.transport.requests.get(0).bearerToken());
    assertTrue(Files.isDirectory(harness.workspace.resolve(FileQueryCache.RELATIVE_DIRECTORY)));
  }

  @Test
  void secondRunIsServedFromTheCache() {
    harness.transport.respond(200, CliHarness.TABLE_JSON);
    String[] args = {"kql=customEvents | summarize count() by name", "name=EventCounts"};

    assertEquals(ExitCode.SUCCESS, QueryCli.run(args));
    assertEquals(ExitCode.SUCCESS, QueryCli.run(args));

    assertTrue(harness.output().contains("Returned 2 row(s) with 2 column(s) (cached)"), harness.output());
    assertEquals(1, harness.transport.requests.size());
    List<DependencyCall> calls = harness.sink.dependencies;
    assertEquals(2, calls.size());
    assertEquals("false", calls.get(0).properties().get("cacheHit"));
    assertEquals("true", calls.get(1).properties().get("cacheHit"));
    assertEquals("EventCounts", calls.get(1).properties().get("queryName"));
  }

  @Test
  void savedQueryRunsByNameAndLabelsTelemetry() throws Exception {
    Path folder = Files.createDirectories(harness.workspace.resolve("queries/Usage"));
    Files.writeString(folder.resolve("Event counts.kql"),
        "// Query: Event counts\n// Tags: usage\n\ncustomEvents | summarize count() by name\n");
    harness.transport.respond(200, CliHarness.TABLE_JSON);

    assertEquals(ExitCode.SUCCESS, QueryCli.run(new String[] {"saved=event counts"}));

    assertEquals("{\"query\":\"customEvents | summarize count() by name\"}",
        harness.transport.requests.get(0).jsonBody());
    assertEquals("Event counts", harness.sink.dependencies.get(0).properties().get("queryName"));
  }

  @Test
  void savedAndKqlAreMutuallyExclusiveAndUnknownSavedQueryFails() {
    assertEquals(ExitCode.INVALID_ARGS, QueryCli.run(new String[] {"kql=traces", "saved=x"}));
    assertEquals(0, harness.rootsCreated);

    assertEquals(ExitCode.CONFIG_ERROR, QueryCli.run(new String[] {"saved=missing"}));
    assertTrue(harness.transport.requests.isEmpty());
  }

  @Test
  void jsonOutputIncludesCachedFlag() {
    harness.transport.respond(200, CliHarness.TABLE_JSON);

    assertEquals(ExitCode.SUCCESS, QueryCli.run(new String[] {"kql=customEvents", "limit=1", "--json"}));

    Map<String, Object> document = new JsonSupport().parseObject(harness.output());
    assertEquals(List.of("name", "count_"), document.get("columns"));
    assertEquals(1, ((List<?>) document.get("rows")).size());
    assertEquals(Boolean.FALSE, document.get("cached"));
    assertEquals("Returned 1 row(s) with 2 column(s) (limited from 2)", document.get("summary"));
  }

  @Test
  void rejectedQueryIsAQueryFailure() {
    harness.transport.respond(400, "{\"error\":{\"message\":\"Syntax error\"}}");

    assertEquals(ExitCode.QUERY_FAILURE, QueryCli.run(new String[] {"kql=customEvents |"}));
    assertEquals(1, harness.sink.exceptions.size());
    assertEquals("query", harness.sink.exceptions.get(0).get("command"));
    assertFalse(harness.sink.dependencies.get(0).success());
  }

  @Test
  void dangerousQueryFailsWithoutNetwork() {
    assertEquals(ExitCode.QUERY_FAILURE, QueryCli.run(new String[] {"kql=.drop table customEvents"}));
    assertTrue(harness.transport.requests.isEmpty());
  }

  @Test
  void incompleteProfileIsAConfigError() {
    assertEquals(ExitCode.CONFIG_ERROR, QueryCli.run(new String[] {"kql=traces", "profile=dev"}));
    assertEquals(0, harness.azureCliCalls);
  }

  @Test
  void authFailureStopsBeforeQuerying() {
    harness.azureCli = new CommandResult(127, "", "");

    assertEquals(ExitCode.AUTH_FAILURE, QueryCli.run(new String[] {"kql=traces"}));
    assertTrue(harness.transport.requests.isEmpty());
  }

  @Test
  void argumentErrorsAreInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, QueryCli.run(new String[0]));
    assertEquals(ExitCode.INVALID_ARGS, QueryCli.run(new String[] {"kql=traces", "limit=-1"}));
    assertEquals(ExitCode.INVALID_ARGS, QueryCli.run(new String[] {"kql=traces", "limit=ten"}));
    assertEquals(ExitCode.INVALID_ARGS, QueryCli.run(new String[] {"kql=traces", "timeout=5"}));
    assertEquals(ExitCode.INVALID_ARGS, QueryCli.run(new String[] {"kql=traces", "otelEndpoint=ftp://x"}));
    assertEquals(0, harness.rootsCreated);
  }
}
