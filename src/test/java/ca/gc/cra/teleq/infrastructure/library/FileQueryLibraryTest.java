package ca.gc.cra.teleq.infrastructure.library;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.teleq.application.port.QueryLibrary.Draft;
import ca.gc.cra.teleq.application.query.SavedQuery;
import ca.gc.cra.teleq.testutil.MutableClock;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileQueryLibraryTest {
  @TempDir Path workspace;

  // 2023-11-14T22:13:20Z
  private final MutableClock clock = new MutableClock(1_700_000_000_000L);

  @Test
  void readsNeverCreateTheFolder() {
    FileQueryLibrary library = FileQueryLibrary.forWorkspace(workspace, "queries", clock);

    assertTrue(library.list().isEmpty());
    assertTrue(library.search(List.of("x")).isEmpty());
    assertTrue(library.categories().isEmpty());
    assertFalse(Files.exists(workspace.resolve("queries")));
  }

  @Test
  void saveWritesHeaderIntoCategoryFolder() throws IOException {
    FileQueryLibrary library = FileQueryLibrary.forWorkspace(workspace, "queries", clock);

    SavedQuery saved = library.save(new Draft("Failed requests!", "requests | where success == false",
        "Find failures", null, List.of("errors", "requests"), "Monitoring"));

    Path file = workspace.resolve("queries/Monitoring/Failed requests.kql");
    assertTrue(Files.isRegularFile(file));
    assertEquals(String.join("\n",
        "// Query: Failed requests!",
        "// Category: Monitoring",
        "// Purpose: Find failures",
        "// Created: 2023-11-14",
        "// Tags: errors, requests",
        "",
        "requests | where success == false"), Files.readString(file, StandardCharsets.UTF_8));
    assertEquals("Monitoring", saved.category());
    assertEquals("Failed requests.kql", saved.fileName());
    assertEquals(List.of("Monitoring"), library.categories());
  }

  @Test
  void listsRecursivelyWithCategoryFromFirstFolderAndSkipsEmptyFiles() throws IOException {
    Path root = Files.createDirectories(workspace.resolve("q"));
    Files.writeString(root.resolve("top.kql"), "traces | take 1");
    Files.createDirectories(root.resolve("Perf/deep"));
    Files.writeString(root.resolve("Perf/deep/slow.kql"), "// Query: Slow pages\npageViews");
    Files.writeString(root.resolve("Perf/empty.kql"), "// Query: Nothing\n");
    Files.writeString(root.resolve("Perf/notes.txt"), "not a query");
    FileQueryLibrary library = FileQueryLibrary.forWorkspace(workspace, "q", clock);

    List<SavedQuery> queries = library.list();

    assertEquals(List.of("Slow pages", "top.kql"),
        queries.stream().map(SavedQuery::name).collect(Collectors.toList()));
    assertEquals("Perf", queries.get(0).category());
    assertEquals(SavedQuery.ROOT_CATEGORY, queries.get(1).category());
  }

  @Test
  void searchRanksByRelevanceAndDropsMisses() {
    FileQueryLibrary library = FileQueryLibrary.forWorkspace(workspace, "queries", clock);
    library.save(new Draft("Exceptions by type", "exceptions | summarize count() by type", null, null,
        List.of(), null));
    library.save(new Draft("Daily volume", "requests | summarize count() by bin(timestamp, 1d)",
        "Shows exceptions next to requests", null, List.of(), null));
    library.save(new Draft("Page views", "pageViews", null, null, List.of("browser"), null));

    List<SavedQuery> matches = library.search(List.of("exceptions", " "));

    assertEquals(List.of("Exceptions by type", "Daily volume"),
        matches.stream().map(SavedQuery::name).collect(Collectors.toList()));
    assertEquals(3, library.search(List.of()).size());
  }

  @Test
  void findMatchesNameOrFileIgnoringCase() {
    FileQueryLibrary library = FileQueryLibrary.forWorkspace(workspace, "queries", clock);
    library.save(new Draft("Page views", "pageViews", null, null, List.of(), "Web"));

    assertEquals("pageViews", library.find("page VIEWS").orElseThrow().kql());
    assertTrue(library.find("Page views.kql").isPresent());
    assertFalse(library.find("missing").isPresent());
  }

  @Test
  void saveRejectsBlankQueryAndPathLikeCategories() {
    FileQueryLibrary library = FileQueryLibrary.forWorkspace(workspace, "queries", clock);

    assertThrows(IllegalArgumentException.class,
        () -> library.save(new Draft("name", "  ", null, null, List.of(), null)));
    assertThrows(IllegalArgumentException.class,
        () -> library.save(new Draft("name", "traces", null, null, List.of(), "../outside")));
    assertThrows(IllegalArgumentException.class,
        () -> library.save(new Draft("name", "traces", null, null, List.of(), "a/b")));
    assertFalse(Files.exists(workspace.resolve("queries")));
  }

  @Test
  void absoluteQueriesFolderIsUsedAsIs(@TempDir Path elsewhere) {
    FileQueryLibrary library = FileQueryLibrary.forWorkspace(workspace, elsewhere.toString(), clock);

    library.save(new Draft("Top", "traces", null, null, List.of(), null));

    assertTrue(Files.isRegularFile(elsewhere.resolve("Top.kql")));
    assertEquals(elsewhere.toAbsolutePath().normalize(), library.directory());
  }
}
