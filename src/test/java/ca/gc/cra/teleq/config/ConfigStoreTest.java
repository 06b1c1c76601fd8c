package ca.gc.cra.teleq.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigStoreTest {
  @TempDir Path temp;

  private Path cwd;
  private Path workspace;
  private Path home;

  @BeforeEach
  void setUp() throws IOException {
    cwd = Files.createDirectories(temp.resolve("cwd"));
    workspace = Files.createDirectories(temp.resolve("workspace"));
    home = Files.createDirectories(temp.resolve("home"));
  }

  @Test
  void workingDirectoryWinsOverWorkspaceAndHome() throws IOException {
    write(workspace.resolve(ConfigStore.FILE_NAME), "{\"connectionName\":\"workspace\"}");
    write(home.resolve(ConfigStore.FILE_NAME), "{\"connectionName\":\"home\"}");
    write(cwd.resolve(ConfigStore.FILE_NAME), "{\"connectionName\":\"cwd\"}");

    ConfigStore store = new ConfigStore(cwd, workspace, home);

    assertEquals("cwd", store.load(null).root().get("connectionName"));
  }

  @Test
  void fallsBackThroughWorkspaceThenHomeDirectories() throws IOException {
    write(home.resolve(".bctb").resolve("config.json"), "{\"connectionName\":\"home-dir\"}");
    write(home.resolve(ConfigStore.FILE_NAME), "{\"connectionName\":\"home-file\"}");
    ConfigStore store = new ConfigStore(cwd, workspace, home);

    assertEquals("home-dir", store.load(null).root().get("connectionName"));

    write(workspace.resolve(ConfigStore.FILE_NAME), "{\"connectionName\":\"workspace\"}");
    assertEquals("workspace", store.load(null).root().get("connectionName"));
  }

  @Test
  void missingConfigurationListsSearchedLocations() {
    ConfigStore store = new ConfigStore(cwd, null, home);

    ConfigException ex = assertThrows(ConfigException.class, () -> store.load(null));

    assertEquals(ConfigException.Kind.CONFIG_NOT_FOUND, ex.kind());
    assertTrue(ex.getMessage().contains("teleq init"), ex.getMessage());
    assertEquals(3, store.candidates().size());
  }

  @Test
  void explicitPathMustExist() {
    ConfigStore store = new ConfigStore(cwd, workspace, home);

    ConfigException ex = assertThrows(ConfigException.class, () -> store.load(Path.of("nope.json")));

    assertEquals(ConfigException.Kind.CONFIG_NOT_FOUND, ex.kind());
  }

  @Test
  void explicitRelativePathResolvesAgainstWorkingDirectory() throws IOException {
    write(cwd.resolve("conf").resolve("team.yaml"), "connectionName: team\n");
    ConfigStore store = new ConfigStore(cwd, workspace, home);

    ConfigurationDocument document = store.load(Path.of("conf/team.yaml"));

    assertEquals("team", document.root().get("connectionName"));
    assertEquals(cwd.resolve("conf").resolve("team.yaml"), document.source().orElseThrow());
  }

  @Test
  void templateIsWrittenOnceAndParsesBack() {
    ConfigStore store = new ConfigStore(cwd, workspace, home);

    Path written = store.writeTemplate(Path.of(ConfigStore.FILE_NAME));
    ConfigurationDocument document = store.read(written);

    assertEquals("default", document.defaultProfile().orElseThrow());
    assertEquals(workspace.toString(), document.profiles().get("default").get("workspacePath"));
    ConfigException ex = assertThrows(ConfigException.class, () -> store.writeTemplate(Path.of(ConfigStore.FILE_NAME)));
    assertEquals(ConfigException.Kind.INVALID_INPUT, ex.kind());
  }

  @Test
  void effectiveWorkspaceDefaultsToWorkingDirectory() {
    assertEquals(cwd, new ConfigStore(cwd, null, home).effectiveWorkspaceRoot());
    assertEquals(workspace, new ConfigStore(cwd, workspace, home).effectiveWorkspaceRoot());
  }

  private static void write(Path file, String text) throws IOException {
    Files.createDirectories(file.getParent());
    Files.writeString(file, text, StandardCharsets.UTF_8);
  }
}
