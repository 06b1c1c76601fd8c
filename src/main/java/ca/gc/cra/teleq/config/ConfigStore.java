package ca.gc.cra.teleq.config;

import ca.gc.cra.teleq.application.json.JsonSupport;
import ca.gc.cra.teleq.validation.Strings;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Discovers and loads the raw configuration document.
 * <p><strong>Search order:</strong></p>
 * <ol>
 *   <li>an explicit path supplied by the caller (relative paths resolve against the working directory);</li>
 *   <li>{@code .bctb-config.json} in the working directory;</li>
 *   <li>{@code .bctb-config.json} in the workspace root, when one is configured;</li>
 *   <li>{@code ~/.bctb/config.json}, then {@code ~/.bctb-config.json}.</li>
 * </ol>
 * <p>The first existing file wins. A missing explicit path is not followed by discovery.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class ConfigStore {
  private static final Logger log = LoggerFactory.getLogger(ConfigStore.class);

  /** File name looked up in the working directory and workspace root. */
  public static final String FILE_NAME = ".bctb-config.json";
  /** Environment variable naming the workspace root. */
  public static final String WORKSPACE_ENV = "BCTB_WORKSPACE_PATH";

  private final Path workingDirectory;
  private final Path workspaceRoot;
  private final Path userHome;
  private final ConfigDocumentParser parser;
  private final JsonSupport json;

  /**
   * Creates a store over explicit locations.
   *
   * @param workingDirectory directory searched first during discovery
   * @param workspaceRoot optional workspace root; {@code null} skips that location
   * @param userHome user home directory
   */
  public ConfigStore(Path workingDirectory, Path workspaceRoot, Path userHome) {
    this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory").toAbsolutePath();
    this.workspaceRoot = workspaceRoot == null ? null : workspaceRoot.toAbsolutePath();
    this.userHome = Objects.requireNonNull(userHome, "userHome").toAbsolutePath();
    this.json = new JsonSupport();
    this.parser = new ConfigDocumentParser(json);
  }

  /**
   * Creates a store from the process working directory, {@code BCTB_WORKSPACE_PATH}, and {@code user.home}.
   *
   * @param env environment lookup
   * @return configured store
   */
  public static ConfigStore fromEnvironment(Function<String, String> env) {
    String workspace = Strings.trimToNull(env.apply(WORKSPACE_ENV));
    return new ConfigStore(
        Path.of(System.getProperty("user.dir")),
        workspace == null ? null : Path.of(workspace),
        Path.of(System.getProperty("user.home")));
  }

  /**
   * Returns the directory used for {@code ${workspaceFolder}} expansion and the cache root.
   *
   * @return workspace root when configured, otherwise the working directory
   */
  public Path effectiveWorkspaceRoot() {
    return workspaceRoot != null ? workspaceRoot : workingDirectory;
  }

  /**
   * Lists the discovery candidates in priority order.
   *
   * @return candidate paths; existence is not checked
   */
  public List<Path> candidates() {
    List<Path> candidates = new ArrayList<>();
    candidates.add(workingDirectory.resolve(FILE_NAME));
    if (workspaceRoot != null) {
      Path workspaceCandidate = workspaceRoot.resolve(FILE_NAME);
      if (!candidates.contains(workspaceCandidate)) {
        candidates.add(workspaceCandidate);
      }
    }
    candidates.add(userHome.resolve(".bctb").resolve("config.json"));
    candidates.add(userHome.resolve(FILE_NAME));
    return List.copyOf(candidates);
  }

  /**
   * Finds the configuration file that {@link #load(Path)} would read.
   *
   * @param explicitPath optional caller-supplied path
   * @return located file, or empty when discovery finds nothing
   * @throws ConfigException with {@link ConfigException.Kind#CONFIG_NOT_FOUND} when an explicit path does not exist
   */
  public Optional<Path> locate(Path explicitPath) {
    if (explicitPath != null) {
      Path resolved = workingDirectory.resolve(explicitPath).normalize();
      if (!Files.isRegularFile(resolved)) {
        throw new ConfigException(ConfigException.Kind.CONFIG_NOT_FOUND,
            "Configuration file not found: " + resolved);
      }
      return Optional.of(resolved);
    }
    for (Path candidate : candidates()) {
      if (Files.isRegularFile(candidate)) {
        log.debug("Using configuration file {}", candidate);
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }

  /**
   * Loads the configuration document.
   *
   * @param explicitPath optional caller-supplied path; {@code null} triggers discovery
   * @return parsed document
   * @throws ConfigException when no file is found, the file cannot be read, or it is malformed
   */
  public ConfigurationDocument load(Path explicitPath) {
    Path path = locate(explicitPath).orElseThrow(() -> new ConfigException(
        ConfigException.Kind.CONFIG_NOT_FOUND,
        "No configuration file found. Searched: " + candidates() + ". Run 'teleq init' to create one."));
    return read(path);
  }

  /**
   * Reads and parses a specific file.
   *
   * @param path file to read
   * @return parsed document
   * @throws ConfigException when the file is missing, unreadable, or malformed
   */
  public ConfigurationDocument read(Path path) {
    Objects.requireNonNull(path, "path");
    if (!Files.isRegularFile(path)) {
      throw new ConfigException(ConfigException.Kind.CONFIG_NOT_FOUND, "Configuration file not found: " + path);
    }
    String text;
    try {
      text = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new ConfigException(ConfigException.Kind.IO_FAILURE,
          "Unable to read configuration file " + path + ": " + ex.getMessage(), ex);
    }
    return parser.parse(text, path);
  }

  /**
   * Writes the starter multi-profile document.
   *
   * @param output target file; relative paths resolve against the working directory
   * @return absolute path written
   * @throws ConfigException with {@link ConfigException.Kind#INVALID_INPUT} when the file exists, or
   *     {@link ConfigException.Kind#IO_FAILURE} when it cannot be written
   */
  public Path writeTemplate(Path output) {
    Path target = workingDirectory.resolve(Objects.requireNonNull(output, "output")).normalize();
    if (Files.exists(target)) {
      throw new ConfigException(ConfigException.Kind.INVALID_INPUT,
          "File already exists: " + target + ". Use a different path or delete the existing file.");
    }
    String text = json.write(template(), true) + System.lineSeparator();
    try {
      Path parent = target.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(target, text, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
    } catch (FileAlreadyExistsException ex) {
      throw new ConfigException(ConfigException.Kind.INVALID_INPUT, "File already exists: " + target, ex);
    } catch (IOException ex) {
      throw new ConfigException(ConfigException.Kind.IO_FAILURE,
          "Unable to write configuration template " + target + ": " + ex.getMessage(), ex);
    }
    log.info("Created configuration template {}", target);
    return target;
  }

  Map<String, Object> template() {
    Map<String, Object> profile = new LinkedHashMap<>();
    profile.put("connectionName", "My BC Production");
    profile.put("authFlow", AuthFlow.AZURE_CLI.configValue());
    profile.put("applicationInsightsAppId", "your-app-insights-id");
    profile.put("kustoClusterUrl", "https://ade.applicationinsights.io");
    profile.put("workspacePath", effectiveWorkspaceRoot().toString());
    profile.put("queriesFolder", ResolvedProfile.DEFAULT_QUERIES_FOLDER);

    Map<String, Object> profiles = new LinkedHashMap<>();
    profiles.put(ProfileResolver.IMPLICIT_PROFILE, profile);

    Map<String, Object> cache = new LinkedHashMap<>();
    cache.put("enabled", ResolvedProfile.DEFAULT_CACHE_ENABLED);
    cache.put("ttlSeconds", ResolvedProfile.DEFAULT_CACHE_TTL_SECONDS);

    Map<String, Object> root = new LinkedHashMap<>();
    root.put(ConfigurationDocument.PROFILES, profiles);
    root.put(ConfigurationDocument.DEFAULT_PROFILE, ProfileResolver.IMPLICIT_PROFILE);
    root.put("cache", cache);
    root.put("sanitize", Map.of("removePII", ResolvedProfile.DEFAULT_REMOVE_PII));
    return root;
  }
}
