package ca.gc.cra.teleq.infrastructure.library;

import ca.gc.cra.teleq.application.port.ClockPort;
import ca.gc.cra.teleq.application.port.QueryLibrary;
import ca.gc.cra.teleq.application.query.SavedQuery;
import ca.gc.cra.teleq.validation.Strings;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link QueryLibrary} over a folder of {@code .kql} files, by default
 * {@code <workspace>/queries}.
 * <p><strong>Layout:</strong> queries in the folder itself belong to {@value SavedQuery#ROOT_CATEGORY}; queries
 * anywhere below a subfolder belong to that subfolder's category.</p>
 * <p><strong>Storage:</strong> the folder and category subfolders are created by {@link #save}; reads never create
 * them. Unreadable files and files without query text are skipped with a DEBUG log line.</p>
 *
 * @since 0.1.0
 */
public final class FileQueryLibrary implements QueryLibrary {
  private static final Logger log = LoggerFactory.getLogger(FileQueryLibrary.class);
  private static final Pattern CATEGORY = Pattern.compile("[A-Za-z0-9][A-Za-z0-9 _-]*");

  private final Path directory;
  private final ClockPort clock;

  /**
   * Creates a library for a workspace.
   *
   * @param workspaceRoot workspace directory
   * @param queriesFolder folder relative to the workspace, or absolute
   * @param clock time source for the {@code Created} header
   * @return library; no files are touched
   */
  public static FileQueryLibrary forWorkspace(Path workspaceRoot, String queriesFolder, ClockPort clock) {
    Objects.requireNonNull(workspaceRoot, "workspaceRoot");
    return new FileQueryLibrary(workspaceRoot.resolve(Strings.requireNonBlank("queriesFolder", queriesFolder)),
        clock);
  }

  /**
   * Creates a library in an explicit directory.
   *
   * @param directory queries folder; created on first save
   * @param clock time source; {@code null} selects the system clock
   */
  public FileQueryLibrary(Path directory, ClockPort clock) {
    this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
  }

  /**
   * Returns the queries folder.
   *
   * @return absolute directory path
   */
  public Path directory() {
    return directory;
  }

  @Override
  public List<SavedQuery> list() {
    List<SavedQuery> queries = new ArrayList<>();
    for (Path file : queryFiles()) {
      read(file).ifPresent(queries::add);
    }
    log.debug("Loaded {} saved queries from {}", queries.size(), directory);
    return queries;
  }

  @Override
  public List<SavedQuery> search(List<String> terms) {
    List<String> needles = terms == null ? List.of()
        : terms.stream().map(Strings::trimToNull).filter(Objects::nonNull).collect(Collectors.toList());
    List<SavedQuery> all = list();
    if (needles.isEmpty()) {
      return all;
    }
    List<SavedQuery> matches = all.stream()
        .filter(query -> query.score(needles) > 0)
        .sorted(Comparator.comparingInt((SavedQuery query) -> query.score(needles)).reversed())
        .collect(Collectors.toList());
    log.debug("Found {} saved queries matching {}", matches.size(), needles);
    return matches;
  }

  @Override
  public Optional<SavedQuery> find(String name) {
    String wanted = Strings.requireNonBlank("name", name).toLowerCase(Locale.ROOT);
    for (SavedQuery query : list()) {
      String fileName = query.fileName().toLowerCase(Locale.ROOT);
      if (query.name().toLowerCase(Locale.ROOT).equals(wanted)
          || fileName.equals(wanted)
          || fileName.equals(wanted + SavedQuery.SUFFIX)) {
        return Optional.of(query);
      }
    }
    return Optional.empty();
  }

  @Override
  public SavedQuery save(Draft draft) {
    Objects.requireNonNull(draft, "draft");
    String name = Strings.requireNonBlank("name", draft.name());
    String kql = Strings.trimToNull(draft.kql());
    if (kql == null) {
      throw new IllegalArgumentException("kql must not be blank");
    }
    String category = Strings.trimToNull(draft.category());
    if (category != null && !CATEGORY.matcher(category).matches()) {
      throw new IllegalArgumentException("category may contain only letters, digits, spaces, '_' and '-'");
    }
    String fileName = SavedQuery.fileNameFor(name);
    Path folder = category == null ? directory : directory.resolve(category);
    Path file = folder.resolve(fileName);
    String created = LocalDate.ofInstant(Instant.ofEpochMilli(clock.nowMillis()), ZoneOffset.UTC).toString();
    String content = SavedQuery.render(name, category, draft.purpose(), draft.useCase(), created, draft.tags(), kql);
    try {
      Files.createDirectories(folder);
      Files.writeString(file, content, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to save query " + file, ex);
    }
    log.info("Saved query '{}' to {}", name, file);
    return SavedQuery.parse(fileName, category == null ? SavedQuery.ROOT_CATEGORY : category, content);
  }

  @Override
  public List<String> categories() {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    try (Stream<Path> children = Files.list(directory)) {
      return children.filter(Files::isDirectory)
          .map(path -> path.getFileName().toString())
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to list query categories in " + directory, ex);
    }
  }

  private List<Path> queryFiles() {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    try (Stream<Path> walk = Files.walk(directory)) {
      return walk.filter(Files::isRegularFile)
          .filter(path -> path.getFileName().toString().endsWith(SavedQuery.SUFFIX))
          .sorted(Comparator.comparing(path -> directory.relativize(path).toString()))
          .collect(Collectors.toList());
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to scan queries folder " + directory, ex);
    }
  }

  private Optional<SavedQuery> read(Path file) {
    try {
      String content = Files.readString(file, StandardCharsets.UTF_8);
      return Optional.of(SavedQuery.parse(file.getFileName().toString(), categoryOf(file), content));
    } catch (IOException | IllegalArgumentException ex) {
      log.debug("Skipping saved query {}: {}", file, ex.getMessage());
      return Optional.empty();
    }
  }

  private String categoryOf(Path file) {
    Path relative = directory.relativize(file.getParent());
    if (relative.toString().isEmpty()) {
      return SavedQuery.ROOT_CATEGORY;
    }
    return relative.getName(0).toString();
  }
}
