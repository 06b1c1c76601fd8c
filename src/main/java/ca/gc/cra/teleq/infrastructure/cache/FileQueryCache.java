package ca.gc.cra.teleq.infrastructure.cache;

import ca.gc.cra.teleq.application.json.JsonSupport;
import ca.gc.cra.teleq.application.port.ClockPort;
import ca.gc.cra.teleq.application.port.QueryCache;
import ca.gc.cra.teleq.application.query.CacheEntry;
import ca.gc.cra.teleq.application.query.CacheStats;
import ca.gc.cra.teleq.application.query.QueryFingerprint;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link QueryCache} storing one JSON file per fingerprint under
 * {@code <workspace>/.vscode/.bctb/cache}.
 * <p><strong>Format:</strong> {@code {"data": <result>, "timestamp": <epoch millis>, "ttl": <seconds>}} in a file
 * named {@code <fingerprint>.json}.</p>
 * <p><strong>Storage:</strong> The directory is created by the first {@link #put}; lookups and maintenance never
 * create it. Entries are written to a temporary sibling and moved into place so readers never see partial
 * files.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use on distinct fingerprints; concurrent stores to one
 * fingerprint resolve last-writer-wins.</p>
 *
 * @since 0.1.0
 */
public final class FileQueryCache implements QueryCache {
  private static final Logger log = LoggerFactory.getLogger(FileQueryCache.class);

  /** Cache location relative to the workspace root. */
  public static final String RELATIVE_DIRECTORY = ".vscode/.bctb/cache";
  private static final String SUFFIX = ".json";

  private final Path directory;
  private final ClockPort clock;
  private final JsonSupport json = new JsonSupport();

  /**
   * Creates a cache rooted at a workspace.
   *
   * @param workspaceRoot workspace directory; the cache lives beneath it
   * @param clock time source for timestamps and expiry
   * @return cache instance; no files are touched
   */
  public static FileQueryCache forWorkspace(Path workspaceRoot, ClockPort clock) {
    Objects.requireNonNull(workspaceRoot, "workspaceRoot");
    return new FileQueryCache(workspaceRoot.resolve(RELATIVE_DIRECTORY), clock);
  }

  /**
   * Creates a cache in an explicit directory.
   *
   * @param directory cache directory; created on first store
   * @param clock time source; {@code null} selects the system clock
   */
  public FileQueryCache(Path directory, ClockPort clock) {
    this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
  }

  /**
   * Returns the cache directory.
   *
   * @return absolute directory path
   */
  public Path directory() {
    return directory;
  }

  @Override
  public Optional<CacheEntry> get(String fingerprint) {
    Path file = fileFor(fingerprint);
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    Optional<CacheEntry> entry = read(file, fingerprint);
    if (entry.isEmpty() || entry.get().isExpired(clock.nowMillis())) {
      return Optional.empty();
    }
    return entry;
  }

  @Override
  public void put(String fingerprint, Object data, long ttlSeconds) {
    Path file = fileFor(fingerprint);
    if (ttlSeconds <= 0) {
      log.debug("Skipping cache store for {} with non-positive TTL {}", fingerprint, ttlSeconds);
      return;
    }
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("data", data);
    document.put("timestamp", clock.nowMillis());
    document.put("ttl", ttlSeconds);
    String text = json.write(document);
    Path temp = null;
    try {
      Files.createDirectories(directory);
      temp = Files.createTempFile(directory, fingerprint.substring(0, 12), ".tmp");
      Files.writeString(temp, text, StandardCharsets.UTF_8);
      move(temp, file);
      temp = null;
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write cache entry " + file, ex);
    } finally {
      if (temp != null) {
        deleteQuietly(temp);
      }
    }
  }

  @Override
  public CacheStats stats() {
    int entries = 0;
    int expired = 0;
    long bytes = 0;
    long now = clock.nowMillis();
    for (Path file : entryFiles()) {
      entries++;
      bytes += sizeOf(file);
      Optional<CacheEntry> entry = read(file, fingerprintOf(file));
      if (entry.isEmpty() || entry.get().isExpired(now)) {
        expired++;
      }
    }
    return new CacheStats(entries, expired, bytes, directory.toString());
  }

  @Override
  public int clear() {
    int removed = 0;
    for (Path file : entryFiles()) {
      if (delete(file)) {
        removed++;
      }
    }
    log.info("Cleared {} cache entries from {}", removed, directory);
    return removed;
  }

  @Override
  public int purgeExpired() {
    int removed = 0;
    long now = clock.nowMillis();
    for (Path file : entryFiles()) {
      Optional<CacheEntry> entry = read(file, fingerprintOf(file));
      if ((entry.isEmpty() || entry.get().isExpired(now)) && delete(file)) {
        removed++;
      }
    }
    log.info("Purged {} expired cache entries from {}", removed, directory);
    return removed;
  }

  private Path fileFor(String fingerprint) {
    if (!QueryFingerprint.isValid(fingerprint)) {
      throw new IllegalArgumentException("Invalid cache fingerprint");
    }
    return directory.resolve(fingerprint + SUFFIX);
  }

  private Optional<CacheEntry> read(Path file, String fingerprint) {
    try {
      Map<String, Object> document = json.parseObject(Files.readString(file, StandardCharsets.UTF_8));
      if (!document.containsKey("data")
          || !(document.get("timestamp") instanceof Number timestamp)
          || !(document.get("ttl") instanceof Number ttl)) {
        log.debug("Ignoring malformed cache entry {}", file.getFileName());
        return Optional.empty();
      }
      return Optional.of(new CacheEntry(fingerprint, document.get("data"), timestamp.longValue(), ttl.longValue()));
    } catch (NoSuchFileException ex) {
      return Optional.empty();
    } catch (IOException | IllegalArgumentException ex) {
      log.debug("Ignoring unreadable cache entry {}: {}", file.getFileName(), ex.getMessage());
      return Optional.empty();
    }
  }

  private List<Path> entryFiles() {
    List<Path> files = new ArrayList<>();
    if (!Files.isDirectory(directory)) {
      return files;
    }
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
      for (Path file : stream) {
        if (Files.isRegularFile(file) && QueryFingerprint.isValid(fingerprintOf(file))) {
          files.add(file);
        }
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to list cache directory " + directory, ex);
    }
    return files;
  }

  private static String fingerprintOf(Path file) {
    String name = file.getFileName().toString();
    return name.endsWith(SUFFIX) ? name.substring(0, name.length() - SUFFIX.length()) : name;
  }

  private static long sizeOf(Path file) {
    try {
      return Files.size(file);
    } catch (IOException ex) {
      log.debug("Cannot size cache entry {}", file.getFileName());
      return 0L;
    }
  }

  private static boolean delete(Path file) {
    try {
      return Files.deleteIfExists(file);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to delete cache entry " + file, ex);
    }
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException ex) {
      log.debug("Failed to remove temporary cache file {}", file, ex);
    }
  }
}
