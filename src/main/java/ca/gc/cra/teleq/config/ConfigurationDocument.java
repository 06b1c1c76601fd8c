package ca.gc.cra.teleq.config;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Raw configuration document as loaded from disk.
 *
 * <p>A document is either <em>profiled</em> (it carries a {@code profiles} object plus optional
 * {@code defaultProfile}, {@code cache}, {@code sanitize} and {@code telemetry} blocks) or <em>flat</em>, in which
 * case the whole root is a single implicit profile. No business rules are applied here; see
 * {@link ProfileResolver}.</p>
 *
 * @since 0.1.0
 */
public final class ConfigurationDocument {
  static final String PROFILES = "profiles";
  static final String DEFAULT_PROFILE = "defaultProfile";
  static final String CACHE_SECTION = "cache";
  static final String SANITIZE_SECTION = "sanitize";

  private final Map<String, Object> root;
  private final Path source;

  private ConfigurationDocument(Map<String, Object> root, Path source) {
    this.root = Collections.unmodifiableMap(new LinkedHashMap<>(root));
    this.source = source;
  }

  /**
   * Wraps an in-memory object graph.
   *
   * @param root parsed root object
   * @param source file the document was read from; {@code null} for in-memory documents
   * @return document view
   */
  public static ConfigurationDocument of(Map<String, Object> root, Path source) {
    return new ConfigurationDocument(Objects.requireNonNull(root, "root"), source);
  }

  /**
   * Wraps an in-memory object graph with no source file.
   *
   * @param root parsed root object
   * @return document view
   */
  public static ConfigurationDocument of(Map<String, Object> root) {
    return of(root, null);
  }

  /**
   * Returns the unmodifiable root object.
   *
   * @return root map
   */
  public Map<String, Object> root() {
    return root;
  }

  /**
   * Returns the file this document was loaded from.
   *
   * @return source path when loaded from disk
   */
  public Optional<Path> source() {
    return Optional.ofNullable(source);
  }

  /**
   * Reports whether the document declares a {@code profiles} object.
   *
   * @return {@code true} for multi-profile documents
   */
  public boolean isProfiled() {
    return root.get(PROFILES) != null;
  }

  /**
   * Returns the declared profiles keyed by name, preserving document order.
   *
   * @return profiles; empty for flat documents
   * @throws ConfigException when {@code profiles} or one of its entries is not an object
   */
  public Map<String, Map<String, Object>> profiles() {
    Object raw = root.get(PROFILES);
    if (raw == null) {
      return Map.of();
    }
    if (!(raw instanceof Map<?, ?> map)) {
      throw malformed("'profiles' must be an object");
    }
    Map<String, Map<String, Object>> profiles = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      String name = String.valueOf(entry.getKey());
      profiles.put(name, asObject(entry.getValue(), "profile '" + name + "'"));
    }
    return Collections.unmodifiableMap(profiles);
  }

  /**
   * Returns the document-level default profile name.
   *
   * @return default profile when declared and non-blank
   */
  public Optional<String> defaultProfile() {
    Object value = root.get(DEFAULT_PROFILE);
    if (value instanceof String name && !name.isBlank()) {
      return Optional.of(name.trim());
    }
    return Optional.empty();
  }

  /**
   * Returns a document-wide block such as {@code cache}, {@code sanitize} or {@code telemetry}.
   *
   * @param name block key
   * @return block contents, or an empty map when absent
   * @throws ConfigException when the block is present but not an object
   */
  public Map<String, Object> section(String name) {
    Object value = root.get(name);
    if (value == null) {
      return Map.of();
    }
    return asObject(value, "'" + name + "'");
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> asObject(Object value, String label) {
    if (value instanceof Map<?, ?> map) {
      return (Map<String, Object>) map;
    }
    throw malformed(label + " must be an object");
  }

  private ConfigException malformed(String detail) {
    String where = source == null ? "configuration" : "configuration " + source;
    return new ConfigException(ConfigException.Kind.MALFORMED_CONFIG, "Malformed " + where + ": " + detail);
  }
}
