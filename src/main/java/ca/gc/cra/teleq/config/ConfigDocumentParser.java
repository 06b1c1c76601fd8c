package ca.gc.cra.teleq.config;

import ca.gc.cra.teleq.application.json.JsonSupport;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Parses configuration text into a {@link ConfigurationDocument}.
 *
 * <p>Files ending in {@code .yaml} or {@code .yml} are read with SnakeYAML; everything else is JSON. Both formats
 * produce the same map/list object graph.</p>
 *
 * @since 0.1.0
 */
public final class ConfigDocumentParser {
  private final JsonSupport json;

  /** Creates a parser with its own JSON support instance. */
  public ConfigDocumentParser() {
    this(new JsonSupport());
  }

  ConfigDocumentParser(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Parses a document, choosing the format from the source file name.
   *
   * @param text document contents
   * @param source file the contents came from; used for format detection and messages
   * @return parsed document
   * @throws ConfigException with {@link ConfigException.Kind#MALFORMED_CONFIG} when parsing fails
   */
  public ConfigurationDocument parse(String text, Path source) {
    Objects.requireNonNull(text, "text");
    Map<String, Object> root = isYaml(source) ? parseYaml(text, source) : parseJson(text, source);
    return ConfigurationDocument.of(root, source);
  }

  static boolean isYaml(Path source) {
    if (source == null || source.getFileName() == null) {
      return false;
    }
    String name = source.getFileName().toString().toLowerCase(Locale.ROOT);
    return name.endsWith(".yaml") || name.endsWith(".yml");
  }

  private Map<String, Object> parseJson(String text, Path source) {
    if (text.isBlank()) {
      throw malformed(source, "document is empty", null);
    }
    try {
      return json.parseObject(text);
    } catch (IllegalArgumentException ex) {
      throw malformed(source, ex.getMessage(), ex);
    }
  }

  private Map<String, Object> parseYaml(String text, Path source) {
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(text);
    } catch (YAMLException ex) {
      throw malformed(source, "invalid YAML", ex);
    }
    if (document == null) {
      throw malformed(source, "document is empty", null);
    }
    if (!(document instanceof Map<?, ?>)) {
      throw malformed(source, "document root must be a mapping", null);
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> root = (Map<String, Object>) normalize(document, source, "root");
    return root;
  }

  private Object normalize(Object node, Path source, String context) {
    if (node instanceof Map<?, ?> raw) {
      Map<String, Object> map = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : raw.entrySet()) {
        if (!(entry.getKey() instanceof String key)) {
          throw malformed(source, context + " contains non-string key " + entry.getKey(), null);
        }
        map.put(key, normalize(entry.getValue(), source, key));
      }
      return map;
    }
    if (node instanceof List<?> items) {
      List<Object> list = new ArrayList<>(items.size());
      for (Object item : items) {
        list.add(normalize(item, source, context));
      }
      return list;
    }
    return node;
  }

  private static ConfigException malformed(Path source, String detail, Throwable cause) {
    String where = source == null ? "configuration" : "configuration " + source;
    return new ConfigException(ConfigException.Kind.MALFORMED_CONFIG, "Malformed " + where + ": " + detail, cause);
  }
}
