package ca.gc.cra.teleq.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands {@code ${NAME}} placeholders in every string of a configuration object graph.
 *
 * <p>{@code ${workspaceFolder}} expands to the workspace root. Any other name is looked up in the environment;
 * unset variables expand to the empty string and are logged at WARN by name only.</p>
 *
 * @since 0.1.0
 */
final class EnvironmentExpander {
  private static final Logger log = LoggerFactory.getLogger(EnvironmentExpander.class);
  private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");
  static final String WORKSPACE_FOLDER = "workspaceFolder";

  private final Function<String, String> env;
  private final String workspaceFolder;

  EnvironmentExpander(Function<String, String> env, String workspaceFolder) {
    this.env = Objects.requireNonNull(env, "env");
    this.workspaceFolder = Objects.requireNonNull(workspaceFolder, "workspaceFolder");
  }

  /**
   * Returns a copy of {@code values} with every nested string expanded.
   *
   * @param values configuration object
   * @return expanded copy
   */
  Map<String, Object> expand(Map<String, Object> values) {
    Map<String, Object> expanded = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      expanded.put(entry.getKey(), expandValue(entry.getValue()));
    }
    return expanded;
  }

  private Object expandValue(Object value) {
    if (value instanceof String text) {
      return expandString(text);
    }
    if (value instanceof Map<?, ?> map) {
      return expand(ConfigMerger.asObject(map));
    }
    if (value instanceof List<?> list) {
      List<Object> expanded = new ArrayList<>(list.size());
      for (Object item : list) {
        expanded.add(expandValue(item));
      }
      return expanded;
    }
    return value;
  }

  String expandString(String text) {
    if (text.indexOf("${") < 0) {
      return text;
    }
    Matcher matcher = PLACEHOLDER.matcher(text);
    StringBuilder out = new StringBuilder();
    while (matcher.find()) {
      String name = matcher.group(1).trim();
      matcher.appendReplacement(out, Matcher.quoteReplacement(lookup(name)));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  private String lookup(String name) {
    if (WORKSPACE_FOLDER.equals(name)) {
      return workspaceFolder;
    }
    String value = env.apply(name);
    if (value == null) {
      log.warn("Configuration references environment variable {} which is not set; using empty value", name);
      return "";
    }
    return value;
  }
}
