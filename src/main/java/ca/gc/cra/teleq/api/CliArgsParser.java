package ca.gc.cra.teleq.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} command arguments into an ordered map.
 *
 * <p>Keys are letters, digits, {@code .}, {@code _} or {@code -}. Values keep further {@code '='} characters and
 * line breaks, which multi-line query text needs; other control characters are rejected. Stateless.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern ARGUMENT = Pattern.compile("([A-Za-z0-9._-]+)\\s*=\\s*(.+)", Pattern.DOTALL);
  private static final Pattern FORBIDDEN_CONTROL = Pattern.compile("[\\p{Cntrl}&&[^\\r\\n\\t]]");

  private CliArgsParser() {}

  /**
   * Parses arguments into a mutable map in command-line order; {@code null} and blank entries are skipped.
   *
   * @param args raw arguments; {@code null} returns an empty map
   * @return mutable map of argument values
   * @throws IllegalArgumentException for a token that is not {@code key=value}, a repeated key, or a value with
   *     control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> values = new LinkedHashMap<>();
    if (args == null) {
      return values;
    }
    for (String raw : args) {
      String token = raw == null ? "" : raw.trim();
      if (token.isEmpty()) {
        continue;
      }
      Matcher matcher = ARGUMENT.matcher(token);
      if (!matcher.matches()) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = matcher.group(1);
      String value = matcher.group(2);
      if (FORBIDDEN_CONTROL.matcher(value).find()) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
      if (values.putIfAbsent(key, value) != null) {
        throw new IllegalArgumentException("argument " + key + " given more than once");
      }
    }
    return values;
  }
}
