package ca.gc.cra.teleq.api;

import ca.gc.cra.teleq.validation.Strings;
import java.nio.file.Path;
import java.util.Map;

/**
 * Shared helpers for the {@code config=} and {@code profile=} arguments every command accepts.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static Path extractConfigPath(Map<String, String> args) {
    String value = remove(args, "config");
    return value == null ? null : Path.of(value);
  }

  static String extractProfile(Map<String, String> args) {
    return remove(args, "profile");
  }

  static int parseNonNegativeInt(Map<String, String> args, String key, int defaultValue) {
    String value = remove(args, key);
    if (value == null) {
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(value);
      if (parsed < 0) {
        throw new IllegalArgumentException(key + " must not be negative");
      }
      return parsed;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + value + "')", ex);
    }
  }

  static void rejectUnknown(Map<String, String> args) {
    if (args != null && !args.isEmpty()) {
      throw new IllegalArgumentException("unknown argument(s): " + String.join(", ", args.keySet()));
    }
  }

  static String remove(Map<String, String> args, String key) {
    if (args == null) {
      return null;
    }
    return Strings.trimToNull(args.remove(key));
  }
}
