package ca.gc.cra.teleq.config;

import java.util.Locale;

/** Coercion helpers for loosely typed configuration values. */
final class ConfigValues {

  private ConfigValues() {}

  static boolean bool(Object value, boolean defaultValue, String key) {
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Boolean b) {
      return b;
    }
    String text = value.toString().trim().toLowerCase(Locale.ROOT);
    if (text.isEmpty()) {
      return defaultValue;
    }
    if ("true".equals(text)) {
      return true;
    }
    if ("false".equals(text)) {
      return false;
    }
    throw new ConfigException(ConfigException.Kind.MALFORMED_CONFIG, key + " must be true or false");
  }

  static long number(Object value, long defaultValue, String key) {
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number n) {
      if (n.doubleValue() != Math.floor(n.doubleValue())) {
        throw new ConfigException(ConfigException.Kind.MALFORMED_CONFIG, key + " must be a whole number");
      }
      return n.longValue();
    }
    String text = value.toString().trim();
    if (text.isEmpty()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(text);
    } catch (NumberFormatException ex) {
      throw new ConfigException(ConfigException.Kind.MALFORMED_CONFIG, key + " must be a whole number", ex);
    }
  }

  static int integer(Object value, int defaultValue, String key) {
    long number = number(value, defaultValue, key);
    if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
      throw new ConfigException(ConfigException.Kind.MALFORMED_CONFIG, key + " is out of range: " + number);
    }
    return (int) number;
  }

  static String string(Object value) {
    if (value == null) {
      return null;
    }
    String text = value.toString().trim();
    return text.isEmpty() ? null : text;
  }
}
