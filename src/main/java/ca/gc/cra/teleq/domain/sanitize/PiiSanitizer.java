package ca.gc.cra.teleq.domain.sanitize;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Redacts personal data from query result values.
 *
 * <p>Rules run in a fixed order: emails are replaced, IPv4 addresses keep their first two octets, GUIDs keep their
 * first eight characters, phone numbers are replaced, and user info in URLs is replaced.</p>
 *
 * @since 0.1.0
 */
public final class PiiSanitizer {
  private static final Pattern EMAIL =
      Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
  private static final Pattern IPV4 = Pattern.compile("\\b(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\b");
  private static final Pattern GUID =
      Pattern.compile("(?i)\\b([0-9a-f]{8})-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}\\b");
  private static final Pattern PHONE =
      Pattern.compile("\\b(?:\\+?1[-.]?)?\\(?([0-9]{3})\\)?[-.]?([0-9]{3})[-.]?([0-9]{4})\\b");
  private static final Pattern URL_USER_INFO = Pattern.compile("\\b(https?://)([^:/\\s]+):([^@\\s]+)@");

  private PiiSanitizer() {}

  /**
   * Applies every redaction rule to a string.
   *
   * @param text value to scrub; {@code null} and empty strings are returned unchanged
   * @return scrubbed text
   */
  public static String sanitize(String text) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    String sanitized = EMAIL.matcher(text).replaceAll("[EMAIL_REDACTED]");
    sanitized = IPV4.matcher(sanitized).replaceAll("$1.$2.xxx.xxx");
    sanitized = GUID.matcher(sanitized).replaceAll("$1-xxxx-xxxx-xxxx-xxxxxxxxxxxx");
    sanitized = PHONE.matcher(sanitized).replaceAll("[PHONE_REDACTED]");
    return URL_USER_INFO.matcher(sanitized).replaceAll("$1[USER_REDACTED]:[PASS_REDACTED]@");
  }

  /**
   * Recursively scrubs every string inside maps and lists; other values pass through.
   *
   * @param value object graph
   * @return scrubbed copy
   */
  public static Object sanitizeValue(Object value) {
    if (value instanceof String text) {
      return sanitize(text);
    }
    if (value instanceof Map<?, ?> map) {
      Map<Object, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        copy.put(entry.getKey(), sanitizeValue(entry.getValue()));
      }
      return copy;
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object item : list) {
        copy.add(sanitizeValue(item));
      }
      return copy;
    }
    return value;
  }
}
