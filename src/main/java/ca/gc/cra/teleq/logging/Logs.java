package ca.gc.cra.teleq.logging;

import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Keeps secrets and oversized backend payloads out of logs.
 * <p>Tokens, client secrets and raw query text are logged only through {@link #redact(String)}; backend error
 * bodies go through {@link #truncate(String, int)}.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final String UNSET_PLACEHOLDER = "<unset>";

  private Logs() {}

  /**
   * Shortens a value to at most {@code maxBytes} UTF-8 bytes, never splitting a character, and appends the
   * byte counts.
   *
   * @param value text to shorten; {@code null} yields {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return the value itself when it fits, otherwise the kept prefix plus {@code "... (truncated, N of M bytes)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    int total = value.getBytes(StandardCharsets.UTF_8).length;
    if (total <= maxBytes) {
      return value;
    }
    int used = 0;
    int end = 0;
    while (end < value.length()) {
      int codePoint = value.codePointAt(end);
      int width = utf8Width(codePoint);
      if (used + width > maxBytes) {
        break;
      }
      used += width;
      end += Character.charCount(codePoint);
    }
    return value.substring(0, end) + "... (truncated, " + maxBytes + " of " + total + " bytes)";
  }

  /**
   * Replaces a sensitive value with a placeholder that only shows whether it was set.
   *
   * @param value secret value
   * @return {@code "<unset>"} for blank input, otherwise {@code "[REDACTED]"}
   */
  public static String redact(String value) {
    return value == null || value.isBlank() ? UNSET_PLACEHOLDER : REDACTED_PLACEHOLDER;
  }

  private static int utf8Width(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    return codePoint < 0x10000 ? 3 : 4;
  }
}
