package ca.gc.cra.teleq.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings used by TELEQ configuration and CLI layers.
 * <p><strong>Why:</strong> Profile names, credentials, and query text arrive from files, environment variables, and
 * command lines; rejecting blank or control-character input early keeps resolution and auth errors precise.
 * <p><strong>Role:</strong> Domain support utilities invoked before ports/adapters touch external resources.
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
public final class Strings {

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains ISO control characters other than
   *     surrounding whitespace
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    // strip() keeps control characters that trim() would silently drop
    String trimmed = raw.strip();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Reports whether a value is {@code null}, empty, or only whitespace.
   *
   * @param value candidate text
   * @return {@code true} when the value carries no content
   */
  public static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  /**
   * Trims a value and converts blank input to {@code null}.
   *
   * @param value candidate text
   * @return trimmed value, or {@code null} when blank
   */
  public static String trimToNull(String value) {
    if (isBlank(value)) {
      return null;
    }
    return value.trim();
  }

  /**
   * Returns the first argument that is not blank, trimmed.
   *
   * @param candidates values in priority order
   * @return first non-blank candidate, or {@code null} when all are blank
   */
  public static String firstNonBlank(String... candidates) {
    if (candidates == null) {
      return null;
    }
    for (String candidate : candidates) {
      if (!isBlank(candidate)) {
        return candidate.trim();
      }
    }
    return null;
  }

  static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
