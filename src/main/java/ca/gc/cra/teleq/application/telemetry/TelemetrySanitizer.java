package ca.gc.cra.teleq.application.telemetry;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Strips personal data from exception details before they reach usage telemetry and derives the stack hash used
 * as part of an error signature.
 *
 * @since 0.1.0
 */
public final class TelemetrySanitizer {
  private static final Pattern WINDOWS_USER = Pattern.compile("(?i)[A-Z]:\\\\Users\\\\[^\\\\\\s]+");
  private static final Pattern UNIX_USER = Pattern.compile("/(?:home|Users)/[^/\\s]+");
  private static final Pattern UNIX_PATH = Pattern.compile("/(?:home|Users)/[\\w.\\-/]+");
  private static final Pattern WINDOWS_PATH = Pattern.compile("(?i)\\b[A-Z]:\\\\[^\\s\"']+");
  private static final Pattern INSTRUMENTATION_KEY = Pattern.compile("(?i)InstrumentationKey=[^;\\s]+");
  private static final Pattern PASSWORD = Pattern.compile("(?i)password=[^&\\s;]+");
  private static final Pattern API_KEY = Pattern.compile("(?i)apiKey=[^&\\s;]+");
  private static final Pattern BEARER = Pattern.compile("(?i)bearer\\s+[\\w.~+/=-]+");
  private static final Pattern EMAIL = Pattern.compile("[\\w.+-]+@[\\w.-]+\\.\\w+");
  private static final Pattern IPV4 = Pattern.compile("\\b\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\b");
  private static final Pattern GUID =
      Pattern.compile("(?i)\\b[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}\\b");

  private TelemetrySanitizer() {}

  /**
   * Removes user-specific paths, secrets, and email addresses from a stack trace.
   *
   * @param stack rendered stack trace
   * @return sanitized stack
   */
  public static String sanitizeStackTrace(String stack) {
    if (stack == null) {
      return "";
    }
    String sanitized = WINDOWS_USER.matcher(stack).replaceAll("<user-path>");
    sanitized = UNIX_USER.matcher(sanitized).replaceAll("<user-path>");
    sanitized = redactSecrets(sanitized);
    return EMAIL.matcher(sanitized).replaceAll("<email>");
  }

  /**
   * Removes paths, secrets, bearer tokens, emails, IP addresses, and GUIDs from an error message.
   *
   * @param message raw message
   * @return sanitized message
   */
  public static String sanitizeErrorMessage(String message) {
    if (message == null) {
      return "";
    }
    String sanitized = WINDOWS_PATH.matcher(message).replaceAll("<path>");
    sanitized = UNIX_PATH.matcher(sanitized).replaceAll("<path>");
    sanitized = redactSecrets(sanitized);
    sanitized = BEARER.matcher(sanitized).replaceAll("bearer <redacted>");
    sanitized = EMAIL.matcher(sanitized).replaceAll("<email>");
    sanitized = IPV4.matcher(sanitized).replaceAll("<ip>");
    return GUID.matcher(sanitized).replaceAll("<guid>");
  }

  /**
   * Buckets a failure into a coarse category for aggregation.
   *
   * @param error failure to classify
   * @return category name
   */
  public static String categorize(Throwable error) {
    String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
    if (containsAny(message, "network", "connection refused", "timed out", "timeout", "unknown host")) {
      return "NetworkError";
    }
    if (containsAny(message, "auth", "unauthorized", "forbidden", "token")) {
      return "AuthenticationError";
    }
    if (containsAny(message, "kusto", "query", "syntax error")) {
      return "QueryError";
    }
    if (containsAny(message, "config", "setting", "invalid")) {
      return "ConfigurationError";
    }
    if (containsAny(message, "permission", "access denied")) {
      return "PermissionError";
    }
    if (containsAny(message, "file", "directory", "no such")) {
      return "FileSystemError";
    }
    return error.getClass().getSimpleName();
  }

  /**
   * Returns the first 16 hex characters of the SHA-256 digest of {@code value}.
   *
   * @param value text to hash
   * @return pseudonymous identifier
   */
  public static String hash16(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash).substring(0, 16);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }

  /**
   * Builds the standard exception dimensions: type, category, sanitized message, sanitized stack and its hash.
   *
   * @param error failure to describe
   * @return mutable property map
   */
  public static Map<String, String> exceptionProperties(Throwable error) {
    Map<String, String> properties = new LinkedHashMap<>();
    properties.put("errorType", error.getClass().getSimpleName());
    properties.put("errorCategory", categorize(error));
    properties.put("errorMessage", sanitizeErrorMessage(error.getMessage()));
    String stack = sanitizeStackTrace(render(error));
    properties.put("stackTrace", stack);
    properties.put("stackHash", hash16(stack));
    return properties;
  }

  /**
   * Returns the rate-limit signature: error type plus the hash of its sanitized stack.
   *
   * @param errorType simple type name
   * @param stackHash sanitized stack hash; may be {@code null}
   * @return signature key
   */
  public static String signature(String errorType, String stackHash) {
    return errorType + ":" + (stackHash == null ? "" : stackHash);
  }

  private static String redactSecrets(String text) {
    String sanitized = INSTRUMENTATION_KEY.matcher(text).replaceAll("InstrumentationKey=<redacted>");
    sanitized = PASSWORD.matcher(sanitized).replaceAll("password=<redacted>");
    return API_KEY.matcher(sanitized).replaceAll("apiKey=<redacted>");
  }

  private static boolean containsAny(String text, String... needles) {
    for (String needle : needles) {
      if (text.contains(needle)) {
        return true;
      }
    }
    return false;
  }

  private static String render(Throwable error) {
    StringWriter out = new StringWriter();
    try (PrintWriter writer = new PrintWriter(out)) {
      error.printStackTrace(writer);
    }
    return out.toString();
  }
}
