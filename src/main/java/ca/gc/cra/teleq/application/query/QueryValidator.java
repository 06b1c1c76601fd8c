package ca.gc.cra.teleq.application.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Pre-flight checks run before a query leaves the process.
 */
public final class QueryValidator {
  private static final List<String> MANAGEMENT_COMMANDS = List.of(".drop", ".delete", ".clear", ".set-or-replace");

  private QueryValidator() {}

  /**
   * Lists reasons a query must not be sent.
   *
   * @param query query text
   * @return problems; empty when the query may be sent
   */
  public static List<String> validate(String query) {
    List<String> errors = new ArrayList<>();
    if (query == null || query.isBlank()) {
      errors.add("Query cannot be empty");
      return errors;
    }
    String lower = query.toLowerCase(Locale.ROOT);
    for (String command : MANAGEMENT_COMMANDS) {
      if (lower.contains(command)) {
        errors.add("Query contains potentially dangerous operation: " + command);
      }
    }
    return errors;
  }
}
