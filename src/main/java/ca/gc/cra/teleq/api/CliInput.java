package ca.gc.cra.teleq.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command arguments split into dashed flags and everything else.
 *
 * <p>Help and verbose spellings are normalized to {@code --help} and {@code --verbose}. A dashed token containing
 * {@code '='} is an argument, not a flag.</p>
 *
 * @param arguments positional and {@code key=value} tokens in command-line order
 * @param flags lower-case flags
 */
public record CliInput(List<String> arguments, Set<String> flags) {
  private static final String HELP = "--help";
  private static final String VERBOSE = "--verbose";
  private static final Map<String, String> ALIASES = Map.of(
      "-h", HELP,
      "help", HELP,
      "-v", VERBOSE,
      "--debug", VERBOSE);

  /** Copies components. */
  public CliInput {
    arguments = List.copyOf(arguments);
    flags = Set.copyOf(flags);
  }

  /**
   * Splits raw arguments; {@code null} and blank tokens are dropped.
   *
   * @param args raw command arguments; may be {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> arguments = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String token = raw == null ? "" : raw.trim();
        if (token.isEmpty()) {
          continue;
        }
        String lower = token.toLowerCase(Locale.ROOT);
        String alias = ALIASES.get(lower);
        if (alias != null) {
          flags.add(alias);
        } else if (lower.startsWith("-") && !lower.contains("=")) {
          flags.add(lower);
        } else {
          arguments.add(token);
        }
      }
    }
    return new CliInput(arguments, flags);
  }

  /**
   * Returns the non-flag tokens for {@link CliArgsParser#toMap(String[])}.
   *
   * @return new array of arguments
   */
  public String[] keyValueArgs() {
    return arguments.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains(HELP);
  }

  public boolean verbose() {
    return flags.contains(VERBOSE);
  }

  /**
   * Checks for a flag such as {@code --json}, ignoring case.
   *
   * @param flag flag including leading dashes
   * @return {@code true} when present
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.toLowerCase(Locale.ROOT));
  }
}
