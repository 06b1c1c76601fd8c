package ca.gc.cra.teleq.api;

/**
 * <strong>What:</strong> Process exit codes returned by the {@code teleq} commands.
 * <p><strong>Why:</strong> Scripts and agents driving the CLI branch on the failure category without parsing
 * messages.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** Configuration was missing, malformed, or did not resolve. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** A token could not be obtained. */
  AUTH_FAILURE(6),
  /** The query was rejected or failed. */
  QUERY_FAILURE(7);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
