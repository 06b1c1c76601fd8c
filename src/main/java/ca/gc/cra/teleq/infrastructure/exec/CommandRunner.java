package ca.gc.cra.teleq.infrastructure.exec;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external command to completion.
 */
public interface CommandRunner {

  /**
   * Executes {@code command} and captures its output.
   *
   * @param command program and arguments
   * @param timeout maximum wait; the process is destroyed when exceeded
   * @return exit status and captured streams
   * @throws IOException when the program cannot be started or its output read
   * @throws InterruptedException when the calling thread is interrupted while waiting
   */
  CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException;

  /**
   * Captured process outcome.
   *
   * @param exitCode process exit status; {@code -1} after a timeout
   * @param stdout standard output
   * @param stderr standard error
   */
  record CommandResult(int exitCode, String stdout, String stderr) {
    /** Normalizes {@code null} streams to empty strings. */
    public CommandResult {
      stdout = stdout == null ? "" : stdout;
      stderr = stderr == null ? "" : stderr;
    }
  }
}
