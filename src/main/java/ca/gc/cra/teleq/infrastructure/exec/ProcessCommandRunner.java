package ca.gc.cra.teleq.infrastructure.exec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * <p>Output is redirected to temporary files so the caller's thread is the only one involved. On Windows the
 * command runs through {@code cmd /c} so {@code .cmd} shims such as {@code az.cmd} resolve.</p>
 */
public final class ProcessCommandRunner implements CommandRunner {
  private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

  private final boolean windows;

  /** Creates a runner for the current operating system. */
  public ProcessCommandRunner() {
    this(System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows"));
  }

  ProcessCommandRunner(boolean windows) {
    this.windows = windows;
  }

  @Override
  public CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(timeout, "timeout");
    Path stdout = Files.createTempFile("teleq-cmd", ".out");
    Path stderr = Files.createTempFile("teleq-cmd", ".err");
    try {
      Process process = new ProcessBuilder(platformCommand(command))
          .redirectOutput(stdout.toFile())
          .redirectError(stderr.toFile())
          .start();
      int exitCode;
      if (process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        exitCode = process.exitValue();
      } else {
        log.warn("Command {} exceeded {} ms; terminating", command.get(0), timeout.toMillis());
        process.destroyForcibly();
        exitCode = -1;
      }
      return new CommandResult(
          exitCode,
          Files.readString(stdout, StandardCharsets.UTF_8),
          Files.readString(stderr, StandardCharsets.UTF_8));
    } finally {
      deleteQuietly(stdout);
      deleteQuietly(stderr);
    }
  }

  List<String> platformCommand(List<String> command) {
    if (!windows) {
      return command;
    }
    List<String> wrapped = new ArrayList<>(command.size() + 2);
    wrapped.add("cmd");
    wrapped.add("/c");
    wrapped.addAll(command);
    return wrapped;
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException ex) {
      log.debug("Unable to delete temporary file {}", file, ex);
    }
  }
}
