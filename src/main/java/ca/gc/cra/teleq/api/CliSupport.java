package ca.gc.cra.teleq.api;

import ca.gc.cra.teleq.application.auth.AuthException;
import ca.gc.cra.teleq.application.query.QueryException;
import ca.gc.cra.teleq.config.CompositionRoot;
import ca.gc.cra.teleq.config.ConfigException;
import java.io.UncheckedIOException;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Shared wiring and failure mapping for the {@code teleq} commands.
 */
final class CliSupport {
  private static volatile Supplier<CompositionRoot> rootOverride;

  private CliSupport() {}

  static CompositionRoot root() {
    Supplier<CompositionRoot> override = rootOverride;
    if (override != null) {
      return override.get();
    }
    return CompositionRoot.fromEnvironment(System::getenv, CliPrinter::println);
  }

  static void setRootForTesting(Supplier<CompositionRoot> supplier) {
    rootOverride = supplier;
  }

  static void clearRootForTesting() {
    rootOverride = null;
  }

  /**
   * Logs a command failure once and maps it to an exit code.
   *
   * @param log command logger
   * @param command command name used in the log line
   * @param ex failure raised by the command
   * @return exit code for the failure category
   */
  static ExitCode fail(Logger log, String command, RuntimeException ex) {
    if (ex instanceof ConfigException config) {
      log.error("{}: configuration error ({}): {}", command, config.kind(), config.getMessage());
      return config.kind() == ConfigException.Kind.IO_FAILURE ? ExitCode.IO_ERROR : ExitCode.CONFIG_ERROR;
    }
    if (ex instanceof AuthException auth) {
      log.error("{}: authentication failed ({}): {}", command, auth.kind(), auth.getMessage());
      if (auth.remediation() != null) {
        log.error("{}: {}", command, auth.remediation());
      }
      return ExitCode.AUTH_FAILURE;
    }
    if (ex instanceof QueryException query) {
      log.error("{}: query failed ({}): {}", command, query.kind().category(), query.getMessage());
      return ExitCode.QUERY_FAILURE;
    }
    if (ex instanceof UncheckedIOException io) {
      log.error("{}: I/O failure: {}", command, io.getCause().getMessage(), io);
      return ExitCode.IO_ERROR;
    }
    if (ex instanceof IllegalArgumentException) {
      log.error("{}: {}", command, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    log.error("{}: unexpected runtime failure", command, ex);
    return ExitCode.RUNTIME_FAILURE;
  }
}
