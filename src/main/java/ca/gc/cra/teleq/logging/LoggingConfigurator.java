package ca.gc.cra.teleq.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Applies the CLI {@code --verbose} flag to Logback.
 *
 * <p>Only the {@code ca.gc.cra.teleq} loggers drop to DEBUG; MSAL and OkHttp keep the levels set in
 * {@code logback.xml}.</p>
 *
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  static final String APPLICATION_LOGGER = "ca.gc.cra.teleq";

  private LoggingConfigurator() {}

  /**
   * Switches application logging to DEBUG for the rest of the process.
   *
   * @return {@code false} when the SLF4J backend is not Logback and nothing changed
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("--verbose ignored: logging backend {} is not Logback", factory.getClass().getName());
      return false;
    }
    context.getLogger(APPLICATION_LOGGER).setLevel(Level.DEBUG);
    log.debug("Verbose logging enabled");
    return true;
  }
}
