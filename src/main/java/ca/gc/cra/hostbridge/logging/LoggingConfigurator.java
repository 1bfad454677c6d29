package ca.gc.cra.hostbridge.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Adjusts Logback levels at runtime for the bridge CLI.
 *
 * <p>Only Logback supports dynamic level changes here; any other SLF4J binding keeps its configured levels and
 * a warning is logged instead.</p>
 *
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /** Raises the root logger to DEBUG. Intended for single-threaded CLI startup. */
  public static void enableVerboseLogging() {
    setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, "DEBUG");
  }

  /**
   * Sets the level of a named logger.
   *
   * @param loggerName logger name, or {@code ROOT}
   * @param level textual level such as {@code INFO}; unknown names fall back to DEBUG
   * @return {@code true} when the backend accepted the change
   */
  public static boolean setLevel(String loggerName, String level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger target = context.getLogger(loggerName);
      Level requested = Level.toLevel(level == null ? "" : level.toUpperCase(Locale.ROOT), Level.DEBUG);
      if (!requested.equals(target.getLevel())) {
        target.setLevel(requested);
      }
      return true;
    }
    log.warn("Log level change requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
