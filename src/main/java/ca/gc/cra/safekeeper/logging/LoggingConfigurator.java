package ca.gc.cra.safekeeper.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts SafeKeeper logging levels from CLI flags.
 * <p><strong>Why:</strong> Operators raise verbosity with {@code --verbose} without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 * <p><strong>Observability:</strong> Warns when the SLF4J backend cannot change levels at runtime.</p>
 *
 * @implNote Tailored for Logback; other bindings keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String LEDGER_LOGGER = "ca.gc.cra.safekeeper";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the root logger and the {@code ca.gc.cra.safekeeper} hierarchy to DEBUG.
   */
  public static void enableVerboseLogging() {
    setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, Level.DEBUG);
    setLevel(LEDGER_LOGGER, Level.DEBUG);
  }

  private static void setLevel(String loggerName, Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(loggerName);
      if (!level.equals(logger.getLevel())) {
        logger.setLevel(level);
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
