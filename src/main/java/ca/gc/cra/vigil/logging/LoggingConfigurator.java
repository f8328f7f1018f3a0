package ca.gc.cra.vigil.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Switches the {@code vigil} CLI between its quiet default and {@code --verbose} output.
 *
 * <p>Verbose mode lowers only the {@code ca.gc.cra.vigil} loggers to DEBUG, which surfaces each YAML and CLI
 * setting as it is applied and the effective settings the composition root builds its evaluator
 * from. Third-party loggers such as {@code io.opentelemetry} keep the levels set in {@code logback.xml}.
 *
 * @implNote Requires Logback as the SLF4J backend; any other binding keeps its own levels and a warning is
 *     logged.
 */
public final class LoggingConfigurator {
  static final String VIGIL_LOGGER = "ca.gc.cra.vigil";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Lowers the {@code ca.gc.cra.vigil} loggers to DEBUG.
   *
   * @return {@code true} if the level was applied
   */
  public static boolean enableVerboseLogging() {
    return setLevel(VIGIL_LOGGER, Level.DEBUG);
  }

  static boolean setLevel(String loggerName, Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Cannot set {} to {}: backend {} does not support level changes",
          loggerName, level, factory.getClass().getName());
      return false;
    }
    Logger logger = context.getLogger(loggerName);
    if (!level.equals(logger.getLevel())) {
      logger.setLevel(level);
    }
    return true;
  }
}
