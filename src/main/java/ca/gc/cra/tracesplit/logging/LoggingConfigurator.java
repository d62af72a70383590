package ca.gc.cra.tracesplit.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Adjusts Logback levels at runtime for {@code --verbose}.
 *
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the root logger to {@code DEBUG}.
   */
  public static void enableVerboseLogging() {
    setRootLevel(Level.DEBUG);
  }

  /**
   * Returns the root logger level, or {@code null} when the backend is not Logback.
   *
   * @return current root level
   */
  public static Level rootLevel() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      return context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel();
    }
    return null;
  }

  /**
   * Sets the root logger level.
   *
   * @param level level to apply; {@code null} is ignored
   */
  public static void setRootLevel(Level level) {
    if (level == null) {
      return;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return;
    }
    log.warn("Log level change requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
