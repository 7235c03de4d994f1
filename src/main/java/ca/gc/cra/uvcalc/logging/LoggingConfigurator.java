package ca.gc.cra.uvcalc.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts runtime logging for calculation runs.
 * <p><strong>Why:</strong> Operators raise verbosity through the {@code verbose} setting to follow each section's
 * correction steps without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded bootstrap.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their levels.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Sets the root logger to DEBUG when {@code verbose} is true; otherwise leaves the configured level untouched.
   *
   * @param verbose value of the {@code verbose} setting
   * @return {@code true} when the level was changed
   */
  public static boolean apply(boolean verbose) {
    if (!verbose) {
      return false;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (Level.DEBUG.equals(root.getLevel())) {
        return false;
      }
      root.setLevel(Level.DEBUG);
      log.debug("Verbose logging enabled");
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
