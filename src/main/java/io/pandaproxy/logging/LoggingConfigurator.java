package io.pandaproxy.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts proxy logging verbosity at runtime for CLI-driven startup.
 * <p><strong>Why:</strong> Operators chasing a flaky printer link need DEBUG output without editing
 * {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    applyRootLevel("DEBUG");
  }

  /**
   * Sets the root logger level from a textual level name ({@code TRACE}..{@code ERROR}).
   *
   * @param levelName level name; blank values are ignored
   * @throws IllegalArgumentException if the name is not a known level
   */
  public static void applyRootLevel(String levelName) {
    if (levelName == null || levelName.isBlank()) {
      return;
    }
    String normalized = levelName.trim().toUpperCase(Locale.ROOT);
    Level level = Level.toLevel(normalized, null);
    if (level == null) {
      throw new IllegalArgumentException("logLevel must be one of TRACE, DEBUG, INFO, WARN, ERROR");
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        normalized, factory.getClass().getName());
  }
}
