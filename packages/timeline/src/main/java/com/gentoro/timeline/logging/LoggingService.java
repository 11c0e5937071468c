package com.gentoro.timeline.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers.
 *
 * <p>Levels can be tuned from configuration using {@code logging.level.<logger-name>} keys, for
 * example {@code logging.level.com.gentoro.timeline.ingest: DEBUG}. The special key {@code
 * logging.level.root} targets the root logger.
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply {@code logging.level.*} entries. Unknown level names fall back to DEBUG per Logback. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) {
      return;
    }
    Configuration levels = configuration.subset(LEVEL_PREFIX);
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String name = it.next();
      String value = levels.getString(name, null);
      if (value == null || value.isBlank()) {
        continue;
      }
      // Dots inside a YAML key come back escaped as "..".
      String loggerName = name.replace("..", ".");
      setLevel(
          "root".equalsIgnoreCase(loggerName) ? Logger.ROOT_LOGGER_NAME : loggerName,
          value.trim());
    }
  }

  /** Raise the root logger to DEBUG. Used by the {@code --verbose} flag. */
  public static void enableVerbose() {
    setLevel(Logger.ROOT_LOGGER_NAME, "DEBUG");
  }

  static void setLevel(String loggerName, String level) {
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      // Another SLF4J binding is active; levels are managed elsewhere.
      return;
    }
    context.getLogger(loggerName).setLevel(Level.toLevel(level, Level.DEBUG));
  }
}
