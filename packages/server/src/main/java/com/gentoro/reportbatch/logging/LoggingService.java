package com.gentoro.reportbatch.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Central access point for loggers and runtime level overrides. */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply {@code logging.level.<logger>} entries from configuration to Logback. The special key
   * {@code logging.level.root} targets the root logger. Unknown level names are ignored.
   */
  public static void applyConfiguration(Configuration config) {
    if (config == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return;
    }
    Configuration levels = config.subset(LEVEL_PREFIX);
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String name = it.next();
      String value = levels.getString(name);
      if (value == null || value.isBlank()) continue;
      Level level = Level.toLevel(value.trim(), null);
      if (level == null) {
        getLogger(LoggingService.class).warn("Ignoring unknown log level '{}' for {}", value, name);
        continue;
      }
      // dotted YAML keys come back with escaped dots ("com..example")
      String loggerName =
          "root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name.replace("..", ".");
      context.getLogger(loggerName).setLevel(level);
    }
  }
}
