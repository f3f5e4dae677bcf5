package com.gentoro.injob.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers. Components obtain their logger through {@link
 * #getLogger(Class)} so that level overrides coming from {@code application.yaml} apply uniformly.
 *
 * <p>Levels are read from keys below {@code logging.level}, for example:
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.gentoro.injob.daemon: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  public static Logger getLogger(String name) {
    return LoggerFactory.getLogger(name);
  }

  /**
   * Apply logger levels from configuration. Unknown level names fall back to DEBUG, as Logback
   * does; a logging backend other than Logback is left untouched.
   *
   * @return number of loggers whose level was set
   */
  public static int applyConfiguration(Configuration configuration) {
    if (configuration == null) return 0;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      getLogger(LoggingService.class)
          .debug("Logging backend is not Logback; skipping level configuration");
      return 0;
    }

    int applied = 0;
    Iterator<String> keys = configuration.getKeys(LEVEL_PREFIX);
    while (keys.hasNext()) {
      String key = keys.next();
      String value = configuration.getString(key, null);
      if (value == null || value.isBlank() || key.length() <= LEVEL_PREFIX.length() + 1) {
        continue;
      }
      // Hierarchical configurations escape dots inside a single key segment as "..".
      String loggerName = key.substring(LEVEL_PREFIX.length() + 1).replace("..", ".");
      if ("root".equalsIgnoreCase(loggerName)) {
        loggerName = Logger.ROOT_LOGGER_NAME;
      }
      context.getLogger(loggerName).setLevel(Level.toLevel(value.trim(), Level.DEBUG));
      applied++;
    }
    return applied;
  }
}
