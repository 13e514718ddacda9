package com.gentoro.tasktree.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out SLF4J loggers and applies the {@code logging.level.*} section of the engine
 * configuration to Logback.
 *
 * <pre>
 *   logging:
 *     level:
 *       root: INFO
 *       com.gentoro.tasktree.hierarchy: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  static final String LEVELS = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Sets the configured levels. Unknown level names are skipped with a warning. Does nothing when
   * Logback is not the SLF4J backend.
   *
   * @return number of loggers whose level was set
   */
  public static int applyConfiguration(Configuration cfg) {
    if (cfg == null) return 0;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      log.debug("SLF4J backend is not Logback; configured log levels ignored");
      return 0;
    }
    Configuration levels = cfg.subset(LEVELS);
    int applied = 0;
    for (Iterator<String> keys = levels.getKeys(); keys.hasNext(); ) {
      String key = keys.next();
      String value = levels.getString(key, "");
      Level level = Level.toLevel(value.trim(), null);
      // hierarchical YAML keys escape the dots of logger names
      String name = key.replace("..", ".");
      if (level == null) {
        log.warn("Ignoring unknown log level '{}' for logger {}", value, name);
        continue;
      }
      ctx.getLogger("root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name).setLevel(level);
      applied++;
    }
    log.debug("Applied {} configured log level(s)", applied);
    return applied;
  }
}
