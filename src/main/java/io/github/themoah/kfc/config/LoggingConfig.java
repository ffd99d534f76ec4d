package io.github.themoah.kfc.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps the command-line verbosity onto Logback levels.
 *
 * <ul>
 *   <li>0 ({@code -q}): errors only</li>
 *   <li>1 (default): info</li>
 *   <li>2 ({@code -v}): debug, including end-of-partition events</li>
 *   <li>3+ ({@code -vv}): trace; Kafka and Vert.x client logs at debug from 4</li>
 * </ul>
 */
public final class LoggingConfig {

  static final String APP_LOGGER = "io.github.themoah.kfc";
  private static final String[] CLIENT_LOGGERS = {"org.apache.kafka", "io.vertx", "io.netty"};

  private LoggingConfig() {}

  public static void applyVerbosity(int verbosity) {
    Level level = levelFor(verbosity);
    if (LoggerFactory.getLogger(APP_LOGGER) instanceof Logger appLogger) {
      appLogger.setLevel(level);
    }
    if (verbosity >= 4) {
      for (String name : CLIENT_LOGGERS) {
        if (LoggerFactory.getLogger(name) instanceof Logger clientLogger) {
          clientLogger.setLevel(Level.DEBUG);
        }
      }
    }
  }

  static Level levelFor(int verbosity) {
    if (verbosity <= 0) {
      return Level.ERROR;
    }
    return switch (verbosity) {
      case 1 -> Level.INFO;
      case 2 -> Level.DEBUG;
      default -> Level.TRACE;
    };
  }
}
