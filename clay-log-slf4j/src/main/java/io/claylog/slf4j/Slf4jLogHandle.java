package io.claylog.slf4j;

import io.claylog.LogLevel;
import io.claylog.spi.LogHandle;
import org.slf4j.Logger;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link LogHandle} over one SLF4J {@link Logger}.
 *
 * <p>SLF4J has no fatal level: {@code fatal} records are logged at {@code ERROR}
 * with the {@link #FATAL} marker.
 */
public final class Slf4jLogHandle implements LogHandle {

  /** Marker attached to records emitted through {@link #fatal}. */
  public static final Marker FATAL = MarkerFactory.getMarker("FATAL");

  private final Logger logger;
  private final String level;
  private final int threshold;
  private final Map<String, Object> bindings;

  Slf4jLogHandle(Logger logger, String level, int threshold, Map<String, Object> bindings) {
    this.logger = logger;
    this.level = level;
    this.threshold = threshold;
    this.bindings = Collections.unmodifiableMap(bindings);
  }

  @Override
  public String level() {
    return level;
  }

  /**
   * Returns the underlying SLF4J logger.
   *
   * @return the logger
   */
  public Logger logger() {
    return logger;
  }

  public Map<String, Object> bindings() {
    return bindings;
  }

  @Override
  public LogHandle child(Map<String, ?> extra) {
    Map<String, Object> merged = new LinkedHashMap<>(bindings);
    if (extra != null) {
      merged.putAll(extra);
    }
    return new Slf4jLogHandle(logger, level, threshold, merged);
  }

  @Override
  public void trace(Map<String, Object> data, Object message) {
    emit(LogLevel.TRACE, data, message);
  }

  @Override
  public void debug(Map<String, Object> data, Object message) {
    emit(LogLevel.DEBUG, data, message);
  }

  @Override
  public void info(Map<String, Object> data, Object message) {
    emit(LogLevel.INFO, data, message);
  }

  @Override
  public void warn(Map<String, Object> data, Object message) {
    emit(LogLevel.WARN, data, message);
  }

  @Override
  public void error(Map<String, Object> data, Object message) {
    emit(LogLevel.ERROR, data, message);
  }

  @Override
  public void fatal(Map<String, Object> data, Object message) {
    emit(LogLevel.FATAL, data, message);
  }

  private void emit(LogLevel recordLevel, Map<String, Object> data, Object message) {
    if (recordLevel.value() < threshold) {
      return;
    }
    LoggingEventBuilder event = logger.atLevel(toSlf4j(recordLevel));
    if (recordLevel == LogLevel.FATAL) {
      event = event.addMarker(FATAL);
    }

    Map<String, Object> fields = new LinkedHashMap<>(bindings);
    if (data != null) {
      fields.putAll(data);
    }
    for (Map.Entry<String, Object> field : fields.entrySet()) {
      event = event.addKeyValue(field.getKey(), field.getValue());
    }

    if (message instanceof Throwable error) {
      event.setCause(error)
          .log(error.getMessage() != null ? error.getMessage() : error.toString());
    } else {
      event.log(String.valueOf(message));
    }
  }

  private static Level toSlf4j(LogLevel level) {
    switch (level) {
      case TRACE:
        return Level.TRACE;
      case DEBUG:
        return Level.DEBUG;
      case INFO:
        return Level.INFO;
      case WARN:
        return Level.WARN;
      default:
        return Level.ERROR;
    }
  }
}
