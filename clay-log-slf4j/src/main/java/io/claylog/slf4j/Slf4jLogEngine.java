package io.claylog.slf4j;

import io.claylog.LogLevel;
import io.claylog.json.JsonLogEngine;
import io.claylog.spi.LogEngine;
import io.claylog.spi.LogHandle;
import io.claylog.spi.LoggerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.OutputStream;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * {@link LogEngine} that forwards records to SLF4J 2.x.
 *
 * <p>The logger name passed to {@code init} selects the SLF4J logger. Bindings and
 * data fields travel as key/value pairs of the fluent event builder, so backends
 * with structured output (Logback encoders, Log4j2 JSON layouts) keep them as
 * fields. The backend owns formatting and destination: the output stream and the
 * pretty-print stream handed to {@link #create} are ignored.
 *
 * <pre>{@code
 * ClayLog.setEngine(new Slf4jLogEngine());
 * LogDispatcher log = ClayLog.init(LogConfig.builder().name("orders").build());
 * }</pre>
 *
 * <p>The handle's minimum level (from {@code LOG}) is applied first; the backend's
 * own level configuration still decides what is finally written.
 */
public final class Slf4jLogEngine implements LogEngine {
  private final Function<String, Logger> loggers;

  public Slf4jLogEngine() {
    this(LoggerFactory::getLogger);
  }

  /**
   * Creates an engine resolving loggers through {@code loggers}.
   *
   * @param loggers logger lookup by name
   */
  public Slf4jLogEngine(Function<String, Logger> loggers) {
    this.loggers = Objects.requireNonNull(loggers, "loggers");
  }

  @Override
  public LogHandle create(LoggerOptions options, OutputStream destination) {
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(options.name(), "name");
    Logger logger = loggers.apply(options.name());
    return new Slf4jLogHandle(logger, options.level(), threshold(options.level()), Map.of());
  }

  static int threshold(String level) {
    if (JsonLogEngine.SILENT.equalsIgnoreCase(level)) {
      return Integer.MAX_VALUE;
    }
    return LogLevel.fromName(level)
        .map(LogLevel::value)
        .orElseThrow(() -> new IllegalArgumentException("unknown level " + level));
  }
}
