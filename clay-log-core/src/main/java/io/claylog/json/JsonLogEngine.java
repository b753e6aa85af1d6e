package io.claylog.json;

import io.claylog.LogLevel;
import io.claylog.spi.LogEngine;
import io.claylog.spi.LogHandle;
import io.claylog.spi.LoggerOptions;

import java.io.OutputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link LogEngine}: one JSON object per line.
 *
 * <p>Record layout, in order:
 * <pre>{@code
 * {"level":30,"time":1792310400000,"pid":4242,"hostname":"web-1","name":"orders",
 *  ...bindings, ...data, "msg":"order placed","v":1}
 * }</pre>
 *
 * <p>Minimum levels are the {@link LogLevel} names (case-insensitive) plus
 * {@value #SILENT}, which drops every record.
 *
 * @see JsonLogHandle
 */
public final class JsonLogEngine implements LogEngine {
  private static final Logger logger = Logger.getLogger(JsonLogEngine.class.getName());

  public static final String SILENT = "silent";

  private final Clock clock;
  private final JsonCodec codec;
  private final long pid;
  private final String hostname;

  /**
   * Creates an engine with the system UTC clock and the default codec.
   */
  public JsonLogEngine() {
    this(Clock.systemUTC(), JsonCodec.getDefault());
  }

  /**
   * Creates an engine with a custom clock and codec.
   *
   * @param clock time source for the {@code time} field
   * @param codec record encoder
   */
  public JsonLogEngine(Clock clock, JsonCodec codec) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.pid = ProcessHandle.current().pid();
    this.hostname = resolveHostname();
  }

  @Override
  public LogHandle create(LoggerOptions options, OutputStream destination) {
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(destination, "destination");
    int threshold = threshold(options.level());

    Map<String, Object> base = new LinkedHashMap<>();
    base.put("pid", pid);
    base.put("hostname", hostname);
    if (options.name() != null) {
      base.put("name", options.name());
    }
    return new JsonLogHandle(this, destination, options.level(), threshold, base);
  }

  Clock clock() {
    return clock;
  }

  JsonCodec codec() {
    return codec;
  }

  /**
   * Maps a minimum level name to its numeric threshold.
   *
   * @throws IllegalArgumentException for unknown names
   */
  static int threshold(String level) {
    if (SILENT.equalsIgnoreCase(level)) {
      return Integer.MAX_VALUE;
    }
    return LogLevel.fromName(level)
        .map(LogLevel::value)
        .orElseThrow(() -> new IllegalArgumentException("unknown level " + level));
  }

  private static String resolveHostname() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      logger.log(Level.FINE, "Could not resolve host name, using localhost", e);
      return "localhost";
    }
  }
}
