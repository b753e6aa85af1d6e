package io.claylog.json;

import io.claylog.LogLevel;
import io.claylog.spi.LogHandle;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link LogHandle} produced by {@link JsonLogEngine}. Children share the parent's
 * sink and minimum level and carry the merged bindings (child wins on collision).
 *
 * <p>Each record is encoded in full, then written and flushed under the sink's
 * monitor, so concurrent emitters never interleave partial lines.
 */
public final class JsonLogHandle implements LogHandle {
  private final JsonLogEngine engine;
  private final OutputStream sink;
  private final String level;
  private final int threshold;
  private final Map<String, Object> bindings;

  JsonLogHandle(JsonLogEngine engine, OutputStream sink, String level, int threshold,
      Map<String, Object> bindings) {
    this.engine = engine;
    this.sink = sink;
    this.level = level;
    this.threshold = threshold;
    this.bindings = Collections.unmodifiableMap(bindings);
  }

  @Override
  public String level() {
    return level;
  }

  /**
   * Returns the fields written on every record of this handle.
   *
   * @return bindings including {@code pid}, {@code hostname} and {@code name}
   */
  public Map<String, Object> bindings() {
    return bindings;
  }

  @Override
  public LogHandle child(Map<String, ?> extra) {
    Map<String, Object> merged = new LinkedHashMap<>(bindings);
    if (extra != null) {
      merged.putAll(extra);
    }
    return new JsonLogHandle(engine, sink, level, threshold, merged);
  }

  @Override
  public void trace(Map<String, Object> data, Object message) {
    write(LogLevel.TRACE, data, message);
  }

  @Override
  public void debug(Map<String, Object> data, Object message) {
    write(LogLevel.DEBUG, data, message);
  }

  @Override
  public void info(Map<String, Object> data, Object message) {
    write(LogLevel.INFO, data, message);
  }

  @Override
  public void warn(Map<String, Object> data, Object message) {
    write(LogLevel.WARN, data, message);
  }

  @Override
  public void error(Map<String, Object> data, Object message) {
    write(LogLevel.ERROR, data, message);
  }

  @Override
  public void fatal(Map<String, Object> data, Object message) {
    write(LogLevel.FATAL, data, message);
  }

  /**
   * Whether records at {@code candidate} pass this handle's minimum level.
   *
   * @param candidate level to test
   * @return {@code true} if it would be written
   */
  public boolean isLevelEnabled(LogLevel candidate) {
    return candidate.value() >= threshold;
  }

  private void write(LogLevel recordLevel, Map<String, Object> data, Object message) {
    if (!isLevelEnabled(recordLevel)) {
      return;
    }
    Map<String, Object> record = new LinkedHashMap<>();
    record.put("level", recordLevel.value());
    record.put("time", engine.clock().millis());
    record.putAll(bindings);
    if (data != null) {
      record.putAll(data);
    }
    if (message instanceof Throwable error) {
      record.putIfAbsent("err", describe(error));
      record.put("msg", error.getMessage() != null ? error.getMessage() : error.toString());
    } else if (message != null) {
      record.put("msg", String.valueOf(message));
    }
    record.put("v", 1);

    byte[] line = (engine.codec().toJson(record) + "\n").getBytes(StandardCharsets.UTF_8);
    try {
      synchronized (sink) {
        sink.write(line);
        sink.flush();
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write log record", e);
    }
  }

  private static Map<String, Object> describe(Throwable error) {
    StringWriter stack = new StringWriter();
    error.printStackTrace(new PrintWriter(stack));
    Map<String, Object> err = new LinkedHashMap<>();
    err.put("type", error.getClass().getName());
    err.put("message", error.getMessage());
    err.put("stack", stack.toString().stripTrailing());
    return err;
  }
}
