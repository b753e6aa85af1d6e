package io.claylog.pretty;

import io.claylog.LogLevel;
import io.claylog.json.JsonCodec;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Renders one JSON record line as human-readable text.
 *
 * <pre>
 * INFO [2026-10-18T09:15:02.114Z] (orders/4242 on web-1): order placed
 *     orderId: "A-17"
 *     _label: "INFO"
 * </pre>
 *
 * Lines that are not JSON objects are returned unchanged.
 */
final class PrettyFormatter {
  private static final Logger logger = Logger.getLogger(PrettyFormatter.class.getName());

  private static final DateTimeFormatter TIME = DateTimeFormatter
      .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", Locale.ROOT)
      .withZone(ZoneOffset.UTC);
  private static final Set<String> STANDARD_KEYS =
      Set.of("level", "time", "pid", "hostname", "name", "msg", "v", "err");
  private static final String INDENT = "    ";
  private static final String RESET = "\u001B[39m";

  private final PrettyOptions options;
  private final JsonCodec codec;

  PrettyFormatter(PrettyOptions options, JsonCodec codec) {
    this.options = options;
    this.codec = codec;
  }

  String format(String line) {
    Map<String, Object> record;
    try {
      record = codec.parseObject(line);
    } catch (IllegalArgumentException e) {
      logger.log(Level.FINEST, "Passing through non-JSON line", e);
      return line;
    }
    if (record.isEmpty()) {
      return line;
    }

    StringBuilder sb = new StringBuilder();
    String level = levelLabel(record.get("level"));
    String time = record.get("time") instanceof Number millis
        ? "[" + TIME.format(Instant.ofEpochMilli(millis.longValue())) + "]"
        : null;
    if (options.levelFirst()) {
      sb.append(level);
      if (time != null) {
        sb.append(' ').append(time);
      }
    } else {
      if (time != null) {
        sb.append(time).append(' ');
      }
      sb.append(level);
    }

    Object name = record.get("name");
    Object pid = record.get("pid");
    Object hostname = record.get("hostname");
    if (name != null || pid != null) {
      sb.append(" (");
      if (name != null) {
        sb.append(name);
      }
      if (pid != null) {
        sb.append(name != null ? "/" : "").append(pid);
      }
      if (hostname != null) {
        sb.append(" on ").append(hostname);
      }
      sb.append(')');
    }
    sb.append(':');
    if (record.get("msg") != null) {
      sb.append(' ').append(record.get("msg"));
    }

    for (Map.Entry<String, Object> entry : record.entrySet()) {
      if (STANDARD_KEYS.contains(entry.getKey())) {
        continue;
      }
      sb.append('\n').append(INDENT).append(entry.getKey()).append(": ")
          .append(render(entry.getValue()));
    }
    if (record.get("err") instanceof Map<?, ?> err && err.get("stack") != null) {
      for (String stackLine : err.get("stack").toString().split("\\R")) {
        sb.append('\n').append(INDENT).append(stackLine);
      }
    }
    return sb.toString();
  }

  private String levelLabel(Object level) {
    String label = "USERLVL";
    if (level instanceof Number number) {
      label = LogLevel.fromValue(number.intValue()).map(LogLevel::label).orElse(label);
    }
    if (!options.colorize()) {
      return label;
    }
    return colorOf(label) + label + RESET;
  }

  private String render(Object value) {
    if (value instanceof Map<?, ?> || value instanceof List<?> || value instanceof String) {
      Map<String, Object> wrapper = new LinkedHashMap<>();
      wrapper.put("v", value);
      String json = codec.toJson(wrapper);
      // strip the {"v": ... } wrapper
      return json.substring(5, json.length() - 1);
    }
    return String.valueOf(value);
  }

  private static String colorOf(String label) {
    switch (label) {
      case "FATAL":
      case "ERROR":
        return "\u001B[31m";
      case "WARN":
        return "\u001B[33m";
      case "INFO":
        return "\u001B[32m";
      case "DEBUG":
        return "\u001B[34m";
      case "TRACE":
        return "\u001B[90m";
      default:
        return "\u001B[37m";
    }
  }
}
