package io.claylog.json;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lightweight JSON encoder/decoder for log records. Has no external dependencies.
 *
 * <p>Encoding rules: {@code Map} → object (keys via {@code String.valueOf}, a null key
 * becomes {@code "null"}), {@code Iterable}
 * and arrays → array, {@code Number} → number (NaN and infinities → {@code null}),
 * {@code Boolean} → literal, {@code Enum} → its name, anything else → string via
 * {@code String.valueOf}. A container that contains itself is written as
 * {@code "[Circular]"}.
 *
 * <p>This is the default {@link JsonCodec} implementation, accessible via
 * {@link JsonCodec#getDefault()} or the singleton {@link #INSTANCE}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  static final String CIRCULAR = "[Circular]";

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, ?> record) {
    if (record == null || record.isEmpty()) {
      return "{}";
    }
    StringBuilder sb = new StringBuilder();
    writeValue(sb, record, Collections.newSetFromMap(new IdentityHashMap<>()));
    return sb.toString();
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null) {
      return Collections.emptyMap();
    }
    String trimmed = json.trim();
    if (trimmed.isEmpty() || "null".equals(trimmed)) {
      return Collections.emptyMap();
    }
    int idx = skipWhitespace(trimmed, 0);
    if (idx >= trimmed.length() || trimmed.charAt(idx) != '{') {
      throw new IllegalArgumentException("Expected JSON object");
    }
    ParseResult result = parseValue(trimmed, idx);
    if (skipWhitespace(trimmed, result.nextIndex) != trimmed.length()) {
      throw new IllegalArgumentException("Unexpected trailing content");
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> object = (Map<String, Object>) result.value;
    return object;
  }

  private void writeValue(StringBuilder sb, Object value, Set<Object> path) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof CharSequence text) {
      writeString(sb, text.toString());
    } else if (value instanceof Number number) {
      writeNumber(sb, number);
    } else if (value instanceof Boolean) {
      sb.append(value);
    } else if (value instanceof Enum<?> constant) {
      writeString(sb, constant.name());
    } else if (value instanceof Map<?, ?> map) {
      if (!path.add(value)) {
        writeString(sb, CIRCULAR);
        return;
      }
      sb.append('{');
      boolean first = true;
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        writeString(sb, String.valueOf(entry.getKey()));
        sb.append(':');
        writeValue(sb, entry.getValue(), path);
      }
      sb.append('}');
      path.remove(value);
    } else if (value instanceof Iterable<?> items) {
      if (!path.add(value)) {
        writeString(sb, CIRCULAR);
        return;
      }
      sb.append('[');
      boolean first = true;
      for (Object item : items) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        writeValue(sb, item, path);
      }
      sb.append(']');
      path.remove(value);
    } else if (value.getClass().isArray()) {
      if (!path.add(value)) {
        writeString(sb, CIRCULAR);
        return;
      }
      sb.append('[');
      int length = Array.getLength(value);
      for (int i = 0; i < length; i++) {
        if (i > 0) {
          sb.append(',');
        }
        writeValue(sb, Array.get(value, i), path);
      }
      sb.append(']');
      path.remove(value);
    } else {
      writeString(sb, String.valueOf(value));
    }
  }

  private static void writeNumber(StringBuilder sb, Number number) {
    if (number instanceof Double d && (d.isNaN() || d.isInfinite())) {
      sb.append("null");
    } else if (number instanceof Float f && (f.isNaN() || f.isInfinite())) {
      sb.append("null");
    } else {
      sb.append(number);
    }
  }

  private static void writeString(StringBuilder sb, String value) {
    sb.append('"').append(escape(value)).append('"');
  }

  private static ParseResult parseValue(String input, int index) {
    int i = skipWhitespace(input, index);
    if (i >= input.length()) {
      throw new IllegalArgumentException("Unexpected end of JSON");
    }
    char c = input.charAt(i);
    switch (c) {
      case '{':
        return parseObjectAt(input, i + 1);
      case '[':
        return parseArrayAt(input, i + 1);
      case '"':
        return parseString(input, i + 1);
      case 't':
        return parseLiteral(input, i, "true", Boolean.TRUE);
      case 'f':
        return parseLiteral(input, i, "false", Boolean.FALSE);
      case 'n':
        return parseLiteral(input, i, "null", null);
      default:
        if (c == '-' || (c >= '0' && c <= '9')) {
          return parseNumber(input, i);
        }
        throw new IllegalArgumentException("Unexpected character '" + c + "' at " + i);
    }
  }

  private static ParseResult parseObjectAt(String input, int startIndex) {
    Map<String, Object> result = new LinkedHashMap<>();
    int len = input.length();
    int idx = skipWhitespace(input, startIndex);
    if (idx < len && input.charAt(idx) == '}') {
      return new ParseResult(result, idx + 1);
    }
    while (true) {
      idx = skipWhitespace(input, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      if (input.charAt(idx) != '"') {
        throw new IllegalArgumentException("Expected string key");
      }
      ParseResult key = parseString(input, idx + 1);
      idx = skipWhitespace(input, key.nextIndex);
      if (idx >= len || input.charAt(idx) != ':') {
        throw new IllegalArgumentException("Expected ':' after key");
      }
      ParseResult value = parseValue(input, idx + 1);
      result.put((String) key.value, value.value);
      idx = skipWhitespace(input, value.nextIndex);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char next = input.charAt(idx);
      if (next == ',') {
        idx++;
        continue;
      }
      if (next == '}') {
        return new ParseResult(result, idx + 1);
      }
      throw new IllegalArgumentException("Expected ',' or '}'");
    }
  }

  private static ParseResult parseArrayAt(String input, int startIndex) {
    List<Object> result = new ArrayList<>();
    int len = input.length();
    int idx = skipWhitespace(input, startIndex);
    if (idx < len && input.charAt(idx) == ']') {
      return new ParseResult(result, idx + 1);
    }
    while (true) {
      ParseResult item = parseValue(input, idx);
      result.add(item.value);
      idx = skipWhitespace(input, item.nextIndex);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON array");
      }
      char next = input.charAt(idx);
      if (next == ',') {
        idx++;
        continue;
      }
      if (next == ']') {
        return new ParseResult(result, idx + 1);
      }
      throw new IllegalArgumentException("Expected ',' or ']'");
    }
  }

  private static ParseResult parseLiteral(String input, int index, String literal, Object value) {
    if (!input.startsWith(literal, index)) {
      throw new IllegalArgumentException("Invalid literal at " + index);
    }
    return new ParseResult(value, index + literal.length());
  }

  private static ParseResult parseNumber(String input, int index) {
    int i = index;
    boolean integral = true;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == '.' || c == 'e' || c == 'E') {
        integral = false;
      } else if (!(c == '-' || c == '+' || (c >= '0' && c <= '9'))) {
        break;
      }
      i++;
    }
    String text = input.substring(index, i);
    try {
      if (integral) {
        try {
          return new ParseResult(Long.parseLong(text), i);
        } catch (NumberFormatException tooLarge) {
          return new ParseResult(Double.parseDouble(text), i);
        }
      }
      return new ParseResult(Double.parseDouble(text), i);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid number: " + text, ex);
    }
  }

  private static int skipWhitespace(String input, int index) {
    int i = index;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
        break;
      }
      i++;
    }
    return i;
  }

  private static ParseResult parseString(String input, int startIndex) {
    StringBuilder sb = new StringBuilder();
    int i = startIndex;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == '"') {
        return new ParseResult(sb.toString(), i + 1);
      }
      if (c == '\\') {
        if (i + 1 >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char next = input.charAt(i + 1);
        switch (next) {
          case '"':
          case '\\':
          case '/':
            sb.append(next);
            i += 2;
            break;
          case 'b':
            sb.append('\b');
            i += 2;
            break;
          case 'f':
            sb.append('\f');
            i += 2;
            break;
          case 'n':
            sb.append('\n');
            i += 2;
            break;
          case 'r':
            sb.append('\r');
            i += 2;
            break;
          case 't':
            sb.append('\t');
            i += 2;
            break;
          case 'u':
            if (i + 5 >= input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            String hex = input.substring(i + 2, i + 6);
            try {
              sb.append((char) Integer.parseInt(hex, 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            i += 6;
            break;
          default:
            throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
        }
      } else {
        sb.append(c);
        i++;
      }
    }
    throw new IllegalArgumentException("Unterminated string");
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.toString();
  }

  private static final class ParseResult {
    private final Object value;
    private final int nextIndex;

    private ParseResult(Object value, int nextIndex) {
      this.value = value;
      this.nextIndex = nextIndex;
    }
  }
}
