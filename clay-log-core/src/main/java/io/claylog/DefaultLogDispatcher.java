package io.claylog;

import io.claylog.heap.HeapStatistics;
import io.claylog.spi.LogHandle;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link LogDispatcher} over a single {@link LogHandle}.
 *
 * <p>Every call builds a fresh data map: the caller's fields, then {@code _label},
 * then heap statistics when {@value Environment#HEAP} is {@code "1"}. The caller's
 * map is never modified.
 */
final class DefaultLogDispatcher implements LogDispatcher {
  static final String LABEL = "_label";

  private final LogHandle handle;
  private final Environment environment;
  private final HeapStatistics heapStatistics;

  DefaultLogDispatcher(LogHandle handle, Environment environment, HeapStatistics heapStatistics) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.environment = Objects.requireNonNull(environment, "environment");
    this.heapStatistics = Objects.requireNonNull(heapStatistics, "heapStatistics");
  }

  @Override
  public void dispatch(LogCall call) {
    String levelName;
    Object message;
    if (call instanceof LogCall.Failure failure) {
      levelName = "error";
      message = failure.error();
    } else if (call instanceof LogCall.Leveled leveled) {
      levelName = leveled.level();
      message = leveled.message();
    } else {
      levelName = null;
      message = null;
    }

    if (isBlank(levelName) || isMissing(message)) {
      reportMalformed(MalformedLogCallException.missingArguments());
      return;
    }
    Optional<LogLevel> level = LogLevel.fromName(levelName);
    if (level.isEmpty()) {
      reportMalformed(MalformedLogCallException.unsupportedLevel(levelName));
      return;
    }

    Map<String, Object> data = new LinkedHashMap<>();
    if (call.data() != null) {
      data.putAll(call.data());
    }
    data.put(LABEL, level.get().label());
    if ("1".equals(environment.get(Environment.HEAP))) {
      // heap fields win on key collision
      data.putAll(heapStatistics.snapshot());
    }
    level.get().emit(handle, data, message);
  }

  private void reportMalformed(MalformedLogCallException problem) {
    handle.error(new LinkedHashMap<>(), problem);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isEmpty();
  }

  private static boolean isMissing(Object message) {
    return message == null || (message instanceof CharSequence text && text.length() == 0);
  }
}
