package io.claylog;

import io.claylog.heap.HeapStatistics;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultLogDispatcherTest {

  private static final HeapStatistics FIXED_HEAP = () -> {
    Map<String, Number> stats = new LinkedHashMap<>();
    stats.put("total_heap_size", 2048L);
    stats.put("used_heap_size", 1024L);
    return stats;
  };

  private final RecordingLogHandle handle = new RecordingLogHandle();

  private LogDispatcher dispatcher() {
    return dispatcher(Map.of(), HeapStatistics.UNAVAILABLE);
  }

  private LogDispatcher dispatcher(Map<String, String> env, HeapStatistics heap) {
    return new DefaultLogDispatcher(handle, Environment.of(env), heap);
  }

  @Test
  void emitsAtRequestedLevelWithLabel() {
    dispatcher().log("info", "message");

    RecordingLogHandle.Call call = handle.onlyCall();
    assertEquals("info", call.method());
    assertEquals(Map.of("_label", "INFO"), call.data());
    assertEquals("message", call.message());
  }

  @Test
  void includesCallerData() {
    dispatcher().log("info", "message", Map.of("some", "data"));

    RecordingLogHandle.Call call = handle.onlyCall();
    assertEquals(Map.of("some", "data", "_label", "INFO"), call.data());
    assertEquals("message", call.message());
  }

  @Test
  void leavesCallerDataUntouched() {
    Map<String, Object> data = new HashMap<>();
    data.put("some", "data");

    dispatcher().log("info", "message", data);

    assertEquals(Map.of("some", "data"), data);
  }

  @Test
  void bareErrorIsLoggedAtErrorLevel() {
    IllegalStateException failure = new IllegalStateException("issue!");

    dispatcher().log(failure);

    RecordingLogHandle.Call call = handle.onlyCall();
    assertEquals("error", call.method());
    assertEquals(Map.of("_label", "ERROR"), call.data());
    assertSame(failure, call.message());
  }

  @Test
  void bareErrorKeepsData() {
    IllegalStateException failure = new IllegalStateException("issue!");

    dispatcher().log(failure, Map.of("orderId", "A-17"));

    assertEquals(Map.of("orderId", "A-17", "_label", "ERROR"), handle.onlyCall().data());
  }

  @Test
  void throwableMessageAtOtherLevel() {
    RuntimeException failure = new RuntimeException("retrying");

    dispatcher().log("warn", failure);

    RecordingLogHandle.Call call = handle.onlyCall();
    assertEquals("warn", call.method());
    assertSame(failure, call.message());
  }

  @Test
  void levelLookupIgnoresCase() {
    dispatcher().log("Debug", "details");

    RecordingLogHandle.Call call = handle.onlyCall();
    assertEquals("debug", call.method());
    assertEquals("DEBUG", call.data().get("_label"));
  }

  @Test
  void everyLevelReachesItsEmitMethod() {
    LogDispatcher log = dispatcher();
    for (LogLevel level : LogLevel.values()) {
      log.log(level.name().toLowerCase(), "m");
    }

    assertEquals(6, handle.calls.size());
    assertEquals("trace", handle.calls.get(0).method());
    assertEquals("fatal", handle.calls.get(5).method());
  }

  // ── malformed calls ──────────────────────────────────────────────

  @Test
  void missingArgumentsAreReportedOnce() {
    dispatcher().log((String) null, null);

    RecordingLogHandle.Call call = handle.onlyCall();
    assertEquals("error", call.method());
    MalformedLogCallException problem = assertInstanceOf(MalformedLogCallException.class, call.message());
    assertEquals("level or msg arguments required", problem.getMessage());
    assertFalse(call.data().containsKey("_label"));
  }

  @Test
  void missingMessageIsReported() {
    dispatcher().log("info", null, Map.of("some", "data"));

    RecordingLogHandle.Call call = handle.onlyCall();
    assertEquals("error", call.method());
    assertInstanceOf(MalformedLogCallException.class, call.message());
    assertTrue(handle.calls("info").isEmpty());
  }

  @Test
  void emptyMessageIsReported() {
    dispatcher().log("info", "");

    assertEquals("error", handle.onlyCall().method());
  }

  @Test
  void missingLevelIsReported() {
    dispatcher().log((String) null, "message");

    assertInstanceOf(MalformedLogCallException.class, handle.onlyCall().message());
  }

  @Test
  void emptyLevelIsReported() {
    dispatcher().log("", "message");

    assertInstanceOf(MalformedLogCallException.class, handle.onlyCall().message());
  }

  @Test
  void nullErrorIsReported() {
    dispatcher().log((Throwable) null);

    MalformedLogCallException problem =
        assertInstanceOf(MalformedLogCallException.class, handle.onlyCall().message());
    assertEquals("level or msg arguments required", problem.getMessage());
  }

  @Test
  void nullCallIsReported() {
    dispatcher().dispatch(null);

    assertEquals("error", handle.onlyCall().method());
  }

  @Test
  void unknownLevelIsReportedInsteadOfForwarded() {
    dispatcher().log("verbose", "message");

    RecordingLogHandle.Call call = handle.onlyCall();
    assertEquals("error", call.method());
    MalformedLogCallException problem = assertInstanceOf(MalformedLogCallException.class, call.message());
    assertEquals("unsupported log level: verbose", problem.getMessage());
  }

  @Test
  void eachReportCarriesAFreshException() {
    LogDispatcher log = dispatcher();

    log.log((String) null, null);
    log.log((String) null, null);

    assertEquals(2, handle.calls.size());
    assertNotSame(handle.calls.get(0).message(), handle.calls.get(1).message());
  }

  @Test
  void engineFailuresPropagate() {
    handle.failure = new IllegalStateException("sink closed");

    IllegalStateException thrown = assertThrows(IllegalStateException.class,
        () -> dispatcher().log("info", "message"));
    assertEquals("sink closed", thrown.getMessage());
  }

  // ── heap enrichment ──────────────────────────────────────────────

  @Test
  void heapStatisticsMergedWhenEnabled() {
    dispatcher(Map.of(Environment.HEAP, "1"), FIXED_HEAP).log("info", "message", Map.of("some", "data"));

    Map<String, Object> data = handle.onlyCall().data();
    assertEquals("data", data.get("some"));
    assertEquals("INFO", data.get("_label"));
    assertEquals(2048L, data.get("total_heap_size"));
    assertEquals(1024L, data.get("used_heap_size"));
  }

  @Test
  void heapStatisticsWinOnCollision() {
    dispatcher(Map.of(Environment.HEAP, "1"), FIXED_HEAP)
        .log("info", "message", Map.of("used_heap_size", "mine"));

    assertEquals(1024L, handle.onlyCall().data().get("used_heap_size"));
  }

  @Test
  void heapStatisticsSkippedForOtherToggleValues() {
    dispatcher(Map.of(Environment.HEAP, "0"), FIXED_HEAP).log("info", "message", Map.of("some", "data"));
    dispatcher(Map.of(Environment.HEAP, "true"), FIXED_HEAP).log("info", "message", Map.of("some", "data"));

    for (RecordingLogHandle.Call call : handle.calls) {
      assertEquals(Map.of("some", "data", "_label", "INFO"), call.data());
    }
  }

  @Test
  void heapEnrichmentIsNoOpWhenUnavailable() {
    dispatcher(Map.of(Environment.HEAP, "1"), HeapStatistics.UNAVAILABLE)
        .log("info", "message", Map.of("some", "data"));

    assertEquals(Map.of("some", "data", "_label", "INFO"), handle.onlyCall().data());
  }

  @Test
  void jvmHeapStatisticsAreNumbers() {
    dispatcher(Map.of(Environment.HEAP, "1"), HeapStatistics.detect())
        .log("info", "message", Map.of("some", "data"));

    Map<String, Object> data = handle.onlyCall().data();
    assertEquals("data", data.get("some"));
    assertEquals("INFO", data.get("_label"));
    for (String key : new String[] {
        "total_heap_size", "used_heap_size", "heap_size_limit", "total_available_size",
        "peak_used_heap_size", "total_non_heap_size", "used_non_heap_size", "gc_count", "gc_time_ms"}) {
      assertInstanceOf(Number.class, data.get(key), key);
    }
  }
}
