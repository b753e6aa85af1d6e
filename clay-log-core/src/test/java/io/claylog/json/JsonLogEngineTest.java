package io.claylog.json;

import io.claylog.Environment;
import io.claylog.LogConfig;
import io.claylog.LogDispatcher;
import io.claylog.LogLevel;
import io.claylog.LogRuntime;
import io.claylog.heap.HeapStatistics;
import io.claylog.spi.LogHandle;
import io.claylog.spi.LoggerOptions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JsonLogEngineTest {

  private static final Instant NOW = Instant.parse("2026-10-18T10:00:00Z");

  private final JsonLogEngine engine =
      new JsonLogEngine(Clock.fixed(NOW, ZoneOffset.UTC), JsonCodec.getDefault());
  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final JsonCodec codec = JsonCodec.getDefault();

  private LogHandle handle(String level) {
    return engine.create(new LoggerOptions("orders", level), out);
  }

  private List<Map<String, Object>> records() {
    List<Map<String, Object>> records = new ArrayList<>();
    for (String line : out.toString(StandardCharsets.UTF_8).split("\n")) {
      if (!line.isEmpty()) {
        records.add(codec.parseObject(line));
      }
    }
    return records;
  }

  private static Map<String, Object> data(String key, Object value) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put(key, value);
    return data;
  }

  @Test
  void writesRecordWithStandardLayout() {
    handle("info").info(data("orderId", "A-17"), "order placed");

    String line = out.toString(StandardCharsets.UTF_8);
    assertTrue(line.endsWith("\n"));
    assertEquals(1, line.split("\n").length);

    Map<String, Object> record = records().get(0);
    assertEquals(List.of("level", "time", "pid", "hostname", "name", "orderId", "msg", "v"),
        new ArrayList<>(record.keySet()));
    assertEquals(30L, record.get("level"));
    assertEquals(NOW.toEpochMilli(), record.get("time"));
    assertEquals(ProcessHandle.current().pid(), record.get("pid"));
    assertNotNull(record.get("hostname"));
    assertEquals("orders", record.get("name"));
    assertEquals("A-17", record.get("orderId"));
    assertEquals("order placed", record.get("msg"));
    assertEquals(1L, record.get("v"));
  }

  @Test
  void writesNumericLevelPerMethod() {
    LogHandle log = handle("trace");

    log.trace(null, "t");
    log.debug(null, "d");
    log.info(null, "i");
    log.warn(null, "w");
    log.error(null, "e");
    log.fatal(null, "f");

    List<Long> levels = new ArrayList<>();
    for (Map<String, Object> record : records()) {
      levels.add((Long) record.get("level"));
    }
    assertEquals(List.of(10L, 20L, 30L, 40L, 50L, 60L), levels);
  }

  @Test
  void dropsRecordsBelowMinimumLevel() {
    LogHandle log = handle("warn");

    log.debug(null, "hidden");
    log.info(null, "hidden");
    log.warn(null, "shown");
    log.error(null, "shown");

    assertEquals(2, records().size());
  }

  @Test
  void minimumLevelIgnoresCase() {
    handle("ERROR").warn(null, "hidden");

    assertEquals(0, out.size());
  }

  @Test
  void silentDropsEverything() {
    LogHandle log = handle(JsonLogEngine.SILENT);

    log.fatal(null, "hidden");

    assertEquals(0, out.size());
  }

  @Test
  void unknownMinimumLevelIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> handle("verbose"));
    assertEquals("unknown level verbose", ex.getMessage());
  }

  @Test
  void levelEnabledFollowsThreshold() {
    JsonLogHandle log = (JsonLogHandle) handle("info");

    assertFalse(log.isLevelEnabled(LogLevel.DEBUG));
    assertTrue(log.isLevelEnabled(LogLevel.INFO));
    assertEquals("info", log.level());
  }

  @Test
  void childMergesBindings() {
    LogHandle parent = handle("info");
    LogHandle child = parent.child(Map.of("requestId", "r-1"));

    child.info(null, "from child");
    parent.info(null, "from parent");

    List<Map<String, Object>> records = records();
    assertEquals("r-1", records.get(0).get("requestId"));
    assertEquals("orders", records.get(0).get("name"));
    assertFalse(records.get(1).containsKey("requestId"));
  }

  @Test
  void childBindingsWinOverParent() {
    LogHandle child = handle("info").child(Map.of("name", "orders-worker"));

    child.info(null, "hi");

    assertEquals("orders-worker", records().get(0).get("name"));
    assertEquals("orders-worker", ((JsonLogHandle) child).bindings().get("name"));
  }

  @Test
  void throwableMessageWritesErrObject() {
    IllegalStateException failure = new IllegalStateException("issue!");

    handle("info").error(data("_label", "ERROR"), failure);

    Map<String, Object> record = records().get(0);
    assertEquals("issue!", record.get("msg"));
    assertEquals("ERROR", record.get("_label"));
    @SuppressWarnings("unchecked")
    Map<String, Object> err = (Map<String, Object>) record.get("err");
    assertEquals("java.lang.IllegalStateException", err.get("type"));
    assertEquals("issue!", err.get("message"));
    assertTrue(err.get("stack").toString().startsWith("java.lang.IllegalStateException: issue!"));
  }

  @Test
  void throwableWithoutMessageUsesToString() {
    handle("info").error(null, new NullPointerException());

    assertEquals("java.lang.NullPointerException", records().get(0).get("msg"));
  }

  @Test
  void callerErrFieldIsKept() {
    handle("info").error(data("err", "caller supplied"), new RuntimeException("boom"));

    assertEquals("caller supplied", records().get(0).get("err"));
  }

  @Test
  void nonStringMessageIsWrittenAsText() {
    handle("info").info(null, 42);

    assertEquals("42", records().get(0).get("msg"));
  }

  @Test
  void selfReferencingArrayInDispatchedDataIsWritten() {
    LogDispatcher log = LogRuntime.builder()
        .engine(engine)
        .environment(Environment.of(Map.of()))
        .heapStatistics(HeapStatistics.UNAVAILABLE)
        .build()
        .init(LogConfig.builder().name("orders").pretty(false).output(out).build());
    Object[] self = new Object[1];
    self[0] = self;

    log.log("info", "m", Map.of("arr", self));

    Map<String, Object> record = records().get(0);
    assertEquals(List.of("[Circular]"), record.get("arr"));
    assertEquals("m", record.get("msg"));
  }

  @Test
  void nullKeyInDataIsWrittenAsText() {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put(null, "orphan");

    handle("info").info(data, "m");

    assertEquals("orphan", records().get(0).get("null"));
  }

  @Test
  void writeFailureIsUnchecked() {
    OutputStream broken = new OutputStream() {
      @Override
      public void write(int b) throws IOException {
        throw new IOException("disk full");
      }
    };
    LogHandle log = engine.create(new LoggerOptions("orders", "info"), broken);

    UncheckedIOException ex = assertThrows(UncheckedIOException.class, () -> log.info(null, "lost"));
    assertEquals("disk full", ex.getCause().getMessage());
  }

  @Test
  void concurrentWritersProduceWholeLines() throws Exception {
    LogHandle log = handle("info");
    int threads = 8;
    int perThread = 200;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      for (int t = 0; t < threads; t++) {
        int worker = t;
        pool.submit(() -> {
          start.await();
          for (int i = 0; i < perThread; i++) {
            log.info(data("worker", worker), "message " + i);
          }
          return null;
        });
      }
      start.countDown();
      pool.shutdown();
      assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
    } finally {
      pool.shutdownNow();
    }

    List<Map<String, Object>> records = records();
    assertEquals(threads * perThread, records.size());
    for (Map<String, Object> record : records) {
      assertEquals(1L, record.get("v"));
    }
  }
}
