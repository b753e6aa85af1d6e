package io.claylog;

import io.claylog.json.JsonLogEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClayLogTest {

  private RecordingLogEngine engine;

  @BeforeEach
  void setUp() {
    engine = new RecordingLogEngine();
    ClayLog.setEngine(engine);
  }

  @AfterEach
  void tearDown() {
    ClayLog.setEngine(new JsonLogEngine());
  }

  @Test
  void initUsesConfiguredEngine() {
    ClayLog.init(LogConfig.builder().name("facade").pretty(false).build());

    assertEquals("facade", engine.createCalls.get(0).name());
    assertSame(engine.lastHandle(), ClayLog.getLogger());
  }

  @Test
  void initRejectsMissingName() {
    assertThrows(ConfigurationException.class, () -> ClayLog.init(null));
  }

  @Test
  void getLoggerReturnsLatestInit() {
    ClayLog.init(LogConfig.builder().name("first").pretty(false).build());
    ClayLog.init(LogConfig.builder().name("second").pretty(false).build());

    assertSame(engine.handles.get(1), ClayLog.getLogger());
  }

  @Test
  void initDispatcherEmitsThroughInstalledLogger() {
    LogDispatcher log = ClayLog.init(LogConfig.builder().name("facade").pretty(false).build());

    log.log("info", "hello");

    assertEquals("hello", engine.lastHandle().onlyCall().message());
  }

  @Test
  void metaForksInstalledLogger() {
    ClayLog.init(LogConfig.builder().name("facade").pretty(false).build());

    ClayLog.meta(Map.of("requestId", "r-1")).log("debug", "forked");

    RecordingLogHandle installed = engine.lastHandle();
    assertEquals(Map.of("requestId", "r-1"), installed.childCalls.get(0));
    assertEquals("debug", installed.children.get(0).onlyCall().method());
    assertSame(installed, ClayLog.getLogger());
  }

  @Test
  void metaWithExplicitHandle() {
    RecordingLogHandle handle = new RecordingLogHandle();

    ClayLog.meta(Map.of("a", 1), handle);

    assertEquals(1, handle.childCalls.size());
  }

  @Test
  void metaRejectsEmptyMetadata() {
    assertThrows(MissingMetadataException.class, () -> ClayLog.meta(Map.of(), new RecordingLogHandle()));
  }

  @Test
  void logWrapsHandle() {
    RecordingLogHandle handle = new RecordingLogHandle();

    ClayLog.log(handle).log(new IllegalStateException("issue!"));

    assertEquals("error", handle.onlyCall().method());
    assertEquals(Map.of("_label", "ERROR"), handle.onlyCall().data());
  }

  @Test
  void logRequiresHandle() {
    assertThrows(NullPointerException.class, () -> ClayLog.log(null));
  }

  @Test
  void setEngineRejectsNull() {
    assertThrows(NullPointerException.class, () -> ClayLog.setEngine(null));
  }

  @Test
  void writesJsonWithDefaultEngine() {
    ClayLog.setEngine(new JsonLogEngine());
    ByteArrayOutputStream out = new ByteArrayOutputStream();

    ClayLog.init(LogConfig.builder().name("facade").pretty(false).output(out).build())
        .log("warn", "written");

    String line = out.toString(StandardCharsets.UTF_8);
    assertTrue(line.contains("\"name\":\"facade\""));
    assertTrue(line.contains("\"_label\":\"WARN\""));
    assertTrue(line.contains("\"msg\":\"written\""));
  }
}
