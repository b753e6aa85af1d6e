package io.claylog;

import io.claylog.spi.LogEngine;
import io.claylog.spi.LogHandle;

import java.util.Map;

/**
 * Static entry points backed by one process-wide {@link LogRuntime}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * LogDispatcher log = ClayLog.init(LogConfig.builder()
 *     .name("checkout")
 *     .meta(Map.of("region", "eu-west-1"))
 *     .build());
 *
 * log.log("info", "cart loaded", Map.of("items", 3));
 *
 * LogDispatcher requestLog = ClayLog.meta(Map.of("requestId", requestId));
 * requestLog.log("warn", "slow upstream");
 * requestLog.log(caughtException);
 * }</pre>
 *
 * <p>Call {@link #init} once at startup, before other threads log. Dispatchers are
 * safe for concurrent use afterwards.
 *
 * @see LogRuntime
 * @see LogDispatcher
 */
public final class ClayLog {
  private static volatile LogRuntime runtime = LogRuntime.builder().build();

  private ClayLog() {
  }

  /**
   * Builds and installs the process-wide logger.
   *
   * @param config logger settings
   * @return dispatcher over the installed logger
   * @throws ConfigurationException if {@code config} is null or has no non-empty name
   * @see LogRuntime#init(LogConfig)
   */
  public static LogDispatcher init(LogConfig config) {
    return runtime.init(config);
  }

  /**
   * Forks the process-wide logger with extra fields.
   *
   * @param metadata fields added to every record of the fork
   * @return dispatcher over the fork
   * @throws MissingMetadataException if {@code metadata} is null or empty
   */
  public static LogDispatcher meta(Map<String, ?> metadata) {
    return runtime.meta(metadata);
  }

  /**
   * Forks {@code handle} (or the process-wide logger when null) with extra fields.
   *
   * @param metadata fields added to every record of the fork
   * @param handle   parent logger, may be {@code null}
   * @return dispatcher over the fork
   * @throws MissingMetadataException if {@code metadata} is null or empty
   */
  public static LogDispatcher meta(Map<String, ?> metadata, LogHandle handle) {
    return runtime.meta(metadata, handle);
  }

  /**
   * Wraps an engine handle in a dispatcher.
   *
   * @param handle handle to emit through
   * @return a new dispatcher
   */
  public static LogDispatcher log(LogHandle handle) {
    return runtime.log(handle);
  }

  /**
   * Returns the engine handle installed by the latest {@link #init}, for callers that
   * need the engine's native interface.
   *
   * @return the handle, or {@code null} before the first {@code init}
   */
  public static LogHandle getLogger() {
    return runtime.getLogger();
  }

  /**
   * Replaces the engine used by subsequent {@link #init} calls. Intended for tests
   * and for framework integrations that choose the engine at startup.
   *
   * @param engine the engine
   */
  public static void setEngine(LogEngine engine) {
    runtime = runtime.withEngine(engine);
  }

  static LogRuntime runtime() {
    return runtime;
  }
}
