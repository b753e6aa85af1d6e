package io.claylog;

import io.claylog.heap.HeapStatistics;
import io.claylog.json.JsonLogEngine;
import io.claylog.pretty.PrettyOptions;
import io.claylog.pretty.PrettyPrintStream;
import io.claylog.spi.LogEngine;
import io.claylog.spi.LogHandle;
import io.claylog.spi.LoggerOptions;

import java.io.OutputStream;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Instance form of the facade: initializer, forker, dispatcher factory and accessor
 * over an injected engine, environment, heap statistics provider and logger slot.
 *
 * <p>{@link ClayLog} delegates to one process-wide runtime. Tests and frameworks can
 * build their own:
 * <pre>{@code
 * LogRuntime runtime = LogRuntime.builder()
 *     .engine(engine)
 *     .environment(Environment.of(Map.of("LOG", "debug")))
 *     .build();
 * LogDispatcher log = runtime.init(LogConfig.builder().name("worker").build());
 * }</pre>
 */
public final class LogRuntime {
  private static final Logger logger = Logger.getLogger(LogRuntime.class.getName());

  static final String DEFAULT_LEVEL = "info";

  private final LogEngine engine;
  private final Environment environment;
  private final HeapStatistics heapStatistics;
  private final LoggerHolder holder;

  private LogRuntime(Builder builder) {
    this.engine = builder.engine == null ? new JsonLogEngine() : builder.engine;
    this.environment = builder.environment == null ? Environment.system() : builder.environment;
    this.heapStatistics = builder.heapStatistics == null ? HeapStatistics.detect() : builder.heapStatistics;
    this.holder = builder.holder == null ? new LoggerHolder() : builder.holder;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a runtime identical to this one but backed by {@code engine}. The logger
   * slot is shared, so {@link #getLogger()} keeps returning the last installed handle
   * until the next {@code init}.
   *
   * @param engine replacement engine
   * @return a new runtime
   */
  public LogRuntime withEngine(LogEngine engine) {
    return builder()
        .engine(Objects.requireNonNull(engine, "engine"))
        .environment(environment)
        .heapStatistics(heapStatistics)
        .holder(holder)
        .build();
  }

  /**
   * Builds the base logger and installs it as the process-wide logger.
   *
   * <p>Output resolves to {@code config.output()} or standard output. Pretty mode is
   * off without process info, otherwise follows {@code config.pretty()} when set, else
   * {@value Environment#PRETTY}. The minimum level comes from
   * {@value Environment#LOG_LEVEL} ({@code info} by default). Non-empty
   * {@code config.meta()} replaces the installed logger with a child carrying it.
   *
   * @param config logger settings
   * @return dispatcher over the installed logger
   * @throws ConfigurationException if {@code config} is null or has no non-empty name
   */
  public LogDispatcher init(LogConfig config) {
    checkConfig(config);

    OutputStream sink = resolveOutput(config);
    OutputStream output = sink;
    boolean pretty = resolvePretty(config);
    if (pretty) {
      PrettyPrintStream prettyStream = engine.pretty(PrettyOptions.DEFAULT);
      prettyStream.pipe(sink);
      output = prettyStream;
    }

    String level = resolveLevel();
    LogHandle handle = engine.create(new LoggerOptions(config.name(), level), output);
    holder.set(handle);

    Map<String, Object> meta = config.meta();
    if (!meta.isEmpty()) {
      handle = handle.child(meta);
      holder.set(handle);
    }
    logger.log(Level.FINE, () -> "Initialized logger '" + config.name() + "' (level=" + level
        + ", pretty=" + pretty + ", meta=" + meta.keySet() + ")");
    return log(handle);
  }

  /**
   * Forks the process-wide logger.
   *
   * @param metadata fields added to every record of the fork
   * @return dispatcher over the fork
   * @throws MissingMetadataException if {@code metadata} is null or empty
   * @throws IllegalStateException    if {@code init} has not run yet
   */
  public LogDispatcher meta(Map<String, ?> metadata) {
    return meta(metadata, null);
  }

  /**
   * Forks {@code handle}, or the process-wide logger when {@code handle} is null.
   * The process-wide logger itself is left untouched.
   *
   * @param metadata fields added to every record of the fork
   * @param handle   parent logger, may be {@code null}
   * @return dispatcher over the fork
   * @throws MissingMetadataException if {@code metadata} is null or empty
   * @throws IllegalStateException    if {@code handle} is null and {@code init} has not run yet
   */
  public LogDispatcher meta(Map<String, ?> metadata, LogHandle handle) {
    if (metadata == null || metadata.isEmpty()) {
      throw new MissingMetadataException("meta requires a non-empty metadata map");
    }
    LogHandle parent = handle != null ? handle : holder.get();
    if (parent == null) {
      throw new IllegalStateException("No logger to fork: call init first or pass a handle");
    }
    return log(parent.child(metadata));
  }

  /**
   * Wraps {@code handle} in a dispatcher without touching the process-wide logger.
   *
   * @param handle handle to emit through
   * @return a new dispatcher
   */
  public LogDispatcher log(LogHandle handle) {
    return new DefaultLogDispatcher(handle, environment, heapStatistics);
  }

  /**
   * Returns the process-wide logger.
   *
   * @return the last handle installed by {@code init}, or {@code null}
   */
  public LogHandle getLogger() {
    return holder.get();
  }

  LogEngine engine() {
    return engine;
  }

  private static void checkConfig(LogConfig config) {
    if (config == null || config.name() == null || config.name().isEmpty()) {
      throw new ConfigurationException("init must be called with a non-empty `name`");
    }
  }

  private static OutputStream resolveOutput(LogConfig config) {
    return config.output() != null ? config.output() : System.out;
  }

  private boolean resolvePretty(LogConfig config) {
    if (!environment.hasProcessInfo()) {
      return false;
    }
    if (config.pretty() != null) {
      return config.pretty();
    }
    String toggle = environment.get(Environment.PRETTY);
    if (toggle != null && !toggle.isEmpty()) {
      return !"false".equals(toggle);
    }
    return false;
  }

  private String resolveLevel() {
    String level = environment.get(Environment.LOG_LEVEL);
    return level == null || level.isEmpty() ? DEFAULT_LEVEL : level;
  }

  public static final class Builder {
    private LogEngine engine;
    private Environment environment;
    private HeapStatistics heapStatistics;
    private LoggerHolder holder;

    private Builder() {
    }

    public Builder engine(LogEngine engine) {
      this.engine = engine;
      return this;
    }

    public Builder environment(Environment environment) {
      this.environment = environment;
      return this;
    }

    public Builder heapStatistics(HeapStatistics heapStatistics) {
      this.heapStatistics = heapStatistics;
      return this;
    }

    /**
     * Shares an existing logger slot with the new runtime.
     *
     * @param holder logger slot
     * @return this builder
     */
    public Builder holder(LoggerHolder holder) {
      this.holder = holder;
      return this;
    }

    public LogRuntime build() {
      return new LogRuntime(this);
    }
  }
}
