package io.claylog;

import java.io.OutputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings for {@link ClayLog#init}.
 *
 * <p>The builder accepts any combination of fields; {@code init} rejects a config
 * without a non-empty name with a {@link ConfigurationException}.
 *
 * <pre>{@code
 * LogConfig config = LogConfig.builder()
 *     .name("orders")
 *     .output(System.err)
 *     .meta(Map.of("region", "eu-west-1"))
 *     .build();
 * }</pre>
 */
public final class LogConfig {
  private final String name;
  private final Boolean pretty;
  private final OutputStream output;
  private final Map<String, Object> meta;

  private LogConfig(Builder builder) {
    this.name = builder.name;
    this.pretty = builder.pretty;
    this.output = builder.output;
    this.meta = builder.meta == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.meta));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Logger name stamped on every record.
   *
   * @return the name, possibly {@code null}
   */
  public String name() {
    return name;
  }

  /**
   * Explicit pretty-print switch.
   *
   * @return {@code TRUE}/{@code FALSE}, or {@code null} to defer to the environment
   */
  public Boolean pretty() {
    return pretty;
  }

  /**
   * Destination sink.
   *
   * @return the sink, or {@code null} for standard output
   */
  public OutputStream output() {
    return output;
  }

  /**
   * Static fields baked into every record of the logger {@code init} builds.
   *
   * @return metadata, never {@code null}
   */
  public Map<String, Object> meta() {
    return meta;
  }

  public static final class Builder {
    private String name;
    private Boolean pretty;
    private OutputStream output;
    private Map<String, ?> meta;

    private Builder() {
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder pretty(Boolean pretty) {
      this.pretty = pretty;
      return this;
    }

    public Builder output(OutputStream output) {
      this.output = output;
      return this;
    }

    public Builder meta(Map<String, ?> meta) {
      this.meta = meta;
      return this;
    }

    public LogConfig build() {
      return new LogConfig(this);
    }
  }
}
