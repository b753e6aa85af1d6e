package io.claylog.spi;

/**
 * Options passed to {@link LogEngine#create} when the base logger is built.
 *
 * @param name  logger identity stamped on every record
 * @param level minimum emit level name (e.g. {@code "info"}, {@code "silent"})
 */
public record LoggerOptions(String name, String level) {
}
