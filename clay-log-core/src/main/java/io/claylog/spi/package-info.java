/**
 * Service Provider Interfaces (SPI) for plugging a structured-log engine under the facade.
 *
 * <p>{@link io.claylog.spi.LogEngine} builds base loggers; {@link io.claylog.spi.LogHandle}
 * is the immutable logger instance the dispatcher emits through. The core ships a
 * JSON-lines engine ({@link io.claylog.json.JsonLogEngine}); the {@code clay-log-slf4j}
 * module provides an SLF4J-backed one.
 *
 * @see io.claylog.spi.LogEngine
 * @see io.claylog.spi.LogHandle
 * @see io.claylog.spi.LoggerOptions
 */
package io.claylog.spi;
