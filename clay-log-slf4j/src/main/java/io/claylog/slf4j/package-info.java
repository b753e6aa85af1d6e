/**
 * SLF4J 2.x engine.
 *
 * <p>Install it before {@code init} to route clay-log records through the
 * application's SLF4J backend instead of the built-in JSON-lines writer:
 * <pre>{@code
 * ClayLog.setEngine(new Slf4jLogEngine());
 * }</pre>
 *
 * <p>Field order, message text and the {@code _label} field match the JSON engine;
 * numeric levels, {@code time}, {@code pid} and {@code hostname} are left to the
 * backend's layout.
 */
package io.claylog.slf4j;
