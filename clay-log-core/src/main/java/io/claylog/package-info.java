/**
 * Root API for clay-log, a structured logging facade over a pluggable engine.
 *
 * <h2>Core Design</h2>
 * <p>{@link io.claylog.ClayLog#init} validates a {@link io.claylog.LogConfig}, resolves
 * the output sink and pretty-print mode, asks the {@linkplain io.claylog.spi.LogEngine engine}
 * for a base logger and installs it in the process-wide {@link io.claylog.LoggerHolder}.
 * Static {@code meta} fields are baked in by forking that logger once.
 *
 * <p>{@link io.claylog.ClayLog#meta} forks a logger with extra fields without touching
 * the installed one. Both return a {@link io.claylog.LogDispatcher}, which normalizes
 * call shapes (level + message, bare error), stamps {@code _label}, optionally merges
 * {@linkplain io.claylog.heap.HeapStatistics heap statistics}, and emits through the
 * {@link io.claylog.LogLevel} table. Malformed calls are reported as one {@code error}
 * record, never thrown.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>clay-log-core</b>: facade, dispatcher, JSON-lines engine, pretty printer (zero external deps)</li>
 *   <li><b>clay-log-slf4j</b>: engine forwarding records to SLF4J</li>
 *   <li><b>clay-log-spring-boot-starter</b>: auto-configuration from {@code clay.log.*} properties</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * LogDispatcher log = ClayLog.init(LogConfig.builder()
 *     .name("orders")
 *     .meta(Map.of("service", "orders-api"))
 *     .build());
 *
 * log.log("info", "order placed", Map.of("orderId", "A-17"));
 *
 * LogDispatcher requestLog = ClayLog.meta(Map.of("requestId", requestId));
 * try {
 *     charge(order);
 * } catch (PaymentException e) {
 *     requestLog.log(e);
 * }
 * }</pre>
 *
 * @see io.claylog.ClayLog
 * @see io.claylog.LogRuntime
 * @see io.claylog.LogDispatcher
 * @see io.claylog.LogLevel
 */
package io.claylog;
