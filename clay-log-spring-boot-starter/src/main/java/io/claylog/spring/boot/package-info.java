/**
 * Spring Boot auto-configuration for clay-log.
 *
 * <p>Setting {@code clay.log.name} is enough to get an initialized facade:
 * <pre>
 * clay.log.name=orders
 * clay.log.meta.region=eu-west-1
 * clay.log.engine=slf4j   # optional, needs clay-log-slf4j
 * </pre>
 * Inject {@link io.claylog.LogDispatcher} where records are written. Code that
 * calls {@link io.claylog.ClayLog} statically sees the same logger.
 *
 * @see io.claylog.spring.boot.ClayLogAutoConfiguration
 * @see io.claylog.spring.boot.ClayLogProperties
 */
package io.claylog.spring.boot;
