package io.claylog.spring.boot;

import io.claylog.slf4j.Slf4jLogEngine;
import io.claylog.spi.LogEngine;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Registers {@link Slf4jLogEngine} when {@code clay.log.engine=slf4j} and
 * clay-log-slf4j is on the classpath.
 *
 * <p>Runs before {@link ClayLogAutoConfiguration} so its JSON default backs off.
 */
@AutoConfiguration(before = ClayLogAutoConfiguration.class)
@ConditionalOnClass(Slf4jLogEngine.class)
@ConditionalOnProperty(prefix = "clay.log", name = "engine", havingValue = "slf4j")
public class ClayLogSlf4jAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(LogEngine.class)
  public Slf4jLogEngine slf4jLogEngine() {
    return new Slf4jLogEngine();
  }
}
