package io.claylog.spring.boot;

import io.claylog.ClayLog;
import io.claylog.LogConfig;
import io.claylog.LogDispatcher;
import io.claylog.json.JsonLogEngine;
import io.claylog.spi.LogEngine;
import io.claylog.spi.LogHandle;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.io.OutputStream;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-configuration for clay-log.
 *
 * <p>Active when {@code clay.log.name} is set. Installs the {@link LogEngine} bean
 * (JSON-lines unless another engine is defined, see
 * {@link ClayLogSlf4jAutoConfiguration}) with {@link ClayLog#setEngine}, runs
 * {@link ClayLog#init} from {@link ClayLogProperties} and exposes the resulting
 * {@link LogDispatcher} and the installed {@link LogHandle}.
 *
 * @see ClayLogProperties
 */
@AutoConfiguration
@ConditionalOnClass(ClayLog.class)
@ConditionalOnProperty(prefix = "clay.log", name = "name")
@EnableConfigurationProperties(ClayLogProperties.class)
public class ClayLogAutoConfiguration {
    private static final Logger logger = Logger.getLogger(ClayLogAutoConfiguration.class.getName());

    @Bean
    @ConditionalOnMissingBean(LogEngine.class)
    public JsonLogEngine clayLogEngine(ClayLogProperties props) {
        if (props.getEngine() == ClayLogProperties.Engine.SLF4J) {
            logger.log(Level.WARNING,
                "clay.log.engine=SLF4J but clay-log-slf4j is not on the classpath; using the JSON engine");
        }
        return new JsonLogEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public LogDispatcher clayLogDispatcher(ClayLogProperties props, LogEngine engine) {
        ClayLog.setEngine(engine);
        return ClayLog.init(LogConfig.builder()
            .name(props.getName())
            .pretty(props.getPretty())
            .output(outputOf(props.getOutput()))
            .meta(props.getMeta())
            .build());
    }

    /**
     * The logger installed by {@link ClayLog#init}, for code that needs the engine's
     * own interface. Registered only alongside {@code clayLogDispatcher}: an
     * application-defined dispatcher means {@code init} never ran here.
     */
    @Bean
    @ConditionalOnBean(name = "clayLogDispatcher")
    @ConditionalOnMissingBean
    public LogHandle clayLogHandle(LogDispatcher clayLogDispatcher) {
        return ClayLog.getLogger();
    }

    private static OutputStream outputOf(ClayLogProperties.Output output) {
        return output == ClayLogProperties.Output.STDERR ? System.err : System.out;
    }
}
