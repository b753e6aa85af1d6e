package io.claylog.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for clay-log.
 *
 * @see ClayLogAutoConfiguration
 */
@ConfigurationProperties(prefix = "clay.log")
public class ClayLogProperties {

    /**
     * Logger name stamped on every record. Auto-configuration is skipped when unset.
     */
    private String name;

    /**
     * Pretty-print records. When unset, the CLAY_LOG_PRETTY environment variable decides.
     */
    private Boolean pretty;

    /**
     * Standard stream records are written to.
     */
    private Output output = Output.STDOUT;

    /**
     * Static fields added to every record.
     */
    private Map<String, String> meta = new LinkedHashMap<>();

    /**
     * Engine that encodes and writes records.
     */
    private Engine engine = Engine.JSON;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Boolean getPretty() {
        return pretty;
    }

    public void setPretty(Boolean pretty) {
        this.pretty = pretty;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Map<String, String> getMeta() {
        return meta;
    }

    public void setMeta(Map<String, String> meta) {
        this.meta = meta;
    }

    public Engine getEngine() {
        return engine;
    }

    public void setEngine(Engine engine) {
        this.engine = engine;
    }

    public enum Output {
        STDOUT,
        STDERR
    }

    public enum Engine {
        /** Built-in JSON-lines writer. */
        JSON,
        /** SLF4J 2.x; requires clay-log-slf4j on the classpath. */
        SLF4J
    }
}
