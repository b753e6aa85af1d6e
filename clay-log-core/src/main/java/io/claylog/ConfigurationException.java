package io.claylog;

/**
 * Thrown by {@link ClayLog#init} when the configuration is missing or has no
 * non-empty {@code name}. Raised before any other side effect of {@code init}.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
