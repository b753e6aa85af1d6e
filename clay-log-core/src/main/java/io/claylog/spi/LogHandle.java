package io.claylog.spi;

import java.util.Map;

/**
 * Opaque reference to a logger instance owned by a {@link LogEngine}.
 *
 * <p>A handle carries a minimum emit level, an output sink, and zero or more
 * inherited metadata fields (bindings). Handles are immutable: {@link #child(Map)}
 * never changes the receiver, it returns a new handle whose records carry the
 * parent's bindings plus the supplied ones.
 *
 * <p>Each emit method takes the record's data fields and its message. The message
 * is usually a {@link String}; a {@link Throwable} is accepted as well and is
 * rendered by the engine.
 *
 * @see LogEngine
 * @see io.claylog.LogLevel
 */
public interface LogHandle {

    /**
     * Returns the minimum level this handle emits, as the name it was created with.
     *
     * @return minimum level name
     */
    String level();

    /**
     * Derives a handle whose records always include {@code bindings}.
     *
     * @param bindings fields to inherit-and-add
     * @return a new handle; the receiver is left untouched
     */
    LogHandle child(Map<String, ?> bindings);

    void trace(Map<String, Object> data, Object message);

    void debug(Map<String, Object> data, Object message);

    void info(Map<String, Object> data, Object message);

    void warn(Map<String, Object> data, Object message);

    void error(Map<String, Object> data, Object message);

    void fatal(Map<String, Object> data, Object message);
}
