package io.claylog;

import io.claylog.spi.LogHandle;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of severities the dispatcher accepts.
 *
 * <p>Each constant carries its numeric weight (as written to JSON records) and is
 * bound to the matching emit method on {@link LogHandle}, so dispatch is a table
 * lookup rather than a dynamic method call by name.
 */
public enum LogLevel {
    TRACE(10, LogHandle::trace),
    DEBUG(20, LogHandle::debug),
    INFO(30, LogHandle::info),
    WARN(40, LogHandle::warn),
    ERROR(50, LogHandle::error),
    FATAL(60, LogHandle::fatal);

    private final int value;
    private final Emitter emitter;

    LogLevel(int value, Emitter emitter) {
        this.value = value;
        this.emitter = emitter;
    }

    /**
     * Returns the numeric weight; higher is more severe.
     *
     * @return level weight
     */
    public int value() {
        return value;
    }

    /**
     * Returns the uppercase label written to {@code _label}.
     *
     * @return label, e.g. {@code "INFO"}
     */
    public String label() {
        return name();
    }

    /**
     * Invokes this level's emit method on {@code handle}.
     *
     * @param handle  target handle
     * @param data    record data fields
     * @param message record message
     */
    public void emit(LogHandle handle, Map<String, Object> data, Object message) {
        emitter.emit(handle, data, message);
    }

    /**
     * Looks up a level by name, ignoring case.
     *
     * @param name level name such as {@code "info"}
     * @return the level, or empty if {@code name} is null or not a known level
     */
    public static Optional<LogLevel> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String upper = name.toUpperCase(Locale.ROOT);
        for (LogLevel level : values()) {
            if (level.name().equals(upper)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    /**
     * Looks up a level by its numeric weight.
     *
     * @param value numeric weight
     * @return the level, or empty for custom weights
     */
    public static Optional<LogLevel> fromValue(int value) {
        for (LogLevel level : values()) {
            if (level.value == value) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    @FunctionalInterface
    private interface Emitter {
        void emit(LogHandle handle, Map<String, Object> data, Object message);
    }
}
