package io.claylog;

import java.util.Map;

/**
 * A single call into a {@link LogDispatcher}, before normalization.
 *
 * <ul>
 *   <li>{@link Leveled}: the usual {@code (level, message, data)} shape.</li>
 *   <li>{@link Failure}: a bare error; the dispatcher logs it at {@code error}
 *       with the error as the message.</li>
 * </ul>
 *
 * <p>Components may be {@code null}; the dispatcher reports such calls instead of
 * throwing.
 */
public sealed interface LogCall permits LogCall.Leveled, LogCall.Failure {

    /**
     * Returns the caller-supplied data fields, possibly {@code null}.
     *
     * @return data fields
     */
    Map<String, ?> data();

    static LogCall of(String level, Object message, Map<String, ?> data) {
        return new Leveled(level, message, data);
    }

    static LogCall of(Throwable error, Map<String, ?> data) {
        return new Failure(error, data);
    }

    /**
     * Level name plus message.
     *
     * @param level   level name, e.g. {@code "info"}
     * @param message a string or a {@link Throwable}
     * @param data    extra fields, may be {@code null}
     */
    record Leveled(String level, Object message, Map<String, ?> data) implements LogCall {
    }

    /**
     * A caught failure logged on its own.
     *
     * @param error the failure
     * @param data  extra fields, may be {@code null}
     */
    record Failure(Throwable error, Map<String, ?> data) implements LogCall {
    }
}
