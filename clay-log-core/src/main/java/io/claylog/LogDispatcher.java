package io.claylog;

import java.util.Map;

/**
 * The function handed back by {@link ClayLog#init}, {@link ClayLog#meta} and
 * {@link ClayLog#log}. It closes over one {@link io.claylog.spi.LogHandle} and
 * forwards each call to the matching emit method.
 *
 * <pre>{@code
 * LogDispatcher log = ClayLog.init(LogConfig.builder().name("orders").build());
 * log.log("info", "order placed", Map.of("orderId", id));
 * log.log(caughtException);
 * }</pre>
 *
 * <p>Dispatchers never throw for malformed calls: a missing level or message, or
 * an unknown level name, is reported as one {@code error} record instead. Failures
 * raised by the engine itself propagate.
 *
 * <p>Instances are safe for concurrent use.
 */
@FunctionalInterface
public interface LogDispatcher {

    /**
     * Normalizes and emits one call.
     *
     * @param call the call
     */
    void dispatch(LogCall call);

    default void log(String level, Object message) {
        dispatch(LogCall.of(level, message, null));
    }

    default void log(String level, Object message, Map<String, ?> data) {
        dispatch(LogCall.of(level, message, data));
    }

    /**
     * Logs {@code error} at {@code error} level with the error as the message.
     *
     * @param error the failure
     */
    default void log(Throwable error) {
        dispatch(LogCall.of(error, null));
    }

    default void log(Throwable error, Map<String, ?> data) {
        dispatch(LogCall.of(error, data));
    }
}
