package io.claylog.spi;

import io.claylog.pretty.PrettyOptions;
import io.claylog.pretty.PrettyPrintStream;

import java.io.OutputStream;

/**
 * The structured-log engine behind the facade.
 *
 * <p>The facade never formats or writes records itself. It asks the engine for a
 * base {@link LogHandle}, forks it with {@link LogHandle#child}, and calls the
 * per-level emit methods. Implementations decide the record format and how the
 * destination stream is used.
 *
 * @see io.claylog.json.JsonLogEngine
 */
public interface LogEngine {

    /**
     * Creates a base logger.
     *
     * @param options     logger name and minimum level
     * @param destination effective output target (the pretty stream when pretty mode is on)
     * @return a new handle
     * @throws IllegalArgumentException if the engine does not know the minimum level
     */
    LogHandle create(LoggerOptions options, OutputStream destination);

    /**
     * Creates a formatting stream that turns raw records into human-readable text.
     * The caller connects its downstream with {@link PrettyPrintStream#pipe}.
     *
     * @param options rendering options
     * @return a new, unconnected pretty stream
     */
    default PrettyPrintStream pretty(PrettyOptions options) {
        return new PrettyPrintStream(options);
    }
}
