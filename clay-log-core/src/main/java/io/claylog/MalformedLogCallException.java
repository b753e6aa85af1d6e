package io.claylog;

/**
 * Describes a log call the dispatcher could not honour: missing level or message,
 * or an unsupported level name.
 *
 * <p>Never thrown by the dispatcher. A fresh instance is emitted as the message of
 * a single {@code error} record so the caller's control flow is not disturbed.
 */
public class MalformedLogCallException extends RuntimeException {

    static final String MISSING_ARGUMENTS = "level or msg arguments required";

    public MalformedLogCallException(String message) {
        super(message);
    }

    static MalformedLogCallException missingArguments() {
        return new MalformedLogCallException(MISSING_ARGUMENTS);
    }

    static MalformedLogCallException unsupportedLevel(String level) {
        return new MalformedLogCallException("unsupported log level: " + level);
    }
}
