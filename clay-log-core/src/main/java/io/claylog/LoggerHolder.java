package io.claylog;

import io.claylog.spi.LogHandle;

/**
 * The process-wide logger slot.
 *
 * <p>Written only by {@link LogRuntime#init}; read by {@link LogRuntime#getLogger()}
 * and by {@link LogRuntime#meta(java.util.Map)} when no handle is passed. The slot
 * is not locked: {@code init} is expected to run once at startup, before other
 * threads start logging.
 */
public final class LoggerHolder {
    private volatile LogHandle current;

    /**
     * Returns the installed handle.
     *
     * @return the handle, or {@code null} before the first {@code init}
     */
    public LogHandle get() {
        return current;
    }

    void set(LogHandle handle) {
        this.current = handle;
    }
}
