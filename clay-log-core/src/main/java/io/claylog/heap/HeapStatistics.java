package io.claylog.heap;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Query for runtime memory counters merged into records when heap reporting is on.
 *
 * <p>{@link #UNAVAILABLE} returns an empty snapshot and is used when the runtime
 * does not expose memory management beans.
 *
 * @see JvmHeapStatistics
 */
public interface HeapStatistics {

    /**
     * Provider for runtimes without memory management support. Enrichment becomes a no-op.
     */
    HeapStatistics UNAVAILABLE = () -> Map.of();

    /**
     * Returns the current counters. Keys are stable snake_case names; values are numbers.
     *
     * @return counter snapshot, empty when unavailable
     */
    Map<String, Number> snapshot();

    /**
     * Returns the JVM provider, or {@link #UNAVAILABLE} when the {@code java.management}
     * module is not present in the runtime image.
     *
     * @return a heap statistics provider
     */
    static HeapStatistics detect() {
        try {
            return JvmHeapStatistics.create();
        } catch (LinkageError e) {
            Logger.getLogger(HeapStatistics.class.getName())
                .log(Level.FINE, "java.management not available, heap enrichment disabled", e);
            return UNAVAILABLE;
        }
    }
}
