package io.claylog;

import java.util.Map;
import java.util.Objects;

/**
 * Read access to the process environment the facade consults.
 *
 * <p>Recognized variables:
 * <ul>
 *   <li>{@value #LOG_LEVEL}: minimum emit level, {@code info} when unset.</li>
 *   <li>{@value #PRETTY}: present, non-empty and not {@code "false"} turns pretty mode on.</li>
 *   <li>{@value #HEAP}: exactly {@code "1"} merges heap statistics into every record.</li>
 * </ul>
 */
public interface Environment {

    String LOG_LEVEL = "LOG";
    String PRETTY = "CLAY_LOG_PRETTY";
    String HEAP = "CLAY_LOG_HEAP";

    /**
     * Returns the value of a variable.
     *
     * @param name variable name
     * @return the value, or {@code null} when unset
     */
    String get(String name);

    /**
     * Whether the code runs in a full process environment. Pretty mode is forced
     * off when it does not.
     *
     * @return {@code true} for a regular JVM process
     */
    boolean hasProcessInfo();

    /**
     * Returns the environment of the running JVM.
     *
     * @return system environment
     */
    static Environment system() {
        return SystemEnvironment.INSTANCE;
    }

    /**
     * Returns a fixed environment backed by {@code variables}.
     *
     * @param variables variable values
     * @return map-backed environment reporting process info
     */
    static Environment of(Map<String, String> variables) {
        return of(variables, true);
    }

    static Environment of(Map<String, String> variables, boolean processInfo) {
        Objects.requireNonNull(variables, "variables");
        Map<String, String> copy = Map.copyOf(variables);
        return new Environment() {
            @Override
            public String get(String name) {
                return copy.get(name);
            }

            @Override
            public boolean hasProcessInfo() {
                return processInfo;
            }
        };
    }

    final class SystemEnvironment implements Environment {
        static final SystemEnvironment INSTANCE = new SystemEnvironment();

        private SystemEnvironment() {
        }

        @Override
        public String get(String name) {
            return System.getenv(name);
        }

        @Override
        public boolean hasProcessInfo() {
            return System.getProperty("java.version") != null;
        }
    }
}
