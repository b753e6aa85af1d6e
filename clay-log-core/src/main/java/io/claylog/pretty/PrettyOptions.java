package io.claylog.pretty;

/**
 * Rendering options for {@link PrettyPrintStream}.
 *
 * @param levelFirst put the level label before the timestamp
 * @param colorize   wrap the level label in ANSI colour codes
 */
public record PrettyOptions(boolean levelFirst, boolean colorize) {

    /**
     * Level first, no colour. Used by {@code init}.
     */
    public static final PrettyOptions DEFAULT = new PrettyOptions(true, false);
}
