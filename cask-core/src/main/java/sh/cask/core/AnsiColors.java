// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core;

import java.util.Locale;

/**
 * ANSI colors for debug output, disabled automatically when stdout is not a TTY
 * unless {@code FORCE_COLOR=true} is set.
 *
 * @see LogFormatter
 */
public final class AnsiColors {

    static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    /** ANSI reset code - clears all formatting */
    public static final String RESET = ansi("0");

    /** Teal - success indicators */
    public static final String TEAL = ansi("38;5;44");

    /** Coral - failure indicators */
    public static final String CORAL = ansi("38;5;204");

    /** Lavender - deploy construction */
    public static final String LAVENDER = ansi("38;5;183");

    /** Amber - signing */
    public static final String AMBER = ansi("38;5;214");

    /** Slate gray - metadata */
    public static final String SLATE = ansi("38;5;247");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }

    /**
     * Formats a duration in microseconds as a human-readable string.
     *
     * @param micros duration in microseconds
     * @return formatted duration (e.g., "1.5ms" or "2.3s")
     */
    public static String duration(final long micros) {
        if (micros < 1000)
            return micros + "μs";
        if (micros < 1_000_000)
            return String.format(Locale.ROOT, "%.1fms", micros / 1000.0);
        return String.format(Locale.ROOT, "%.2fs", micros / 1_000_000.0);
    }
}
