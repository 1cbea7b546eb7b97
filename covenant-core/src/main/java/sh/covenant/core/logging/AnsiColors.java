// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.logging;

/**
 * ANSI palette for debug output. Every constant is the empty string when stdout is not
 * a terminal, unless {@code FORCE_COLOR=true} is set.
 *
 * @see LogFormatter
 */
public final class AnsiColors {

    static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    public static final String RESET = ansi("0");

    /** Committed transactions. */
    public static final String TEAL = ansi("38;5;44");

    /** Rejected transactions. */
    public static final String CORAL = ansi("38;5;204");

    /** Emitted events. */
    public static final String INDIGO = ansi("38;5;99");

    /** Nonce burns and other warnings. */
    public static final String AMBER = ansi("38;5;214");

    /** Agent ids. */
    public static final String SKY = ansi("38;5;117");

    /** Metadata. */
    public static final String SLATE = ansi("38;5;247");

    public static final String LAVENDER = ansi("38;5;183");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }
}
