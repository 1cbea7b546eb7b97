// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.logging;

/**
 * Global toggle for verbose debug logging across Covenant modules.
 *
 * <p>Flags are volatile. {@link #isEnabled()} reads them non-atomically, which is
 * fine for best-effort logging.
 */
public final class CovenantDebug {

    private static volatile boolean txLogging = false;
    private static volatile boolean eventLogging = false;

    private CovenantDebug() {
    }

    /**
     * @return true if either transaction or event logging is enabled
     */
    public static boolean isEnabled() {
        return txLogging || eventLogging;
    }

    public static void setEnabled(final boolean enabled) {
        txLogging = enabled;
        eventLogging = enabled;
    }

    public static void setTxLogging(final boolean enabled) {
        txLogging = enabled;
    }

    public static boolean isTxLoggingEnabled() {
        return txLogging;
    }

    public static void setEventLogging(final boolean enabled) {
        eventLogging = enabled;
    }

    public static boolean isEventLoggingEnabled() {
        return eventLogging;
    }
}
