// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for ledger transactions and registry events.
 */
public final class DebugLogger {

    /** Logger name all debug output is routed through. */
    public static final String LOGGER_NAME = "sh.covenant.debug";

    private static final Logger LOG = LoggerFactory.getLogger(LOGGER_NAME);

    private DebugLogger() {
    }

    public static void logTx(final String message, final Object... args) {
        if (!CovenantDebug.isTxLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logEvent(final String message, final Object... args) {
        if (!CovenantDebug.isEventLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!CovenantDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Colored output goes straight to stdout on a TTY, otherwise through SLF4J.
     * Output is always sanitized.
     */
    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        final String sanitized = LogSanitizer.sanitize(formatted);

        if (AnsiColors.IS_TTY) {
            System.out.println(sanitized);
        } else {
            LOG.info(sanitized);
        }
    }
}
