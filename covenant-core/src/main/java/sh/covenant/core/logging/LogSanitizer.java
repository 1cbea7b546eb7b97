// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.logging;

import java.util.regex.Pattern;

/**
 * Removes sensitive data from debug log payloads.
 *
 * <ul>
 * <li>Redacts private key values, both JSON-style and {@code privateKey=} style</li>
 * <li>Redacts {@code signature=} values</li>
 * <li>Truncates excessively long output</li>
 * </ul>
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final Pattern JSON_PRIVATE_KEY_PATTERN =
            Pattern.compile("\"privateKey\"\\s*:\\s*\"0x[^\"]+\"");

    private static final String JSON_PRIVATE_KEY_REPLACEMENT = "\"privateKey\":\"0x***[REDACTED]***\"";

    private static final Pattern KV_PRIVATE_KEY_PATTERN =
            Pattern.compile("privateKey=0x[0-9a-fA-F]+");

    private static final String KV_PRIVATE_KEY_REPLACEMENT = "privateKey=0x***[REDACTED]***";

    private static final Pattern SIGNATURE_PATTERN =
            Pattern.compile("([sS]ignature)=0x[0-9a-fA-F]+");

    private static final String SIGNATURE_REPLACEMENT = "$1=0x***[REDACTED]***";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("\"privateKey\"")) {
            sanitized = JSON_PRIVATE_KEY_PATTERN.matcher(sanitized).replaceAll(JSON_PRIVATE_KEY_REPLACEMENT);
        }

        if (sanitized.contains("privateKey=")) {
            sanitized = KV_PRIVATE_KEY_PATTERN.matcher(sanitized).replaceAll(KV_PRIVATE_KEY_REPLACEMENT);
        }

        if (sanitized.contains("ignature=")) {
            sanitized = SIGNATURE_PATTERN.matcher(sanitized).replaceAll(SIGNATURE_REPLACEMENT);
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
