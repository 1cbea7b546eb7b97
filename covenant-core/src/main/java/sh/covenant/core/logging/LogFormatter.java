// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.logging;

import static sh.covenant.core.logging.AnsiColors.*;

/**
 * Structured, colored formatting for ledger debug output.
 *
 * <table border="1">
 * <tr><th>Method</th><th>Format</th><th>Color</th></tr>
 * <tr><td>formatTxCommit</td><td>✓ [TX]</td><td>Teal</td></tr>
 * <tr><td>formatTxRevert</td><td>✗ [TX-REVERT]</td><td>Coral</td></tr>
 * <tr><td>formatEvent</td><td>[EVENT]</td><td>Indigo</td></tr>
 * <tr><td>formatNonceBurn</td><td>○ [NONCE-BURN]</td><td>Amber</td></tr>
 * </table>
 *
 * <p>All methods are pure; the result can be handed to any logger.
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    private static final int HASH_PREFIX_LENGTH = 6;

    private static final int HASH_SUFFIX_LENGTH = 4;

    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: ✓ [TX] seq=3 op=register sender=0xf39f...2266 timestamp=1700000000 events=1
     */
    public static String formatTxCommit(long sequence, String operation, String sender, long timestamp, int events) {
        return String.format(
                "%s✓%s %s[TX]%s seq=%d op=%s sender=%s timestamp=%d events=%d",
                TEAL, RESET,
                TEAL, RESET,
                sequence, operation, shortenHash(sender), timestamp, events);
    }

    /**
     * Format: ✗ [TX-REVERT] seq=3 op=register sender=0xf39f...2266 error=DOMAIN_ALREADY_REGISTERED
     */
    public static String formatTxRevert(long sequence, String operation, String sender, String error) {
        return String.format(
                "%s✗%s %s[TX-REVERT]%s seq=%d op=%s sender=%s error=%s%s%s",
                CORAL, RESET,
                CORAL, RESET,
                sequence, operation, shortenHash(sender),
                CORAL, error, RESET);
    }

    /**
     * Format: [EVENT] AgentRegistered(uint256,address,string,string) topic=0x1234...abcd
     */
    public static String formatEvent(String signature, String topic, Object payload) {
        return String.format(
                "%s[EVENT]%s %s topic=%s %s%s%s",
                INDIGO, RESET,
                signature, shortenHash(topic),
                SLATE, payload, RESET);
    }

    /**
     * Format: ○ [NONCE-BURN] agent=0xf39f...2266 nonce=4 reason=INVALID_AGENT_SIGNATURE
     */
    public static String formatNonceBurn(String agent, Object nonce, String reason) {
        return String.format(
                "%s○%s %s[NONCE-BURN]%s agent=%s nonce=%s reason=%s",
                AMBER, RESET,
                AMBER, RESET,
                shortenHash(agent), nonce, reason);
    }

    /**
     * Shortens a hex value to {@code 0xabcd...ef12}; values of
     * {@value #HASH_SHORTEN_THRESHOLD} characters or fewer are returned as-is.
     */
    static String shortenHash(String fullHash) {
        if (fullHash == null || fullHash.length() <= HASH_SHORTEN_THRESHOLD) {
            return fullHash;
        }
        return fullHash.substring(0, HASH_PREFIX_LENGTH)
                + "..."
                + fullHash.substring(fullHash.length() - HASH_SUFFIX_LENGTH);
    }
}
