// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.identity;

/**
 * When a delegated registration consumes the agent's consent nonce.
 */
public enum NonceMode {

    /**
     * Consume once the expiry check passes, even if the signature or a later check fails.
     * A failed call therefore invalidates any consent signed for that nonce, and anyone
     * can advance an agent's nonce by submitting garbage signatures.
     */
    CONSUME_AFTER_EXPIRY_CHECK,

    /** Consume only when the registration commits. */
    CONSUME_ON_SUCCESS
}
