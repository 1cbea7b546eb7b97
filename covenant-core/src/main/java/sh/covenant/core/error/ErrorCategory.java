// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.error;

/**
 * Coarse classification of {@link RegistryError} kinds. Each category maps to one
 * {@link RegistryException} subclass.
 */
public enum ErrorCategory {
    /** Caller identity does not match the identity the operation requires. */
    AUTHORIZATION,
    /** A referenced agent, DID or request does not exist. */
    NOT_FOUND,
    /** A uniqueness or issue-once invariant would be violated. */
    CONFLICT,
    /** Input is malformed or cannot be cryptographically verified. */
    VALIDATION,
    /** A time window has elapsed. */
    TEMPORAL
}
