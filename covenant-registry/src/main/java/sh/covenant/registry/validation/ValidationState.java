// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.validation;

/**
 * Lifecycle of the request occupying a data-hash slot.
 */
public enum ValidationState {
    /** No request has ever occupied the slot. */
    ABSENT,
    /** Within its window and not yet answered. */
    PENDING,
    /** Answered by its validator. */
    RESPONDED,
    /** Window elapsed without an answer; the slot may be reused. */
    EXPIRED
}
