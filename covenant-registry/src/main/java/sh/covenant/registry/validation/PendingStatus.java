// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.validation;

/**
 * @param exists  a request occupies the slot, expired or not
 * @param pending the request exists, is unanswered and is within its window
 */
public record PendingStatus(boolean exists, boolean pending) {

    public PendingStatus {
        if (pending && !exists) {
            throw new IllegalArgumentException("a pending request must exist");
        }
    }
}
