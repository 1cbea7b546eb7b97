// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.error;

/**
 * A uniqueness or issue-once invariant would be violated.
 *
 * @see ErrorCategory#CONFLICT
 */
public final class ConflictException extends RegistryException {

    ConflictException(final RegistryError error, final String message, final Throwable cause) {
        super(requireCategory(error, ErrorCategory.CONFLICT), message, cause);
    }

    private static RegistryError requireCategory(final RegistryError error, final ErrorCategory expected) {
        if (error.category() != expected) {
            throw new IllegalArgumentException(error + " is not a " + expected + " error");
        }
        return error;
    }
}
