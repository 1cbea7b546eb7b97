// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.error;

/**
 * The validation request's expiration window has elapsed.
 *
 * @see ErrorCategory#TEMPORAL
 */
public final class ExpiredException extends RegistryException {

    ExpiredException(final RegistryError error, final String message, final Throwable cause) {
        super(requireCategory(error, ErrorCategory.TEMPORAL), message, cause);
    }

    private static RegistryError requireCategory(final RegistryError error, final ErrorCategory expected) {
        if (error.category() != expected) {
            throw new IllegalArgumentException(error + " is not a " + expected + " error");
        }
        return error;
    }
}
