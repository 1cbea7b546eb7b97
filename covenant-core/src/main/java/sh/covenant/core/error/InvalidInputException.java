// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.error;

/**
 * Input is malformed, out of range, or fails cryptographic verification.
 *
 * @see ErrorCategory#VALIDATION
 */
public final class InvalidInputException extends RegistryException {

    InvalidInputException(final RegistryError error, final String message, final Throwable cause) {
        super(requireCategory(error, ErrorCategory.VALIDATION), message, cause);
    }

    private static RegistryError requireCategory(final RegistryError error, final ErrorCategory expected) {
        if (error.category() != expected) {
            throw new IllegalArgumentException(error + " is not a " + expected + " error");
        }
        return error;
    }
}
