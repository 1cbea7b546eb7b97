// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.error;

/**
 * The caller is not the identity the operation requires.
 *
 * @see ErrorCategory#AUTHORIZATION
 */
public final class UnauthorizedException extends RegistryException {

    UnauthorizedException(final RegistryError error, final String message, final Throwable cause) {
        super(requireCategory(error, ErrorCategory.AUTHORIZATION), message, cause);
    }

    private static RegistryError requireCategory(final RegistryError error, final ErrorCategory expected) {
        if (error.category() != expected) {
            throw new IllegalArgumentException(error + " is not a " + expected + " error");
        }
        return error;
    }
}
