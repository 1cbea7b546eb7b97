// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.error;

/**
 * A referenced agent, DID or validation request does not exist.
 *
 * @see ErrorCategory#NOT_FOUND
 */
public final class NotFoundException extends RegistryException {

    NotFoundException(final RegistryError error, final String message, final Throwable cause) {
        super(requireCategory(error, ErrorCategory.NOT_FOUND), message, cause);
    }

    private static RegistryError requireCategory(final RegistryError error, final ErrorCategory expected) {
        if (error.category() != expected) {
            throw new IllegalArgumentException(error + " is not a " + expected + " error");
        }
        return error;
    }
}
