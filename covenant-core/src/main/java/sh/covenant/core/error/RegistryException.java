// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.error;

import java.util.Objects;

/**
 * A registry operation was rejected. The operation made no state change.
 *
 * <p>
 * {@link #error()} names the exact reason; the concrete subclass names its
 * {@link ErrorCategory}. Use {@link #of(RegistryError, String)} to build the right
 * subclass for a kind.
 *
 * @since 0.1.0
 */
public abstract sealed class RegistryException extends CovenantException
        permits UnauthorizedException,
        NotFoundException,
        ConflictException,
        InvalidInputException,
        ExpiredException {

    private final RegistryError error;

    protected RegistryException(final RegistryError error, final String message) {
        super(error + ": " + message);
        this.error = error;
    }

    protected RegistryException(final RegistryError error, final String message, final Throwable cause) {
        super(error + ": " + message, cause);
        this.error = error;
    }

    public RegistryError error() {
        return error;
    }

    public ErrorCategory category() {
        return error.category();
    }

    /**
     * Creates the exception subclass matching the category of {@code error}.
     *
     * @param error   the rejection reason
     * @param message human-readable detail
     * @return the exception (not thrown)
     */
    public static RegistryException of(final RegistryError error, final String message) {
        return of(error, message, null);
    }

    public static RegistryException of(final RegistryError error, final String message, final Throwable cause) {
        Objects.requireNonNull(error, "error");
        switch (error.category()) {
            case AUTHORIZATION:
                return new UnauthorizedException(error, message, cause);
            case NOT_FOUND:
                return new NotFoundException(error, message, cause);
            case CONFLICT:
                return new ConflictException(error, message, cause);
            case VALIDATION:
                return new InvalidInputException(error, message, cause);
            case TEMPORAL:
                return new ExpiredException(error, message, cause);
            default:
                throw new IllegalStateException("Unhandled category: " + error.category());
        }
    }
}
