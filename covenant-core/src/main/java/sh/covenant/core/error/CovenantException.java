// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.error;

/**
 * Base runtime exception for all Covenant failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * CovenantException
 * ├── {@link Eip712Exception} - typed-data encoding failures
 * └── {@link RegistryException} - rejected registry operations
 *     ├── {@link UnauthorizedException} - caller identity mismatch
 *     ├── {@link NotFoundException} - referenced key absent
 *     ├── {@link ConflictException} - uniqueness or one-shot invariant violated
 *     ├── {@link InvalidInputException} - malformed or unverifiable input
 *     └── {@link ExpiredException} - time window elapsed
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     caller.register("agent.example", null, null);
 * } catch (ConflictException e) {
 *     // domain, DID or address already taken: e.error() says which
 * } catch (CovenantException e) {
 *     // anything else Covenant rejected
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class CovenantException extends RuntimeException
        permits Eip712Exception, RegistryException {

    public CovenantException(final String message) {
        super(message);
    }

    public CovenantException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
