// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.error;

/**
 * Every distinct reason a registry operation can be rejected.
 */
public enum RegistryError {
    UNAUTHORIZED_REGISTRATION(ErrorCategory.AUTHORIZATION),
    UNAUTHORIZED_UPDATE(ErrorCategory.AUTHORIZATION),
    UNAUTHORIZED_FEEDBACK(ErrorCategory.AUTHORIZATION),
    UNAUTHORIZED_VALIDATOR(ErrorCategory.AUTHORIZATION),

    AGENT_NOT_FOUND(ErrorCategory.NOT_FOUND),
    DID_NOT_REGISTERED(ErrorCategory.NOT_FOUND),
    VALIDATION_REQUEST_NOT_FOUND(ErrorCategory.NOT_FOUND),

    DOMAIN_ALREADY_REGISTERED(ErrorCategory.CONFLICT),
    DID_ALREADY_REGISTERED(ErrorCategory.CONFLICT),
    ADDRESS_ALREADY_REGISTERED(ErrorCategory.CONFLICT),
    FEEDBACK_ALREADY_AUTHORIZED(ErrorCategory.CONFLICT),
    VALIDATION_ALREADY_RESPONDED(ErrorCategory.CONFLICT),

    INVALID_INPUT(ErrorCategory.VALIDATION),
    INVALID_ADDRESS(ErrorCategory.VALIDATION),
    INVALID_DATA_HASH(ErrorCategory.VALIDATION),
    INVALID_RESPONSE(ErrorCategory.VALIDATION),
    DID_ADDRESS_MISMATCH(ErrorCategory.VALIDATION),
    INVALID_DEVELOPER_DID(ErrorCategory.VALIDATION),
    INVALID_AGENT_SIGNATURE(ErrorCategory.VALIDATION),
    SIGNATURE_EXPIRED(ErrorCategory.VALIDATION),
    INSUFFICIENT_FEE(ErrorCategory.VALIDATION),

    REQUEST_EXPIRED(ErrorCategory.TEMPORAL);

    private final ErrorCategory category;

    RegistryError(final ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
