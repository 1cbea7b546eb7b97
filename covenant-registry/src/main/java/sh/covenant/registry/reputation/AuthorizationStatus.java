// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.reputation;

import java.util.Objects;

import sh.covenant.core.types.Hash;

/**
 * Result of {@link ReputationRegistry#isAuthorized}.
 *
 * @param authorized whether the pair holds an authorization
 * @param authId     the token, {@link Hash#ZERO} when absent
 */
public record AuthorizationStatus(boolean authorized, Hash authId) {

    static final AuthorizationStatus ABSENT = new AuthorizationStatus(false, Hash.ZERO);

    public AuthorizationStatus {
        Objects.requireNonNull(authId, "authId");
        if (authorized == authId.isZero()) {
            throw new IllegalArgumentException("authorized must be true exactly when authId is non-zero");
        }
    }
}
