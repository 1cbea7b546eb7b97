// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.identity;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.covenant.core.types.Address;

/**
 * What a registration call asks for, as seen by a {@link RegistrationPolicy}.
 *
 * @param agentAddress the prospective owner
 * @param domain       requested domain, or null
 * @param did          requested DID, or null
 * @param delegated    true for a developer-submitted registration
 */
public record RegistrationAttempt(
        Address agentAddress,
        @Nullable String domain,
        @Nullable String did,
        boolean delegated) {

    public RegistrationAttempt {
        Objects.requireNonNull(agentAddress, "agentAddress");
    }

    public boolean hasDomain() {
        return domain != null && !domain.isEmpty();
    }

    public boolean hasDid() {
        return did != null && !did.isEmpty();
    }
}
