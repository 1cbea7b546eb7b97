// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.config;

import sh.covenant.registry.identity.RegistrationPolicies;
import sh.covenant.registry.identity.RegistrationPolicy;

/**
 * Which identifying fields a registration must carry.
 */
public enum IdentityRequirement {
    NONE,
    DOMAIN,
    DID,
    DOMAIN_OR_DID;

    public RegistrationPolicy policy() {
        switch (this) {
            case DOMAIN:
                return RegistrationPolicies.requireDomain();
            case DID:
                return RegistrationPolicies.requireDid();
            case DOMAIN_OR_DID:
                return RegistrationPolicies.requireDomainOrDid();
            case NONE:
            default:
                return RegistrationPolicies.open();
        }
    }
}
