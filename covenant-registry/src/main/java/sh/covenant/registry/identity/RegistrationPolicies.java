// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.identity;

import java.util.List;

import sh.covenant.core.error.RegistryError;
import sh.covenant.core.error.RegistryException;
import sh.covenant.registry.ledger.Transaction;

/**
 * Stock {@link RegistrationPolicy} implementations.
 */
public final class RegistrationPolicies {

    private static final RegistrationPolicy OPEN = (attempt, tx) -> { };

    private static final RegistrationPolicy REQUIRE_DOMAIN = (attempt, tx) -> {
        if (!attempt.hasDomain()) {
            throw RegistryException.of(RegistryError.INVALID_INPUT, "a domain is required");
        }
    };

    private static final RegistrationPolicy REQUIRE_DID = (attempt, tx) -> {
        if (!attempt.hasDid()) {
            throw RegistryException.of(RegistryError.INVALID_INPUT, "a DID is required");
        }
    };

    private static final RegistrationPolicy REQUIRE_DOMAIN_OR_DID = (attempt, tx) -> {
        if (!attempt.hasDomain() && !attempt.hasDid()) {
            throw RegistryException.of(RegistryError.INVALID_INPUT, "a domain or a DID is required");
        }
    };

    private RegistrationPolicies() {
    }

    /** Accepts every attempt. */
    public static RegistrationPolicy open() {
        return OPEN;
    }

    public static RegistrationPolicy requireDomain() {
        return REQUIRE_DOMAIN;
    }

    public static RegistrationPolicy requireDid() {
        return REQUIRE_DID;
    }

    public static RegistrationPolicy requireDomainOrDid() {
        return REQUIRE_DOMAIN_OR_DID;
    }

    /**
     * Composes policies. Checks run in order and stop at the first rejection;
     * {@code onRegistered} reaches every policy.
     */
    public static RegistrationPolicy allOf(final RegistrationPolicy... policies) {
        final List<RegistrationPolicy> all = List.of(policies);
        return new RegistrationPolicy() {
            @Override
            public void check(final RegistrationAttempt attempt, final Transaction tx) {
                for (RegistrationPolicy policy : all) {
                    policy.check(attempt, tx);
                }
            }

            @Override
            public void onRegistered(final RegistrationAttempt attempt, final Transaction tx) {
                for (RegistrationPolicy policy : all) {
                    policy.onRegistered(attempt, tx);
                }
            }

            @Override
            public String toString() {
                return "allOf" + all;
            }
        };
    }
}
