// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.identity;

import sh.covenant.core.error.RegistryException;
import sh.covenant.registry.ledger.Transaction;

/**
 * Deployment-specific gate on registration, checked before any state changes.
 *
 * @see RegistrationPolicies
 * @see BurnFeePolicy
 */
public interface RegistrationPolicy {

    /**
     * Rejects the attempt by throwing.
     *
     * @throws RegistryException if the attempt does not satisfy this policy
     */
    void check(RegistrationAttempt attempt, Transaction tx);

    /**
     * Called after every other check has passed, just before the record is persisted.
     * Must not throw.
     */
    default void onRegistered(RegistrationAttempt attempt, Transaction tx) {
    }
}
