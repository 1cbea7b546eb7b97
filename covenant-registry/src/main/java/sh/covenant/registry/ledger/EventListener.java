// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.ledger;

import sh.covenant.core.agent.event.RegistryEvent;

/**
 * Receives events after the transaction that emitted them commits, in commit order.
 * <p>
 * Called on the committing thread while the ledger is still locked for writing. Reads
 * through the registries are allowed; submitting a transaction is not.
 */
@FunctionalInterface
public interface EventListener {

    void onEvent(long sequence, RegistryEvent event);
}
