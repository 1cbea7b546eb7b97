// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.ledger;

/**
 * Source of the ledger's ordering value (block height or timestamp).
 * <p>
 * Expiration arithmetic in the registries is done in the units this clock reports.
 */
@FunctionalInterface
public interface LogicalClock {

    /**
     * @return the current logical time; a ledger rejects a value smaller than the one it
     *         saw on the previous transaction
     */
    long now();
}
