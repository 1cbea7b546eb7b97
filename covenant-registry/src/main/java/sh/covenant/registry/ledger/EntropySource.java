// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.ledger;

import java.security.SecureRandom;

/**
 * Supplies the unpredictable per-transaction seed.
 */
@FunctionalInterface
public interface EntropySource {

    /** Seed length in bytes. */
    int SEED_LENGTH = 32;

    /**
     * @return {@value #SEED_LENGTH} fresh bytes
     */
    byte[] nextSeed();

    /** Seeds drawn from a {@link SecureRandom}. */
    static EntropySource secureRandom() {
        final SecureRandom random = new SecureRandom();
        return () -> {
            final byte[] seed = new byte[SEED_LENGTH];
            random.nextBytes(seed);
            return seed;
        };
    }
}
