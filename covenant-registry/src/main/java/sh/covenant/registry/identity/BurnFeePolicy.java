// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.identity;

import java.math.BigInteger;
import java.util.Objects;

import sh.covenant.core.error.RegistryError;
import sh.covenant.core.error.RegistryException;
import sh.covenant.registry.ledger.Transaction;

/**
 * Requires a registration to carry at least {@code fee} and burns whatever it carries.
 * <p>
 * The attached value is burned only when the registration commits. Accessed under the
 * ledger's write lock.
 */
public final class BurnFeePolicy implements RegistrationPolicy {

    private final BigInteger fee;
    private volatile BigInteger totalBurned = BigInteger.ZERO;

    public BurnFeePolicy(final BigInteger fee) {
        Objects.requireNonNull(fee, "fee");
        if (fee.signum() < 0) {
            throw new IllegalArgumentException("fee must be non-negative: " + fee);
        }
        this.fee = fee;
    }

    @Override
    public void check(final RegistrationAttempt attempt, final Transaction tx) {
        if (tx.value().compareTo(fee) < 0) {
            throw RegistryException.of(RegistryError.INSUFFICIENT_FEE,
                    "registration requires " + fee + ", got " + tx.value());
        }
    }

    @Override
    public void onRegistered(final RegistrationAttempt attempt, final Transaction tx) {
        totalBurned = totalBurned.add(tx.value());
    }

    public BigInteger fee() {
        return fee;
    }

    /** Sum of values burned by committed registrations. */
    public BigInteger totalBurned() {
        return totalBurned;
    }

    @Override
    public String toString() {
        return "BurnFeePolicy[fee=" + fee + "]";
    }
}
