// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.ledger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import sh.covenant.core.agent.event.RegistryEvent;
import sh.covenant.core.types.Address;

/**
 * Context of one admitted state transition: who sent it, when, with what value and
 * entropy. Only a {@link Ledger} creates transactions, so {@link #sender()} is the
 * authenticated caller.
 * <p>
 * Events emitted here are staged; they reach the {@link EventLog} only if the
 * transaction body completes normally. A transaction is usable only while its body runs.
 */
public final class Transaction {

    private final Ledger ledger;
    private final long sequence;
    private final String operation;
    private final Address sender;
    private final BigInteger value;
    private final long timestamp;
    private final byte[] seed;
    private final List<RegistryEvent> staged = new ArrayList<>();
    private boolean open = true;

    Transaction(
            final Ledger ledger,
            final long sequence,
            final String operation,
            final Address sender,
            final BigInteger value,
            final long timestamp,
            final byte[] seed) {
        this.ledger = ledger;
        this.sequence = sequence;
        this.operation = operation;
        this.sender = sender;
        this.value = value;
        this.timestamp = timestamp;
        this.seed = seed;
    }

    public long sequence() {
        return sequence;
    }

    public String operation() {
        return operation;
    }

    /** The authenticated caller. */
    public Address sender() {
        return sender;
    }

    /** Payment attached to the call; zero unless the caller sent one. */
    public BigInteger value() {
        return value;
    }

    /** Logical time of this transaction. */
    public long timestamp() {
        return timestamp;
    }

    /** Unpredictable 32-byte seed, fresh for each transaction. */
    public byte[] seed() {
        return Arrays.copyOf(seed, seed.length);
    }

    /** Stages an event for emission on commit. */
    public void emit(final RegistryEvent event) {
        requireOpen();
        staged.add(Objects.requireNonNull(event, "event"));
    }

    /**
     * Checks that this transaction is still running and was issued by {@code expected}.
     *
     * @throws IllegalStateException if the body has finished or the ledger differs
     */
    public void requireActiveOn(final Ledger expected) {
        if (ledger != expected) {
            throw new IllegalStateException("Transaction belongs to another ledger");
        }
        requireOpen();
    }

    List<RegistryEvent> staged() {
        return staged;
    }

    void close() {
        open = false;
    }

    private void requireOpen() {
        if (!open) {
            throw new IllegalStateException("Transaction " + sequence + " is no longer active");
        }
    }

    @Override
    public String toString() {
        return "Transaction[seq=" + sequence + ", op=" + operation + ", sender=" + sender.value()
                + ", timestamp=" + timestamp + ", value=" + value + "]";
    }
}
