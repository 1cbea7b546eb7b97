// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.ledger;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.covenant.core.agent.event.RegistryEvent;
import sh.covenant.core.error.RegistryException;
import sh.covenant.core.logging.DebugLogger;
import sh.covenant.core.logging.LogFormatter;
import sh.covenant.core.types.Address;

/**
 * Serializes every registry state transition into one global order.
 * <p>
 * Writes run through {@link #execute} under an exclusive lock, each receiving a fresh
 * {@link Transaction}. Reads run through {@link #read} under a shared lock and only ever
 * see committed state. A body that throws leaves no events behind; registries check every
 * precondition before mutating so a thrown body also leaves no state change.
 *
 * <pre>{@code
 * Ledger ledger = new Ledger(new ManualClock(1_000));
 * AgentId id = ledger.execute("register", owner, tx -> identity.register(tx, "agent.example", null, null));
 * AgentRecord record = identity.get(id);
 * }</pre>
 */
public final class Ledger {

    private static final Logger LOG = LoggerFactory.getLogger(Ledger.class);

    private final ReentrantReadWriteLock mx = new ReentrantReadWriteLock();
    private final LogicalClock clock;
    private final EntropySource entropy;
    private final EventLog eventLog = new EventLog();

    private long lastSequence;
    private long lastTimestamp = Long.MIN_VALUE;

    public Ledger(final LogicalClock clock) {
        this(clock, EntropySource.secureRandom());
    }

    public Ledger(final LogicalClock clock, final EntropySource entropy) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.entropy = Objects.requireNonNull(entropy, "entropy");
    }

    /**
     * Runs a state transition with no attached value.
     *
     * @see #execute(String, Address, BigInteger, Function)
     */
    public <T> T execute(final String operation, final Address sender, final Function<Transaction, T> body) {
        return execute(operation, sender, BigInteger.ZERO, body);
    }

    /**
     * Runs a state transition as {@code sender}.
     *
     * @param operation label used in logs
     * @param sender    the authenticated caller
     * @param value     payment attached to the call, non-negative
     * @param body      the transition; may throw to reject
     * @return whatever {@code body} returns
     * @throws IllegalStateException if the clock has gone backwards
     */
    public <T> T execute(
            final String operation,
            final Address sender,
            final BigInteger value,
            final Function<Transaction, T> body) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(body, "body");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("value must be non-negative: " + value);
        }

        final Lock lock = mx.writeLock();
        lock.lock();
        try {
            final long timestamp = clock.now();
            if (timestamp < lastTimestamp) {
                throw new IllegalStateException(
                        "Clock went backwards: " + timestamp + " < " + lastTimestamp);
            }
            final byte[] seed = entropy.nextSeed();
            if (seed == null || seed.length != EntropySource.SEED_LENGTH) {
                throw new IllegalStateException("Entropy source must supply " + EntropySource.SEED_LENGTH + " bytes");
            }

            final Transaction tx = new Transaction(
                    this, ++lastSequence, operation, sender, value, timestamp, seed);
            lastTimestamp = timestamp;
            final T result;
            try {
                result = body.apply(tx);
            } catch (RegistryException e) {
                DebugLogger.logTx(LogFormatter.formatTxRevert(
                        tx.sequence(), operation, sender.value(), e.error().name()));
                LOG.debug("Rejected seq={} op={} sender={}: {}", tx.sequence(), operation, sender.value(), e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                DebugLogger.logTx(LogFormatter.formatTxRevert(
                        tx.sequence(), operation, sender.value(), e.getClass().getSimpleName()));
                throw e;
            } finally {
                tx.close();
            }

            final List<RegistryEvent> staged = List.copyOf(tx.staged());
            DebugLogger.logTx(LogFormatter.formatTxCommit(
                    tx.sequence(), operation, sender.value(), timestamp, staged.size()));
            eventLog.append(tx.sequence(), staged);
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs a read-only view over committed state.
     */
    public <T> T read(final Supplier<T> view) {
        Objects.requireNonNull(view, "view");
        final Lock lock = mx.readLock();
        lock.lock();
        try {
            return view.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current logical time as seen by reads: the clock reading, but never earlier than
     * the last admitted transaction.
     */
    public long now() {
        return read(() -> Math.max(clock.now(), lastTimestamp));
    }

    /** Sequence number of the most recently admitted transaction, 0 if none. */
    public long lastSequence() {
        return read(() -> lastSequence);
    }

    public EventLog eventLog() {
        return eventLog;
    }

    public LogicalClock clock() {
        return clock;
    }
}
