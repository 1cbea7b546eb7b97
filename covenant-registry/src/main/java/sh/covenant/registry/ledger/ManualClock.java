// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.ledger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * A clock that only moves when told to. Used by tests and simulations.
 */
public final class ManualClock implements LogicalClock {

    private final AtomicLong time;

    public ManualClock(final long start) {
        this.time = new AtomicLong(start);
    }

    @Override
    public long now() {
        return time.get();
    }

    /**
     * Sets the clock. Moving it backwards is allowed here; the ledger refuses to run
     * transactions against it until it catches up.
     */
    public void set(final long value) {
        time.set(value);
    }

    /**
     * Advances the clock and returns the new time.
     *
     * @throws IllegalArgumentException if {@code delta} is negative
     */
    public long advance(final long delta) {
        if (delta < 0) {
            throw new IllegalArgumentException("delta must be non-negative: " + delta);
        }
        return time.addAndGet(delta);
    }

    @Override
    public String toString() {
        return "ManualClock[" + time.get() + "]";
    }
}
