// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.ledger;

import java.time.Clock;
import java.util.Objects;

/**
 * Wall-clock time in epoch seconds, the unit a block timestamp uses.
 */
public final class SystemClock implements LogicalClock {

    private final Clock clock;

    public SystemClock() {
        this(Clock.systemUTC());
    }

    public SystemClock(final Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public long now() {
        return clock.instant().getEpochSecond();
    }
}
