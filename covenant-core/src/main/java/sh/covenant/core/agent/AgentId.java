// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.agent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Sequential agent identifier.
 * <p>
 * Registries assign ids starting at 1; {@link #NONE} (0) is the "not found" sentinel and
 * never identifies a registered agent. Ids are never reused.
 *
 * @param value the id, non-negative
 * @since 0.1.0
 */
public record AgentId(@JsonValue long value) implements Comparable<AgentId> {

    /** Reserved sentinel; no agent is ever assigned this id. */
    public static final AgentId NONE = new AgentId(0);

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public AgentId {
        if (value < 0) {
            throw new IllegalArgumentException("AgentId must be non-negative: " + value);
        }
    }

    public static AgentId of(final long value) {
        return value == 0 ? NONE : new AgentId(value);
    }

    public boolean isNone() {
        return value == 0;
    }

    /** The id that follows this one. */
    public AgentId next() {
        return new AgentId(Math.addExact(value, 1));
    }

    @Override
    public int compareTo(final AgentId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "AgentId(" + value + ")";
    }
}
