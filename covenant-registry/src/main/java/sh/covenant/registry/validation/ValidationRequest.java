// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.validation;

import java.util.Objects;

import sh.covenant.core.agent.AgentId;
import sh.covenant.core.types.Hash;

/**
 * The request occupying a data-hash slot.
 *
 * @param validatorAgentId agent asked to score the work
 * @param serverAgentId    agent whose work is scored
 * @param dataHash         digest of the work artifact
 * @param timestamp        logical time the request was created
 * @param responded        whether the validator has answered
 */
public record ValidationRequest(
        AgentId validatorAgentId,
        AgentId serverAgentId,
        Hash dataHash,
        long timestamp,
        boolean responded) {

    public ValidationRequest {
        Objects.requireNonNull(validatorAgentId, "validatorAgentId");
        Objects.requireNonNull(serverAgentId, "serverAgentId");
        Objects.requireNonNull(dataHash, "dataHash");
    }

    /** Expired once {@code now > timestamp + window}. */
    public boolean isExpired(final long now, final long window) {
        return now - timestamp > window;
    }

    ValidationRequest markResponded() {
        return new ValidationRequest(validatorAgentId, serverAgentId, dataHash, timestamp, true);
    }
}
