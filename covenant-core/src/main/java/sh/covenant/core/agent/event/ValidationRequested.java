// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.agent.event;

import java.util.Objects;

import sh.covenant.core.agent.AgentId;
import sh.covenant.core.types.Hash;

/**
 * A validator was asked to score the work identified by {@code dataHash}. Re-emitted for idempotent refreshes.
 */
public record ValidationRequested(AgentId validatorAgentId, AgentId serverAgentId, Hash dataHash) implements RegistryEvent {

    public static final String SIGNATURE = "ValidationRequested(uint256,uint256,bytes32)";
    public static final Hash TOPIC = RegistryEvent.topicOf(SIGNATURE);

    public ValidationRequested {
        Objects.requireNonNull(validatorAgentId, "validatorAgentId");
        Objects.requireNonNull(serverAgentId, "serverAgentId");
        Objects.requireNonNull(dataHash, "dataHash");
    }

    @Override
    public String signature() {
        return SIGNATURE;
    }

    @Override
    public Hash topic() {
        return TOPIC;
    }
}
