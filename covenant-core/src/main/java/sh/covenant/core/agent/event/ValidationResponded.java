// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.agent.event;

import java.util.Objects;

import sh.covenant.core.agent.AgentId;
import sh.covenant.core.types.Hash;

/**
 * A validator recorded its score for {@code dataHash}.
 */
public record ValidationResponded(AgentId validatorAgentId, AgentId serverAgentId, Hash dataHash, int response) implements RegistryEvent {

    public static final String SIGNATURE = "ValidationResponded(uint256,uint256,bytes32,uint8)";
    public static final Hash TOPIC = RegistryEvent.topicOf(SIGNATURE);

    public ValidationResponded {
        Objects.requireNonNull(validatorAgentId, "validatorAgentId");
        Objects.requireNonNull(serverAgentId, "serverAgentId");
        Objects.requireNonNull(dataHash, "dataHash");
        if (response < 0 || response > 0xff) {
            throw new IllegalArgumentException("response must fit in uint8: " + response);
        }
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
