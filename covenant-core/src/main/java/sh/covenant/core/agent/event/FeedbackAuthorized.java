// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.agent.event;

import java.util.Objects;

import sh.covenant.core.agent.AgentId;
import sh.covenant.core.types.Hash;

/**
 * A server agent authorized a client agent to leave feedback.
 */
public record FeedbackAuthorized(AgentId clientAgentId, AgentId serverAgentId, Hash authId) implements RegistryEvent {

    public static final String SIGNATURE = "FeedbackAuthorized(uint256,uint256,bytes32)";
    public static final Hash TOPIC = RegistryEvent.topicOf(SIGNATURE);

    public FeedbackAuthorized {
        Objects.requireNonNull(clientAgentId, "clientAgentId");
        Objects.requireNonNull(serverAgentId, "serverAgentId");
        Objects.requireNonNull(authId, "authId");
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
