// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.agent.event;

import java.util.Objects;

import sh.covenant.core.agent.AgentId;
import sh.covenant.core.types.Hash;

/**
 * A developer DID was linked to an agent, replacing any prior link.
 */
public record AgentDeveloperLinked(AgentId agentId, String developerDid) implements RegistryEvent {

    public static final String SIGNATURE = "AgentDeveloperLinked(uint256,string)";
    public static final Hash TOPIC = RegistryEvent.topicOf(SIGNATURE);

    public AgentDeveloperLinked {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(developerDid, "developerDid");
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
