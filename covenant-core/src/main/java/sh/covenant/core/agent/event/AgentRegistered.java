// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.agent.event;

import java.util.Objects;

import sh.covenant.core.agent.AgentId;
import sh.covenant.core.types.Address;
import sh.covenant.core.types.Hash;

/**
 * A new agent was registered.
 */
public record AgentRegistered(AgentId agentId, Address owner, String domain, String did) implements RegistryEvent {

    public static final String SIGNATURE = "AgentRegistered(uint256,address,string,string)";
    public static final Hash TOPIC = RegistryEvent.topicOf(SIGNATURE);

    public AgentRegistered {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(owner, "owner");
        domain = RegistryEvent.orEmpty(domain);
        did = RegistryEvent.orEmpty(did);
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
