// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.agent.event;

import java.util.Objects;

import sh.covenant.core.agent.AgentId;
import sh.covenant.core.types.Address;
import sh.covenant.core.types.Hash;

/**
 * An agent record changed. Carries the full post-update record.
 */
public record AgentUpdated(AgentId agentId, Address owner, String domain, String did, String description) implements RegistryEvent {

    public static final String SIGNATURE = "AgentUpdated(uint256,address,string,string,string)";
    public static final Hash TOPIC = RegistryEvent.topicOf(SIGNATURE);

    public AgentUpdated {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(owner, "owner");
        domain = RegistryEvent.orEmpty(domain);
        did = RegistryEvent.orEmpty(did);
        description = RegistryEvent.orEmpty(description);
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
