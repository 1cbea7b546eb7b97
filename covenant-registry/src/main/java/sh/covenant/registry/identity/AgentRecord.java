// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.identity;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.covenant.core.agent.AgentId;
import sh.covenant.core.types.Address;

/**
 * An agent's directory entry. Immutable; an update replaces the whole record.
 * <p>
 * Empty strings are stored as {@code null}. {@code domain} keeps the casing it was
 * registered with.
 *
 * @param agentId     the sequential id, never {@link AgentId#NONE}
 * @param owner       the address allowed to mutate this record
 * @param domain      display domain, or null
 * @param did         DID bound to {@code owner}, or null
 * @param description free text, or null
 */
public record AgentRecord(
        AgentId agentId,
        Address owner,
        @Nullable String domain,
        @Nullable String did,
        @Nullable String description) {

    public AgentRecord {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(owner, "owner");
        if (agentId.isNone()) {
            throw new IllegalArgumentException("agentId 0 is reserved");
        }
        domain = blankToNull(domain);
        did = blankToNull(did);
        description = blankToNull(description);
    }

    public boolean hasDomain() {
        return domain != null;
    }

    public boolean hasDid() {
        return did != null;
    }

    AgentRecord with(final Address newOwner, @Nullable final String newDomain,
            @Nullable final String newDid, @Nullable final String newDescription) {
        return new AgentRecord(agentId, newOwner, newDomain, newDid, newDescription);
    }

    private static @Nullable String blankToNull(@Nullable final String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
