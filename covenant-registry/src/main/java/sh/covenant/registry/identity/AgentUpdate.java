// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.identity;

import org.jspecify.annotations.Nullable;

import sh.covenant.core.types.Address;

/**
 * Requested changes to an agent record.
 * <p>
 * A {@code null} field leaves the current value unchanged. An empty string for domain,
 * DID or description clears it.
 *
 * <pre>{@code
 * AgentUpdate update = AgentUpdate.builder()
 *     .newAddress(rotated)
 *     .newDid(DidBuilder.forAddress(rotated))
 *     .build();
 * }</pre>
 */
public record AgentUpdate(
        @Nullable Address newAddress,
        @Nullable String newDomain,
        @Nullable String newDid,
        @Nullable String newDescription) {

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return newAddress == null && newDomain == null && newDid == null && newDescription == null;
    }

    public static final class Builder {
        private Address newAddress;
        private String newDomain;
        private String newDid;
        private String newDescription;

        private Builder() {
        }

        public Builder newAddress(final Address newAddress) {
            this.newAddress = newAddress;
            return this;
        }

        public Builder newDomain(final String newDomain) {
            this.newDomain = newDomain;
            return this;
        }

        public Builder newDid(final String newDid) {
            this.newDid = newDid;
            return this;
        }

        public Builder newDescription(final String newDescription) {
            this.newDescription = newDescription;
            return this;
        }

        public AgentUpdate build() {
            return new AgentUpdate(newAddress, newDomain, newDid, newDescription);
        }
    }
}
