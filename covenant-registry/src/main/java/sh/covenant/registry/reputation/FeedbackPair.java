// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.reputation;

import java.util.Objects;

import sh.covenant.core.agent.AgentId;

/**
 * Ordered (client, server) key of a feedback authorization.
 */
record FeedbackPair(AgentId client, AgentId server) {

    FeedbackPair {
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(server, "server");
    }
}
