// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.agent.event;

import java.nio.charset.StandardCharsets;

import sh.covenant.core.crypto.Keccak256;
import sh.covenant.core.types.Hash;

/**
 * An event emitted by a committed registry transaction.
 * <p>
 * Each event exposes its canonical Solidity-style signature and the topic an indexer
 * filters on, the Keccak-256 of that signature. Absent optional strings are carried as
 * {@code ""}.
 *
 * @since 0.1.0
 */
public sealed interface RegistryEvent permits
        AgentRegistered,
        AgentUpdated,
        AgentDeveloperLinked,
        FeedbackAuthorized,
        ValidationRequested,
        ValidationResponded {

    /** Canonical signature, e.g. {@code FeedbackAuthorized(uint256,uint256,bytes32)}. */
    String signature();

    /** Keccak-256 of {@link #signature()}. */
    Hash topic();

    /** Computes the topic for an event signature. */
    static Hash topicOf(final String signature) {
        return Hash.fromBytes(Keccak256.hash(signature.getBytes(StandardCharsets.UTF_8)));
    }

    /** Maps {@code null} to the empty string. */
    static String orEmpty(final String value) {
        return value == null ? "" : value;
    }
}
