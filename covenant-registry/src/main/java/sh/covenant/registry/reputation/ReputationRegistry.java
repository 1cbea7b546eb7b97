// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.reputation;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.covenant.core.agent.AgentId;
import sh.covenant.core.agent.event.FeedbackAuthorized;
import sh.covenant.core.crypto.Keccak256;
import sh.covenant.core.error.RegistryError;
import sh.covenant.core.error.RegistryException;
import sh.covenant.core.types.Hash;
import sh.covenant.registry.identity.AgentRecord;
import sh.covenant.registry.identity.IdentityRegistry;
import sh.covenant.registry.ledger.Ledger;
import sh.covenant.registry.ledger.Transaction;

/**
 * Lets a server agent pre-authorize a client agent to leave feedback about it.
 * <p>
 * Authorizations are keyed by agent id, so they survive address, domain and DID changes
 * on either side. They are issued once and never revoked or reissued.
 */
public final class ReputationRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ReputationRegistry.class);

    private final Ledger ledger;
    private final IdentityRegistry identity;

    private final Map<FeedbackPair, Hash> authorizations = new HashMap<>();
    private final Set<Hash> validAuthIds = new HashSet<>();

    public ReputationRegistry(final Ledger ledger, final IdentityRegistry identity) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.identity = Objects.requireNonNull(identity, "identity");
    }

    /**
     * Authorizes {@code clientAgentId} to rate {@code serverAgentId}. Only the server's
     * current owner may call this.
     *
     * @return the new, non-zero authorization token
     * @throws RegistryException {@code AGENT_NOT_FOUND}, {@code UNAUTHORIZED_FEEDBACK} or
     *         {@code FEEDBACK_ALREADY_AUTHORIZED}
     */
    public Hash acceptFeedback(final Transaction tx, final AgentId clientAgentId, final AgentId serverAgentId) {
        tx.requireActiveOn(ledger);
        Objects.requireNonNull(clientAgentId, "clientAgentId");
        Objects.requireNonNull(serverAgentId, "serverAgentId");

        if (!identity.exists(clientAgentId)) {
            throw RegistryException.of(RegistryError.AGENT_NOT_FOUND, "client " + clientAgentId + " does not exist");
        }
        final AgentRecord server = identity.find(serverAgentId).orElseThrow(() ->
                RegistryException.of(RegistryError.AGENT_NOT_FOUND, "server " + serverAgentId + " does not exist"));
        if (!tx.sender().equals(server.owner())) {
            throw RegistryException.of(RegistryError.UNAUTHORIZED_FEEDBACK,
                    "only the owner of " + serverAgentId + " may authorize feedback");
        }
        final FeedbackPair pair = new FeedbackPair(clientAgentId, serverAgentId);
        if (authorizations.containsKey(pair)) {
            throw RegistryException.of(RegistryError.FEEDBACK_ALREADY_AUTHORIZED,
                    clientAgentId + " may already rate " + serverAgentId);
        }

        final Hash authId = deriveAuthId(tx, clientAgentId, serverAgentId);
        authorizations.put(pair, authId);
        validAuthIds.add(authId);
        tx.emit(new FeedbackAuthorized(clientAgentId, serverAgentId, authId));
        LOG.debug("Feedback authorized client={} server={} authId={}", clientAgentId, serverAgentId, authId.value());
        return authId;
    }

    public AuthorizationStatus isAuthorized(final AgentId clientAgentId, final AgentId serverAgentId) {
        final Hash authId = getAuthId(clientAgentId, serverAgentId);
        return authId.isZero() ? AuthorizationStatus.ABSENT : new AuthorizationStatus(true, authId);
    }

    /** @return the token, or {@link Hash#ZERO} if the pair holds none */
    public Hash getAuthId(final AgentId clientAgentId, final AgentId serverAgentId) {
        final FeedbackPair pair = new FeedbackPair(clientAgentId, serverAgentId);
        return ledger.read(() -> authorizations.getOrDefault(pair, Hash.ZERO));
    }

    /** Whether {@code authId} was ever issued by this registry. */
    public boolean isValidAuthId(final Hash authId) {
        Objects.requireNonNull(authId, "authId");
        return ledger.read(() -> validAuthIds.contains(authId));
    }

    /**
     * keccak256(uint256(client) ‖ uint256(server) ‖ uint256(timestamp) ‖ seed ‖ sender)
     */
    static Hash deriveAuthId(final Transaction tx, final AgentId client, final AgentId server) {
        return Hash.fromBytes(Keccak256.hash(
                uint256(client.value()),
                uint256(server.value()),
                uint256(tx.timestamp()),
                tx.seed(),
                tx.sender().toBytes()));
    }

    private static byte[] uint256(final long value) {
        final byte[] raw = BigInteger.valueOf(value).toByteArray();
        final byte[] word = new byte[32];
        final int length = Math.min(raw.length, 32);
        System.arraycopy(raw, raw.length - length, word, 32 - length, length);
        if (value < 0) {
            Arrays.fill(word, 0, 32 - length, (byte) 0xff);
        }
        return word;
    }
}
