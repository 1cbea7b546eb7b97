// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.validation;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.covenant.core.agent.AgentId;
import sh.covenant.core.agent.event.ValidationRequested;
import sh.covenant.core.agent.event.ValidationResponded;
import sh.covenant.core.error.RegistryError;
import sh.covenant.core.error.RegistryException;
import sh.covenant.core.types.Hash;
import sh.covenant.registry.identity.IdentityRegistry;
import sh.covenant.registry.ledger.Ledger;
import sh.covenant.registry.ledger.Transaction;

/**
 * Time-bounded validation requests and responses, one slot per data hash.
 * <p>
 * A request stays answerable for {@value #EXPIRATION_WINDOW} clock units. Requesting an
 * occupied, unexpired slot again re-emits the request event without touching the stored
 * request. Once the occupant expires, the next request overwrites the slot. A recorded
 * score stays readable through {@link #getResponse} until the new occupant is answered.
 */
public final class ValidationRegistry {

    /** Logical-clock units a request stays answerable. */
    public static final long EXPIRATION_WINDOW = 1000;

    /** Highest accepted score. */
    public static final int MAX_SCORE = 100;

    private static final Logger LOG = LoggerFactory.getLogger(ValidationRegistry.class);

    private final Ledger ledger;
    private final IdentityRegistry identity;

    private final Map<Hash, ValidationRequest> requests = new HashMap<>();
    private final Map<Hash, Integer> responses = new HashMap<>();

    public ValidationRegistry(final Ledger ledger, final IdentityRegistry identity) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.identity = Objects.requireNonNull(identity, "identity");
    }

    /**
     * Asks {@code validatorAgentId} to score {@code serverAgentId}'s work. Anyone may call.
     *
     * @return the request now occupying the slot
     * @throws RegistryException {@code INVALID_DATA_HASH} or {@code AGENT_NOT_FOUND}
     */
    public ValidationRequest requestValidation(
            final Transaction tx,
            final AgentId validatorAgentId,
            final AgentId serverAgentId,
            final Hash dataHash) {
        tx.requireActiveOn(ledger);
        Objects.requireNonNull(validatorAgentId, "validatorAgentId");
        Objects.requireNonNull(serverAgentId, "serverAgentId");
        Objects.requireNonNull(dataHash, "dataHash");

        if (dataHash.isZero()) {
            throw RegistryException.of(RegistryError.INVALID_DATA_HASH, "data hash must be non-zero");
        }
        if (!identity.exists(validatorAgentId)) {
            throw RegistryException.of(RegistryError.AGENT_NOT_FOUND,
                    "validator " + validatorAgentId + " does not exist");
        }
        if (!identity.exists(serverAgentId)) {
            throw RegistryException.of(RegistryError.AGENT_NOT_FOUND,
                    "server " + serverAgentId + " does not exist");
        }

        final ValidationRequest existing = requests.get(dataHash);
        if (existing != null && !existing.isExpired(tx.timestamp(), EXPIRATION_WINDOW)) {
            tx.emit(new ValidationRequested(validatorAgentId, serverAgentId, dataHash));
            LOG.debug("Re-emitted request for {} (created at {})", dataHash.value(), existing.timestamp());
            return existing;
        }

        final ValidationRequest request =
                new ValidationRequest(validatorAgentId, serverAgentId, dataHash, tx.timestamp(), false);
        requests.put(dataHash, request);
        // the previous occupant's score leaves with it
        responses.remove(dataHash);
        tx.emit(new ValidationRequested(validatorAgentId, serverAgentId, dataHash));
        LOG.debug("Validation requested {} validator={} server={}{}",
                dataHash.value(), validatorAgentId, serverAgentId, existing != null ? " (slot reused)" : "");
        return request;
    }

    /**
     * Records the designated validator's score.
     *
     * @throws RegistryException {@code INVALID_RESPONSE}, {@code VALIDATION_REQUEST_NOT_FOUND},
     *         {@code REQUEST_EXPIRED}, {@code VALIDATION_ALREADY_RESPONDED} or
     *         {@code UNAUTHORIZED_VALIDATOR}
     */
    public void submitResponse(final Transaction tx, final Hash dataHash, final int score) {
        tx.requireActiveOn(ledger);
        Objects.requireNonNull(dataHash, "dataHash");

        if (score < 0 || score > MAX_SCORE) {
            throw RegistryException.of(RegistryError.INVALID_RESPONSE,
                    "score must be within [0, " + MAX_SCORE + "], got " + score);
        }
        final ValidationRequest request = requests.get(dataHash);
        if (request == null) {
            throw RegistryException.of(RegistryError.VALIDATION_REQUEST_NOT_FOUND,
                    "no request for " + dataHash.value());
        }
        if (request.isExpired(tx.timestamp(), EXPIRATION_WINDOW)) {
            throw RegistryException.of(RegistryError.REQUEST_EXPIRED,
                    "request for " + dataHash.value() + " expired at " + (request.timestamp() + EXPIRATION_WINDOW));
        }
        if (request.responded()) {
            throw RegistryException.of(RegistryError.VALIDATION_ALREADY_RESPONDED,
                    "request for " + dataHash.value() + " already answered");
        }
        if (!tx.sender().equals(identity.get(request.validatorAgentId()).owner())) {
            throw RegistryException.of(RegistryError.UNAUTHORIZED_VALIDATOR,
                    "only the owner of " + request.validatorAgentId() + " may respond");
        }

        requests.put(dataHash, request.markResponded());
        responses.put(dataHash, score);
        tx.emit(new ValidationResponded(request.validatorAgentId(), request.serverAgentId(), dataHash, score));
        LOG.debug("Validation response {} score={} by {}", dataHash.value(), score, request.validatorAgentId());
    }

    // ═══════════════════════════════════════════════════════════════
    // Reads
    // ═══════════════════════════════════════════════════════════════

    /**
     * @throws RegistryException {@code VALIDATION_REQUEST_NOT_FOUND}
     */
    public ValidationRequest getRequest(final Hash dataHash) {
        Objects.requireNonNull(dataHash, "dataHash");
        return ledger.read(() -> {
            final ValidationRequest request = requests.get(dataHash);
            if (request == null) {
                throw RegistryException.of(RegistryError.VALIDATION_REQUEST_NOT_FOUND,
                        "no request for " + dataHash.value());
            }
            return request;
        });
    }

    public PendingStatus isPending(final Hash dataHash) {
        final ValidationState state = stateOf(dataHash);
        return new PendingStatus(state != ValidationState.ABSENT, state == ValidationState.PENDING);
    }

    public ResponseStatus getResponse(final Hash dataHash) {
        Objects.requireNonNull(dataHash, "dataHash");
        return ledger.read(() -> {
            final Integer score = responses.get(dataHash);
            return score == null ? ResponseStatus.NONE : new ResponseStatus(true, score);
        });
    }

    /** State of the current occupant at the ledger's current time. */
    public ValidationState stateOf(final Hash dataHash) {
        Objects.requireNonNull(dataHash, "dataHash");
        final long now = ledger.now();
        return ledger.read(() -> {
            final ValidationRequest request = requests.get(dataHash);
            if (request == null) {
                return ValidationState.ABSENT;
            }
            if (request.responded()) {
                return ValidationState.RESPONDED;
            }
            return request.isExpired(now, EXPIRATION_WINDOW) ? ValidationState.EXPIRED : ValidationState.PENDING;
        });
    }

    public long expirationWindow() {
        return EXPIRATION_WINDOW;
    }
}
