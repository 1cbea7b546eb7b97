// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.identity;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.covenant.core.agent.AgentId;
import sh.covenant.core.agent.event.AgentDeveloperLinked;
import sh.covenant.core.agent.event.AgentRegistered;
import sh.covenant.core.agent.event.AgentUpdated;
import sh.covenant.core.crypto.Signature;
import sh.covenant.core.crypto.eip712.Eip712Domain;
import sh.covenant.core.did.DidValidator;
import sh.covenant.core.error.RegistryError;
import sh.covenant.core.error.RegistryException;
import sh.covenant.core.logging.DebugLogger;
import sh.covenant.core.logging.LogFormatter;
import sh.covenant.core.types.Address;
import sh.covenant.registry.ledger.Ledger;
import sh.covenant.registry.ledger.Transaction;

/**
 * Canonical directory of agents.
 * <p>
 * Assigns sequential {@link AgentId}s from 1 and keeps three unique secondary indexes
 * (lower-cased domain, DID, owner address) in step with the record table. Every
 * non-empty DID stored for an agent embeds that agent's current owner address.
 * <p>
 * Write methods take the {@link Transaction} of an enclosing {@link Ledger#execute}
 * call; the transaction's sender is the authenticated caller. Every check runs before
 * any mutation, so a rejected call changes nothing. The one exception is the consent
 * nonce under {@link NonceMode#CONSUME_AFTER_EXPIRY_CHECK}.
 */
public final class IdentityRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(IdentityRegistry.class);

    private final Ledger ledger;
    private final RegistrationPolicy policy;
    private final Eip712Domain consentDomain;
    private final NonceMode nonceMode;

    private final Map<AgentId, AgentRecord> agents = new HashMap<>();
    private final Map<String, AgentId> byDomain = new HashMap<>();
    private final Map<String, AgentId> byDid = new HashMap<>();
    private final Map<Address, AgentId> byAddress = new HashMap<>();
    private final Map<AgentId, String> developerDids = new HashMap<>();
    private final Map<Address, Long> nonces = new HashMap<>();
    private AgentId lastId = AgentId.NONE;

    public IdentityRegistry(
            final Ledger ledger,
            final RegistrationPolicy policy,
            final Eip712Domain consentDomain,
            final NonceMode nonceMode) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.consentDomain = Objects.requireNonNull(consentDomain, "consentDomain");
        this.nonceMode = Objects.requireNonNull(nonceMode, "nonceMode");
    }

    // ═══════════════════════════════════════════════════════════════
    // Registration
    // ═══════════════════════════════════════════════════════════════

    /**
     * Self-registers {@code address}.
     *
     * @param tx          the enclosing transaction; its sender must be {@code address}
     * @param domain      domain, unique ignoring ASCII case; null or empty for none
     * @param did         DID embedding {@code address}; null or empty for none
     * @param address     the new agent's owner
     * @param description free text; null or empty for none
     * @return the new agent's id
     * @throws RegistryException {@code INVALID_ADDRESS}, {@code UNAUTHORIZED_REGISTRATION},
     *         a policy rejection, {@code DOMAIN_ALREADY_REGISTERED},
     *         {@code DID_ADDRESS_MISMATCH}, {@code DID_ALREADY_REGISTERED} or
     *         {@code ADDRESS_ALREADY_REGISTERED}
     */
    public AgentId register(
            final Transaction tx,
            @Nullable final String domain,
            @Nullable final String did,
            final Address address,
            @Nullable final String description) {
        tx.requireActiveOn(ledger);
        Objects.requireNonNull(address, "address");
        requireNonZero(address);
        if (!tx.sender().equals(address)) {
            throw RegistryException.of(RegistryError.UNAUTHORIZED_REGISTRATION,
                    "sender " + tx.sender().value() + " cannot register " + address.value());
        }

        final RegistrationAttempt attempt = new RegistrationAttempt(address, domain, did, false);
        policy.check(attempt, tx);
        if (hasText(domain)) {
            requireDomainAvailable(domain, AgentId.NONE);
        }
        if (hasText(did)) {
            requireDidBinds(did, address);
            requireDidAvailable(did, AgentId.NONE);
        }
        requireAddressAvailable(address, AgentId.NONE);

        policy.onRegistered(attempt, tx);
        final AgentRecord record = insert(address, domain, did, description);
        tx.emit(new AgentRegistered(record.agentId(), address, record.domain(), record.did()));
        LOG.debug("Registered {} owner={} domain={} did={}",
                record.agentId(), address.value(), record.domain(), record.did());
        return record.agentId();
    }

    /**
     * Registers an agent on its behalf. The sender is the developer; the agent consents
     * through an EIP-712 {@link DelegatedConsent} signature.
     *
     * @param tx             the enclosing transaction; its sender is the developer
     * @param developerDID   DID embedding the sender's address
     * @param agentDID       DID embedding {@code agentAddress}
     * @param agentAddress   the new agent's owner
     * @param description    free text; null or empty for none
     * @param expiry         last logical time at which the consent is valid
     * @param agentSignature the agent's signature over the consent
     * @return the new agent's id
     * @throws RegistryException {@code INVALID_ADDRESS}, {@code INVALID_DEVELOPER_DID},
     *         {@code DID_ADDRESS_MISMATCH}, {@code SIGNATURE_EXPIRED},
     *         {@code INVALID_AGENT_SIGNATURE}, a policy rejection,
     *         {@code DID_ALREADY_REGISTERED} or {@code ADDRESS_ALREADY_REGISTERED}
     */
    public AgentId registerWithDelegatedConsent(
            final Transaction tx,
            final String developerDID,
            final String agentDID,
            final Address agentAddress,
            @Nullable final String description,
            final long expiry,
            final Signature agentSignature) {
        tx.requireActiveOn(ledger);
        Objects.requireNonNull(developerDID, "developerDID");
        Objects.requireNonNull(agentDID, "agentDID");
        Objects.requireNonNull(agentAddress, "agentAddress");
        Objects.requireNonNull(agentSignature, "agentSignature");
        requireNonZero(agentAddress);

        if (!DidValidator.validate(developerDID, tx.sender())) {
            throw RegistryException.of(RegistryError.INVALID_DEVELOPER_DID,
                    "developer DID does not embed sender " + tx.sender().value());
        }
        requireDidBinds(agentDID, agentAddress);
        if (tx.timestamp() > expiry) {
            throw RegistryException.of(RegistryError.SIGNATURE_EXPIRED,
                    "consent expired at " + expiry + ", now " + tx.timestamp());
        }

        final long nonce = nonces.getOrDefault(agentAddress, 0L);
        if (nonceMode == NonceMode.CONSUME_AFTER_EXPIRY_CHECK) {
            nonces.put(agentAddress, nonce + 1);
        }

        final String desc = description == null ? "" : description;
        final RegistrationAttempt attempt = new RegistrationAttempt(agentAddress, null, agentDID, true);
        try {
            final DelegatedConsent consent = new DelegatedConsent(
                    developerDID, agentDID, agentAddress, desc,
                    BigInteger.valueOf(nonce), BigInteger.valueOf(expiry));
            requireSignedBy(consent, agentSignature, agentAddress);
            policy.check(attempt, tx);
            requireDidAvailable(agentDID, AgentId.NONE);
            requireAddressAvailable(agentAddress, AgentId.NONE);
        } catch (RegistryException e) {
            if (nonceMode == NonceMode.CONSUME_AFTER_EXPIRY_CHECK) {
                LOG.warn("Delegated registration for {} failed with {}; consent nonce {} is consumed",
                        agentAddress.value(), e.error(), nonce);
                DebugLogger.logTx(LogFormatter.formatNonceBurn(agentAddress.value(), nonce, e.error().name()));
            }
            throw e;
        }
        if (nonceMode == NonceMode.CONSUME_ON_SUCCESS) {
            nonces.put(agentAddress, nonce + 1);
        }

        policy.onRegistered(attempt, tx);
        final AgentRecord record = insert(agentAddress, null, agentDID, desc);
        developerDids.put(record.agentId(), developerDID);
        tx.emit(new AgentRegistered(record.agentId(), agentAddress, null, agentDID));
        tx.emit(new AgentDeveloperLinked(record.agentId(), developerDID));
        LOG.debug("Registered {} owner={} on behalf of developer {}",
                record.agentId(), agentAddress.value(), tx.sender().value());
        return record.agentId();
    }

    // ═══════════════════════════════════════════════════════════════
    // Updates
    // ═══════════════════════════════════════════════════════════════

    /**
     * Applies {@code update} to an agent, all or nothing.
     * <p>
     * A new DID is checked against the address in effect after this update. If the
     * address changes and the DID is kept, the kept DID must embed the new address.
     * An empty update changes nothing and emits no event.
     *
     * @return the updated record
     * @throws RegistryException {@code AGENT_NOT_FOUND}, {@code UNAUTHORIZED_UPDATE},
     *         {@code INVALID_ADDRESS}, {@code ADDRESS_ALREADY_REGISTERED},
     *         {@code DOMAIN_ALREADY_REGISTERED}, {@code DID_ADDRESS_MISMATCH} or
     *         {@code DID_ALREADY_REGISTERED}
     */
    public AgentRecord updateAgent(final Transaction tx, final AgentId agentId, final AgentUpdate update) {
        tx.requireActiveOn(ledger);
        Objects.requireNonNull(update, "update");
        final AgentRecord current = requireOwned(tx, agentId);
        if (update.isEmpty()) {
            return current;
        }

        Address owner = current.owner();
        if (update.newAddress() != null && !update.newAddress().equals(owner)) {
            requireNonZero(update.newAddress());
            requireAddressAvailable(update.newAddress(), agentId);
            owner = update.newAddress();
        }

        String domain = current.domain();
        if (update.newDomain() != null) {
            if (hasText(update.newDomain())) {
                requireDomainAvailable(update.newDomain(), agentId);
            }
            domain = update.newDomain();
        }

        String did = current.did();
        if (update.newDid() != null) {
            if (hasText(update.newDid())) {
                requireDidBinds(update.newDid(), owner);
                requireDidAvailable(update.newDid(), agentId);
            }
            did = update.newDid();
        } else if (did != null && !owner.equals(current.owner())) {
            requireDidBinds(did, owner);
        }

        final String description = update.newDescription() != null
                ? update.newDescription()
                : current.description();

        final AgentRecord updated = current.with(owner, domain, did, description);
        replace(current, updated);
        tx.emit(new AgentUpdated(agentId, updated.owner(), updated.domain(), updated.did(), updated.description()));
        LOG.debug("Updated {} owner={} domain={} did={}",
                agentId, updated.owner().value(), updated.domain(), updated.did());
        return updated;
    }

    /** Replaces only the description; null or empty clears it. */
    public AgentRecord updateDescriptionOnly(
            final Transaction tx, final AgentId agentId, @Nullable final String description) {
        return updateAgent(tx, agentId, AgentUpdate.builder()
                .newDescription(description == null ? "" : description)
                .build());
    }

    /**
     * Records which developer an agent belongs to, replacing any previous link.
     *
     * @throws RegistryException {@code AGENT_NOT_FOUND}, {@code UNAUTHORIZED_UPDATE} or
     *         {@code INVALID_DEVELOPER_DID}
     */
    public void linkDeveloperDid(
            final Transaction tx,
            final AgentId agentId,
            final Address developerAddress,
            final String developerDID) {
        tx.requireActiveOn(ledger);
        Objects.requireNonNull(developerAddress, "developerAddress");
        requireOwned(tx, agentId);
        if (!hasText(developerDID) || !DidValidator.validate(developerDID, developerAddress)) {
            throw RegistryException.of(RegistryError.INVALID_DEVELOPER_DID,
                    "developer DID does not embed " + developerAddress.value());
        }
        developerDids.put(agentId, developerDID);
        tx.emit(new AgentDeveloperLinked(agentId, developerDID));
        LOG.debug("Linked {} to developer {}", agentId, developerAddress.value());
    }

    // ═══════════════════════════════════════════════════════════════
    // Reads
    // ═══════════════════════════════════════════════════════════════

    /**
     * @throws RegistryException {@code AGENT_NOT_FOUND}
     */
    public AgentRecord get(final AgentId agentId) {
        Objects.requireNonNull(agentId, "agentId");
        return ledger.read(() -> {
            final AgentRecord record = agents.get(agentId);
            if (record == null) {
                throw notFound(agentId);
            }
            return record;
        });
    }

    public Optional<AgentRecord> find(final AgentId agentId) {
        Objects.requireNonNull(agentId, "agentId");
        return ledger.read(() -> Optional.ofNullable(agents.get(agentId)));
    }

    /**
     * Looks an agent up by domain, ignoring ASCII case.
     *
     * @throws RegistryException {@code AGENT_NOT_FOUND}
     */
    public AgentRecord resolveByDomain(final String domain) {
        Objects.requireNonNull(domain, "domain");
        return ledger.read(() -> {
            final AgentId id = byDomain.get(normalizeDomain(domain));
            if (id == null) {
                throw RegistryException.of(RegistryError.AGENT_NOT_FOUND, "no agent for domain " + domain);
            }
            return agents.get(id);
        });
    }

    /**
     * @throws RegistryException {@code AGENT_NOT_FOUND}
     */
    public AgentRecord resolveByAddress(final Address address) {
        Objects.requireNonNull(address, "address");
        return ledger.read(() -> {
            final AgentId id = byAddress.get(address);
            if (id == null) {
                throw RegistryException.of(RegistryError.AGENT_NOT_FOUND, "no agent for address " + address.value());
            }
            return agents.get(id);
        });
    }

    /**
     * @throws RegistryException {@code DID_NOT_REGISTERED}
     */
    public AgentRecord resolveByDid(final String did) {
        Objects.requireNonNull(did, "did");
        return ledger.read(() -> {
            final AgentId id = byDid.get(did);
            if (id == null) {
                throw RegistryException.of(RegistryError.DID_NOT_REGISTERED, "DID not registered: " + did);
            }
            return agents.get(id);
        });
    }

    public boolean exists(final AgentId agentId) {
        Objects.requireNonNull(agentId, "agentId");
        return ledger.read(() -> agents.containsKey(agentId));
    }

    /** Number of registered agents, which is also the highest assigned id. */
    public long count() {
        return ledger.read(() -> lastId.value());
    }

    /** The nonce the next consent signed by {@code agentAddress} must carry. */
    public long nonceOf(final Address agentAddress) {
        Objects.requireNonNull(agentAddress, "agentAddress");
        return ledger.read(() -> nonces.getOrDefault(agentAddress, 0L));
    }

    public Optional<String> developerDidOf(final AgentId agentId) {
        Objects.requireNonNull(agentId, "agentId");
        return ledger.read(() -> Optional.ofNullable(developerDids.get(agentId)));
    }

    /** EIP-712 domain consent signatures must be made under. */
    public Eip712Domain consentDomain() {
        return consentDomain;
    }

    public NonceMode nonceMode() {
        return nonceMode;
    }

    public RegistrationPolicy policy() {
        return policy;
    }

    /**
     * Lower-cases ASCII letters only; other characters compare exactly.
     */
    static String normalizeDomain(final String domain) {
        final char[] chars = domain.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            final char c = chars[i];
            if (c >= 'A' && c <= 'Z') {
                chars[i] = (char) (c + ('a' - 'A'));
            }
        }
        return new String(chars);
    }

    // ═══════════════════════════════════════════════════════════════
    // Checks (no mutation)
    // ═══════════════════════════════════════════════════════════════

    private AgentRecord requireOwned(final Transaction tx, final AgentId agentId) {
        Objects.requireNonNull(agentId, "agentId");
        final AgentRecord current = agents.get(agentId);
        if (current == null) {
            throw notFound(agentId);
        }
        if (!tx.sender().equals(current.owner())) {
            throw RegistryException.of(RegistryError.UNAUTHORIZED_UPDATE,
                    "sender " + tx.sender().value() + " does not own " + agentId);
        }
        return current;
    }

    private void requireDomainAvailable(final String domain, final AgentId self) {
        final AgentId holder = byDomain.get(normalizeDomain(domain));
        if (holder != null && !holder.equals(self)) {
            throw RegistryException.of(RegistryError.DOMAIN_ALREADY_REGISTERED,
                    domain + " is held by " + holder);
        }
    }

    private void requireDidAvailable(final String did, final AgentId self) {
        final AgentId holder = byDid.get(did);
        if (holder != null && !holder.equals(self)) {
            throw RegistryException.of(RegistryError.DID_ALREADY_REGISTERED, "DID is held by " + holder);
        }
    }

    private void requireAddressAvailable(final Address address, final AgentId self) {
        final AgentId holder = byAddress.get(address);
        if (holder != null && !holder.equals(self)) {
            throw RegistryException.of(RegistryError.ADDRESS_ALREADY_REGISTERED,
                    address.value() + " is held by " + holder);
        }
    }

    private static void requireDidBinds(final String did, final Address address) {
        if (!DidValidator.validate(did, address)) {
            throw RegistryException.of(RegistryError.DID_ADDRESS_MISMATCH,
                    "DID does not embed " + address.value());
        }
    }

    private void requireSignedBy(
            final DelegatedConsent consent, final Signature signature, final Address expected) {
        final Address recovered;
        try {
            recovered = consent.typedData(consentDomain).recoverSigner(signature);
        } catch (IllegalArgumentException e) {
            throw RegistryException.of(RegistryError.INVALID_AGENT_SIGNATURE,
                    "signature is not recoverable", e);
        }
        if (!recovered.equals(expected)) {
            throw RegistryException.of(RegistryError.INVALID_AGENT_SIGNATURE,
                    "consent signed by " + recovered.value() + ", expected " + expected.value());
        }
    }

    private static void requireNonZero(final Address address) {
        if (address.isZero()) {
            throw RegistryException.of(RegistryError.INVALID_ADDRESS, "zero address");
        }
    }

    private static RegistryException notFound(final AgentId agentId) {
        return RegistryException.of(RegistryError.AGENT_NOT_FOUND, agentId + " does not exist");
    }

    private static boolean hasText(@Nullable final String value) {
        return value != null && !value.isEmpty();
    }

    // ═══════════════════════════════════════════════════════════════
    // Mutation
    // ═══════════════════════════════════════════════════════════════

    private AgentRecord insert(
            final Address owner,
            @Nullable final String domain,
            @Nullable final String did,
            @Nullable final String description) {
        final AgentId id = lastId.next();
        final AgentRecord record = new AgentRecord(id, owner, domain, did, description);
        lastId = id;
        agents.put(id, record);
        index(record);
        return record;
    }

    private void replace(final AgentRecord previous, final AgentRecord next) {
        unindex(previous);
        agents.put(next.agentId(), next);
        index(next);
    }

    private void index(final AgentRecord record) {
        byAddress.put(record.owner(), record.agentId());
        if (record.domain() != null) {
            byDomain.put(normalizeDomain(record.domain()), record.agentId());
        }
        if (record.did() != null) {
            byDid.put(record.did(), record.agentId());
        }
    }

    private void unindex(final AgentRecord record) {
        byAddress.remove(record.owner());
        if (record.domain() != null) {
            byDomain.remove(normalizeDomain(record.domain()));
        }
        if (record.did() != null) {
            byDid.remove(record.did());
        }
    }
}
