// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.covenant.core.agent.AgentId;
import sh.covenant.core.crypto.Signature;
import sh.covenant.core.types.Address;
import sh.covenant.core.types.Hash;
import sh.covenant.registry.config.RegistryConfig;
import sh.covenant.registry.identity.AgentRecord;
import sh.covenant.registry.identity.AgentUpdate;
import sh.covenant.registry.identity.BurnFeePolicy;
import sh.covenant.registry.identity.IdentityRegistry;
import sh.covenant.registry.ledger.EntropySource;
import sh.covenant.registry.ledger.EventLog;
import sh.covenant.registry.ledger.Ledger;
import sh.covenant.registry.ledger.LogicalClock;
import sh.covenant.registry.reputation.ReputationRegistry;
import sh.covenant.registry.validation.ValidationRegistry;

/**
 * The three registries wired onto one ledger.
 *
 * <p>Reads go straight to the registries; writes go through a {@link Caller}, which runs
 * each operation as its own transaction:
 * <pre>{@code
 * TrustRegistries registries = TrustRegistries.create(RegistryConfig.defaults(), new ManualClock(1));
 * AgentId server = registries.as(alice).register("alice.example", null, alice, "server");
 * AgentId client = registries.as(bob).register("bob.example", null, bob, "client");
 * Hash authId = registries.as(alice).acceptFeedback(client, server);
 * }</pre>
 */
public final class TrustRegistries {
    private static final Logger LOG = LoggerFactory.getLogger(TrustRegistries.class);

    private final RegistryConfig config;
    private final Ledger ledger;
    private final IdentityRegistry identity;
    private final ReputationRegistry reputation;
    private final ValidationRegistry validation;
    private final @Nullable BurnFeePolicy burnFeePolicy;

    private TrustRegistries(final RegistryConfig config, final Ledger ledger) {
        this.config = config;
        this.ledger = ledger;
        this.burnFeePolicy = config.burnFeePolicy().orElse(null);
        this.identity = new IdentityRegistry(
                ledger, config.registrationPolicy(burnFeePolicy), config.eip712Domain(), config.nonceMode());
        this.reputation = new ReputationRegistry(ledger, identity);
        this.validation = new ValidationRegistry(ledger, identity);
    }

    public static TrustRegistries create(final RegistryConfig config, final LogicalClock clock) {
        return create(config, clock, EntropySource.secureRandom());
    }

    public static TrustRegistries create(
            final RegistryConfig config, final LogicalClock clock, final EntropySource entropy) {
        Objects.requireNonNull(config, "config");
        final TrustRegistries registries = new TrustRegistries(config, new Ledger(clock, entropy));
        LOG.debug("Created registries chainId={} requirement={} fee={} nonceMode={}",
                config.chainId(), config.identityRequirement(), config.registrationFee(), config.nonceMode());
        return registries;
    }

    public RegistryConfig config() {
        return config;
    }

    public Ledger ledger() {
        return ledger;
    }

    public IdentityRegistry identity() {
        return identity;
    }

    public ReputationRegistry reputation() {
        return reputation;
    }

    public ValidationRegistry validation() {
        return validation;
    }

    public EventLog eventLog() {
        return ledger.eventLog();
    }

    /** The fee policy, present when the configured registration fee is non-zero. */
    public Optional<BurnFeePolicy> burnFeePolicy() {
        return Optional.ofNullable(burnFeePolicy);
    }

    /** Total value burned by successful registrations. */
    public BigInteger totalBurned() {
        return burnFeePolicy == null ? BigInteger.ZERO : burnFeePolicy.totalBurned();
    }

    /** Writes on behalf of {@code sender}, carrying no value. */
    public Caller as(final Address sender) {
        return new Caller(sender, BigInteger.ZERO);
    }

    /**
     * Issues write operations as one sender. Each call is a separate transaction.
     */
    public final class Caller {
        private final Address sender;
        private final BigInteger value;

        private Caller(final Address sender, final BigInteger value) {
            this.sender = Objects.requireNonNull(sender, "sender");
            this.value = Objects.requireNonNull(value, "value");
        }

        public Address sender() {
            return sender;
        }

        public BigInteger value() {
            return value;
        }

        /** Same sender, attaching {@code value} to each transaction. */
        public Caller withValue(final BigInteger value) {
            return new Caller(sender, value);
        }

        public AgentId register(
                @Nullable final String domain,
                @Nullable final String did,
                final Address address,
                @Nullable final String description) {
            return ledger.execute("register", sender, value,
                    tx -> identity.register(tx, domain, did, address, description));
        }

        public AgentId registerWithDelegatedConsent(
                final String developerDID,
                final String agentDID,
                final Address agentAddress,
                @Nullable final String description,
                final long expiry,
                final Signature agentSignature) {
            return ledger.execute("registerWithDelegatedConsent", sender, value,
                    tx -> identity.registerWithDelegatedConsent(
                            tx, developerDID, agentDID, agentAddress, description, expiry, agentSignature));
        }

        public AgentRecord updateAgent(final AgentId agentId, final AgentUpdate update) {
            return ledger.execute("updateAgent", sender, value,
                    tx -> identity.updateAgent(tx, agentId, update));
        }

        public AgentRecord updateDescriptionOnly(final AgentId agentId, @Nullable final String description) {
            return ledger.execute("updateDescriptionOnly", sender, value,
                    tx -> identity.updateDescriptionOnly(tx, agentId, description));
        }

        public void linkDeveloperDid(
                final AgentId agentId, final Address developerAddress, final String developerDID) {
            ledger.execute("linkDeveloperDid", sender, value, tx -> {
                identity.linkDeveloperDid(tx, agentId, developerAddress, developerDID);
                return null;
            });
        }

        public Hash acceptFeedback(final AgentId clientAgentId, final AgentId serverAgentId) {
            return ledger.execute("acceptFeedback", sender, value,
                    tx -> reputation.acceptFeedback(tx, clientAgentId, serverAgentId));
        }

        public void requestValidation(
                final AgentId validatorAgentId, final AgentId serverAgentId, final Hash dataHash) {
            ledger.execute("requestValidation", sender, value,
                    tx -> validation.requestValidation(tx, validatorAgentId, serverAgentId, dataHash));
        }

        public void submitResponse(final Hash dataHash, final int score) {
            ledger.execute("submitResponse", sender, value, tx -> {
                validation.submitResponse(tx, dataHash, score);
                return null;
            });
        }

        @Override
        public String toString() {
            return "Caller{sender=" + sender.value() + ", value=" + value + "}";
        }
    }
}
