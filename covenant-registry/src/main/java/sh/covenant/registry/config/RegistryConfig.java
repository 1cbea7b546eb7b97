// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.config;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import org.jspecify.annotations.Nullable;

import sh.covenant.core.crypto.eip712.Eip712Domain;
import sh.covenant.core.types.Address;
import sh.covenant.registry.identity.BurnFeePolicy;
import sh.covenant.registry.identity.NonceMode;
import sh.covenant.registry.identity.RegistrationPolicies;
import sh.covenant.registry.identity.RegistrationPolicy;

/**
 * Deployment settings for a set of registries.
 *
 * <p>Example, from a file:
 * <pre>{@code
 * {
 *   "chainId": 11155111,
 *   "domainName": "CovenantRegistry",
 *   "verifyingContract": "0x5FbDB2315678afecb367f032d93F642f64180aa3",
 *   "identityRequirement": "DOMAIN_OR_DID",
 *   "registrationFee": 1000,
 *   "nonceMode": "CONSUME_ON_SUCCESS"
 * }
 * }</pre>
 * Absent keys take the values of {@link #defaults()}.
 *
 * @param chainId             EIP-712 chain id, positive
 * @param domainName          EIP-712 domain name
 * @param domainVersion       EIP-712 domain version
 * @param verifyingContract   EIP-712 verifying contract, or null to omit it
 * @param identityRequirement identifying fields a registration must carry
 * @param registrationFee     value a registration must carry, burned on success; 0 for none
 * @param nonceMode           when a delegated registration consumes its nonce
 */
@JsonDeserialize(builder = RegistryConfig.Builder.class)
public record RegistryConfig(
        long chainId,
        String domainName,
        String domainVersion,
        @Nullable Address verifyingContract,
        IdentityRequirement identityRequirement,
        BigInteger registrationFee,
        NonceMode nonceMode) {

    public static final long DEFAULT_CHAIN_ID = 1L;
    public static final String DEFAULT_DOMAIN_NAME = "CovenantRegistry";
    public static final String DEFAULT_DOMAIN_VERSION = "1";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public RegistryConfig {
        if (chainId <= 0) {
            throw new IllegalArgumentException("chainId must be positive: " + chainId);
        }
        Objects.requireNonNull(domainName, "domainName");
        Objects.requireNonNull(domainVersion, "domainVersion");
        Objects.requireNonNull(identityRequirement, "identityRequirement");
        Objects.requireNonNull(registrationFee, "registrationFee");
        Objects.requireNonNull(nonceMode, "nonceMode");
        if (domainName.isBlank()) {
            throw new IllegalArgumentException("domainName cannot be blank");
        }
        if (domainVersion.isBlank()) {
            throw new IllegalArgumentException("domainVersion cannot be blank");
        }
        if (registrationFee.signum() < 0) {
            throw new IllegalArgumentException("registrationFee must be non-negative: " + registrationFee);
        }
    }

    public static RegistryConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses a configuration document.
     *
     * @param json the JSON string
     * @return the configuration
     * @throws IllegalArgumentException if the JSON is malformed or a value is invalid
     */
    public static RegistryConfig fromJson(String json) {
        Objects.requireNonNull(json, "json");
        try {
            return MAPPER.readValue(json, RegistryConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid registry config JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Domain delegated-consent signatures are made under. */
    public Eip712Domain eip712Domain() {
        return Eip712Domain.builder()
            .name(domainName)
            .version(domainVersion)
            .chainId(chainId)
            .verifyingContract(verifyingContract)
            .build();
    }

    /** A fresh fee policy, present when the registration fee is non-zero. */
    public Optional<BurnFeePolicy> burnFeePolicy() {
        return registrationFee.signum() == 0
            ? Optional.empty()
            : Optional.of(new BurnFeePolicy(registrationFee));
    }

    /**
     * The identity requirement, followed by {@code burnFee} when one is given.
     *
     * @param burnFee the fee policy to charge, typically from {@link #burnFeePolicy()}
     */
    public RegistrationPolicy registrationPolicy(@Nullable final BurnFeePolicy burnFee) {
        final RegistrationPolicy requirement = identityRequirement.policy();
        return burnFee == null ? requirement : RegistrationPolicies.allOf(requirement, burnFee);
    }

    public Builder toBuilder() {
        return new Builder()
            .chainId(chainId)
            .domainName(domainName)
            .domainVersion(domainVersion)
            .verifyingContract(verifyingContract)
            .identityRequirement(identityRequirement)
            .registrationFee(registrationFee)
            .nonceMode(nonceMode);
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private long chainId = DEFAULT_CHAIN_ID;
        private String domainName = DEFAULT_DOMAIN_NAME;
        private String domainVersion = DEFAULT_DOMAIN_VERSION;
        private Address verifyingContract;
        private IdentityRequirement identityRequirement = IdentityRequirement.NONE;
        private BigInteger registrationFee = BigInteger.ZERO;
        private NonceMode nonceMode = NonceMode.CONSUME_AFTER_EXPIRY_CHECK;

        private Builder() {
        }

        public Builder chainId(long chainId) {
            this.chainId = chainId;
            return this;
        }

        public Builder domainName(String domainName) {
            this.domainName = domainName;
            return this;
        }

        public Builder domainVersion(String domainVersion) {
            this.domainVersion = domainVersion;
            return this;
        }

        public Builder verifyingContract(Address verifyingContract) {
            this.verifyingContract = verifyingContract;
            return this;
        }

        public Builder identityRequirement(IdentityRequirement identityRequirement) {
            this.identityRequirement = identityRequirement;
            return this;
        }

        public Builder registrationFee(BigInteger registrationFee) {
            this.registrationFee = registrationFee;
            return this;
        }

        public Builder nonceMode(NonceMode nonceMode) {
            this.nonceMode = nonceMode;
            return this;
        }

        public RegistryConfig build() {
            return new RegistryConfig(
                chainId, domainName, domainVersion, verifyingContract,
                identityRequirement, registrationFee, nonceMode);
        }
    }
}
