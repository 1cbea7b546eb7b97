// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.identity;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import sh.covenant.core.crypto.Signature;
import sh.covenant.core.crypto.Signer;
import sh.covenant.core.crypto.eip712.Eip712Domain;
import sh.covenant.core.crypto.eip712.TypeDefinition;
import sh.covenant.core.crypto.eip712.TypedData;
import sh.covenant.core.crypto.eip712.TypedDataField;
import sh.covenant.core.types.Address;

/**
 * EIP-712 message an agent signs to let a developer register it.
 *
 * <p>Example, agent side:
 * <pre>{@code
 * var consent = new DelegatedConsent(
 *     developerDid, agentDid, agentSigner.address(), "weather oracle",
 *     BigInteger.valueOf(registries.identity().nonceOf(agentSigner.address())),
 *     BigInteger.valueOf(deadline));
 *
 * Signature sig = DelegatedConsent.sign(consent, config.eip712Domain(), agentSigner);
 * }</pre>
 *
 * @param developerDID DID of the developer submitting the registration
 * @param agentDID     DID of the agent, bound to {@code agentAddress}
 * @param agentAddress the agent's owner address and the expected signer
 * @param description  agent description, {@code ""} if none
 * @param nonce        the agent's current consent nonce
 * @param expiry       last logical time at which the consent is valid
 */
public record DelegatedConsent(
        String developerDID,
        String agentDID,
        Address agentAddress,
        String description,
        BigInteger nonce,
        BigInteger expiry) {

    /** Primary type name. */
    public static final String PRIMARY_TYPE = "DelegatedRegistration";

    /** EIP-712 type definition for the consent message. */
    public static final TypeDefinition<DelegatedConsent> DEFINITION =
        TypeDefinition.forRecord(
            DelegatedConsent.class,
            PRIMARY_TYPE,
            Map.of(PRIMARY_TYPE, List.of(
                TypedDataField.of("developerDID", "string"),
                TypedDataField.of("agentDID", "string"),
                TypedDataField.of("agentAddress", "address"),
                TypedDataField.of("description", "string"),
                TypedDataField.of("nonce", "uint256"),
                TypedDataField.of("expiry", "uint256")
            ))
        );

    public DelegatedConsent {
        Objects.requireNonNull(developerDID, "developerDID");
        Objects.requireNonNull(agentDID, "agentDID");
        Objects.requireNonNull(agentAddress, "agentAddress");
        Objects.requireNonNull(nonce, "nonce");
        Objects.requireNonNull(expiry, "expiry");
        description = description == null ? "" : description;
    }

    /** Wraps this consent as typed data under {@code domain}. */
    public TypedData<DelegatedConsent> typedData(final Eip712Domain domain) {
        return TypedData.create(domain, DEFINITION, this);
    }

    /**
     * Signs a consent message.
     *
     * @param consent the consent
     * @param domain  the registry's EIP-712 domain
     * @param signer  the agent's signer; must control {@code consent.agentAddress()}
     * @return signature with v=27 or v=28
     */
    public static Signature sign(
            final DelegatedConsent consent, final Eip712Domain domain, final Signer signer) {
        Objects.requireNonNull(consent, "consent");
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(signer, "signer");
        return consent.typedData(domain).sign(signer);
    }
}
