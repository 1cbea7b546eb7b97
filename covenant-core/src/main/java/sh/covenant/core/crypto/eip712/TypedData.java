// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.crypto.eip712;

import java.util.Map;
import java.util.Objects;

import sh.covenant.core.crypto.Keccak256;
import sh.covenant.core.crypto.PrivateKey;
import sh.covenant.core.crypto.Signature;
import sh.covenant.core.crypto.Signer;
import sh.covenant.core.types.Address;
import sh.covenant.core.types.Hash;

/**
 * Type-safe EIP-712 typed data container.
 *
 * <p>Encapsulates a domain, type definition and message for signing, hashing and
 * signer recovery:
 * <pre>{@code
 * var typedData = TypedData.create(domain, DelegatedConsent.DEFINITION, consent);
 *
 * Signature sig = typedData.sign(agentSigner);     // off-ledger, by the agent
 * Address who = typedData.recoverSigner(sig);      // on-ledger, by the registry
 * }</pre>
 *
 * @param <T> the message type (typically a record)
 * @see <a href="https://eips.ethereum.org/EIPS/eip-712">EIP-712</a>
 */
public final class TypedData<T> {

    /** EIP-712 prefix: 0x19 0x01 */
    private static final byte[] EIP712_PREFIX = new byte[] { 0x19, 0x01 };

    private final Eip712Domain domain;
    private final TypeDefinition<T> definition;
    private final T message;

    private TypedData(Eip712Domain domain, TypeDefinition<T> definition, T message) {
        this.domain = Objects.requireNonNull(domain, "domain");
        this.definition = Objects.requireNonNull(definition, "definition");
        this.message = Objects.requireNonNull(message, "message");
    }

    /**
     * Creates typed data from a domain, type definition, and message.
     *
     * @param <T> the message type
     * @param domain     the EIP-712 domain
     * @param definition the type definition with field mappings
     * @param message    the message instance
     * @return typed data ready for signing or hashing
     */
    public static <T> TypedData<T> create(
            Eip712Domain domain,
            TypeDefinition<T> definition,
            T message) {
        return new TypedData<>(domain, definition, message);
    }

    /**
     * Computes {@code keccak256("\x19\x01" || domainSeparator || hashStruct(message))}.
     *
     * @return the 32-byte EIP-712 hash
     */
    public Hash hash() {
        Hash domainSeparator = TypedDataEncoder.hashDomain(domain);

        Map<String, Object> messageData = definition.extractor().apply(message);
        byte[] messageHash = TypedDataEncoder.hashStruct(
            definition.primaryType(),
            definition.types(),
            messageData
        );

        return Hash.fromBytes(Keccak256.hash(EIP712_PREFIX, domainSeparator.toBytes(), messageHash));
    }

    /**
     * Signs this typed data. The returned signature has v=27 or v=28.
     *
     * @param signer the signer to use
     * @return signature with v=27 or v=28
     */
    public Signature sign(Signer signer) {
        Objects.requireNonNull(signer, "signer");
        Signature raw = signer.signHash(hash().toBytes());
        int v = raw.v() < 27 ? raw.v() + 27 : raw.v();
        return new Signature(raw.r(), raw.s(), v);
    }

    /**
     * Recovers the address that produced {@code signature} over this typed data.
     *
     * @param signature the signature
     * @return the recovered signer
     * @throws IllegalArgumentException if no public key can be recovered
     */
    public Address recoverSigner(Signature signature) {
        Objects.requireNonNull(signature, "signature");
        return PrivateKey.recoverAddress(hash().toBytes(), signature);
    }

    public Eip712Domain domain() {
        return domain;
    }

    public String primaryType() {
        return definition.primaryType();
    }

    public T message() {
        return message;
    }

    public TypeDefinition<T> definition() {
        return definition;
    }
}
