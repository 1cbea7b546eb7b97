// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.crypto.eip712;

import org.jspecify.annotations.Nullable;

import sh.covenant.core.types.Address;
import sh.covenant.core.types.Hash;

/**
 * EIP-712 domain separator fields.
 * <p>
 * All fields are optional; include only what the signing context uses. The
 * registries bind consent signatures to {name, version, chainId, verifyingContract}
 * so a signature for one registry deployment cannot be replayed against another.
 *
 * @param name the protocol name, or null if not used
 * @param version the signing domain version, or null if not used
 * @param chainId the EIP-155 chain ID, or null if not used
 * @param verifyingContract the registry address that verifies the signature, or null if not used
 * @param salt disambiguation salt, or null if not used
 * @see <a href="https://eips.ethereum.org/EIPS/eip-712">EIP-712</a>
 */
public record Eip712Domain(
        @Nullable String name,
        @Nullable String version,
        @Nullable Long chainId,
        @Nullable Address verifyingContract,
        @Nullable Hash salt
) {

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Computes the domain separator hash:
     * {@code keccak256(typeHash("EIP712Domain") || encodeData(domain))}.
     *
     * @return the 32-byte domain separator hash
     */
    public Hash separator() {
        return TypedDataEncoder.hashDomain(this);
    }

    /**
     * Builder for constructing Eip712Domain instances.
     */
    public static final class Builder {
        private String name;
        private String version;
        private Long chainId;
        private Address verifyingContract;
        private Hash salt;

        Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder chainId(long chainId) {
            this.chainId = chainId;
            return this;
        }

        public Builder verifyingContract(Address verifyingContract) {
            this.verifyingContract = verifyingContract;
            return this;
        }

        public Builder salt(Hash salt) {
            this.salt = salt;
            return this;
        }

        public Eip712Domain build() {
            return new Eip712Domain(name, version, chainId, verifyingContract, salt);
        }
    }
}
