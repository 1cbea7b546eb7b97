// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.crypto.eip712;

/**
 * Sealed interface over the EIP-712 member types the registries sign.
 *
 * @see <a href="https://eips.ethereum.org/EIPS/eip-712">EIP-712</a>
 */
public sealed interface Eip712Type permits
        Eip712Type.Uint,
        Eip712Type.Address,
        Eip712Type.Bool,
        Eip712Type.FixedBytes,
        Eip712Type.DynamicBytes,
        Eip712Type.String,
        Eip712Type.Struct {

    /**
     * Unsigned integer type (uint8, uint16, ..., uint256).
     *
     * @param bits the bit width (must be 8-256 and divisible by 8)
     */
    record Uint(int bits) implements Eip712Type {
        public Uint {
            if (bits % 8 != 0 || bits < 8 || bits > 256) {
                throw new IllegalArgumentException("Invalid uint width: " + bits);
            }
        }
    }

    /** 20-byte account address. */
    record Address() implements Eip712Type {}

    record Bool() implements Eip712Type {}

    /**
     * Fixed-length byte array type (bytes1, bytes2, ..., bytes32).
     *
     * @param length the byte length (must be 1-32)
     */
    record FixedBytes(int length) implements Eip712Type {
        public FixedBytes {
            if (length < 1 || length > 32) {
                throw new IllegalArgumentException("Invalid bytes length: " + length);
            }
        }
    }

    record DynamicBytes() implements Eip712Type {}

    record String() implements Eip712Type {}

    /**
     * Struct (custom composite) type.
     *
     * @param name the struct type name
     */
    record Struct(java.lang.String name) implements Eip712Type {}
}
