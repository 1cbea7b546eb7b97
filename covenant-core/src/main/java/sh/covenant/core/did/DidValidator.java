// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.did;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

import sh.covenant.core.types.Address;
import sh.covenant.primitives.Base58;

/**
 * Checks whether a DID cryptographically embeds an account address.
 * <p>
 * A DID has exactly four {@code ':'} separators, for example
 * {@code did:covenant:agent:mainnet:<payload>}. The payload after the fourth
 * separator is base58. Decoded, it must be exactly {@value #PAYLOAD_LENGTH} bytes:
 *
 * <pre>
 * offset  0      2               9                          29     31
 *         +------+---------------+--------------------------+------+
 *         | head | 7 zero bytes  | 20-byte address          | tail |
 *         +------+---------------+--------------------------+------+
 * </pre>
 *
 * The zero run marks an address-controlled identifier. Header and trailer are not
 * interpreted.
 * <p>
 * Stateless and thread-safe.
 *
 * @see DidBuilder
 * @since 0.1.0
 */
public final class DidValidator {

    /** Number of {@code ':'} characters a DID must contain. */
    public static final int SEPARATOR_COUNT = 4;

    /** Decoded payload length in bytes. */
    public static final int PAYLOAD_LENGTH = 31;

    static final int PADDING_OFFSET = 2;
    static final int ADDRESS_OFFSET = 9;
    static final int ADDRESS_END = ADDRESS_OFFSET + Address.BYTE_LENGTH;

    private DidValidator() {
    }

    /**
     * Returns whether {@code did} embeds {@code expectedAddress}.
     *
     * @param did             the DID text
     * @param expectedAddress the address that must be embedded
     * @return true only if the DID parses and its embedded address equals
     *         {@code expectedAddress} bit-for-bit
     */
    public static boolean validate(final String did, final Address expectedAddress) {
        Objects.requireNonNull(expectedAddress, "expectedAddress");
        return extractAddress(did)
                .map(expectedAddress::equals)
                .orElse(false);
    }

    /**
     * Extracts the embedded address.
     *
     * @param did the DID text; {@code null} yields empty
     * @return the embedded address, or empty if the DID is malformed
     */
    public static Optional<Address> extractAddress(final String did) {
        if (did == null) {
            return Optional.empty();
        }
        final int payloadStart = payloadStart(did);
        if (payloadStart < 0) {
            return Optional.empty();
        }
        final Optional<byte[]> decoded = Base58.decode(did.substring(payloadStart));
        if (decoded.isEmpty()) {
            return Optional.empty();
        }
        final byte[] payload = decoded.get();
        if (payload.length != PAYLOAD_LENGTH) {
            return Optional.empty();
        }
        for (int i = PADDING_OFFSET; i < ADDRESS_OFFSET; i++) {
            if (payload[i] != 0) {
                return Optional.empty();
            }
        }
        return Optional.of(Address.fromBytes(Arrays.copyOfRange(payload, ADDRESS_OFFSET, ADDRESS_END)));
    }

    /**
     * Index just past the fourth separator, or -1 if the separator count is not exactly four.
     */
    private static int payloadStart(final String did) {
        int count = 0;
        int fourth = -1;
        for (int i = 0; i < did.length(); i++) {
            if (did.charAt(i) == ':') {
                count++;
                if (count == SEPARATOR_COUNT) {
                    fourth = i;
                } else if (count > SEPARATOR_COUNT) {
                    return -1;
                }
            }
        }
        return count == SEPARATOR_COUNT ? fourth + 1 : -1;
    }
}
