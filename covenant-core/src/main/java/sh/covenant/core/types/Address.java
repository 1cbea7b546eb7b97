// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import sh.covenant.primitives.Hex;

/**
 * Hex-encoded 20-byte account address.
 * <p>
 * Identifies the account that signs a ledger transaction and, by extension, the owner
 * of an agent record.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 40 hex characters long (20 bytes)</li>
 * </ul>
 * <p>
 * The value is stored in lowercase, so two addresses compare equal bit-for-bit
 * regardless of the checksum casing they were written in.
 *
 * @since 0.1.0
 */
public record Address(@JsonValue String value) {
    public static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    /**
     * The zero address ({@code 0x0000000000000000000000000000000000000000}).
     * <p>
     * Never a valid owner; used as the "no address" sentinel.
     */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public Address {
        Objects.requireNonNull(value, "address");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Decodes this address to a 20-byte array.
     *
     * @return 20-byte array representation
     */
    public byte[] toBytes() {
        return Hex.decode(value);
    }

    /** Returns {@code true} for {@link #ZERO}. */
    public boolean isZero() {
        return ZERO.value.equals(value);
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address("0x" + Hex.encodeNoPrefix(bytes));
    }
}
