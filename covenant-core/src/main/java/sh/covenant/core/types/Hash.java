// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import sh.covenant.primitives.Hex;

/**
 * Hex-encoded 32-byte digest.
 * <p>
 * Used for validation data hashes, feedback authorization tokens, EIP-712 signing
 * hashes and event topics. The all-zero value ({@link #ZERO}) means "absent".
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 64 hex characters long (32 bytes)</li>
 * </ul>
 *
 * @since 0.1.0
 */
public record Hash(@JsonValue String value) {
    public static final int BYTE_LENGTH = 32;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    /** The all-zero hash. */
    public static final Hash ZERO = new Hash("0x" + "0".repeat(BYTE_LENGTH * 2));

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public Hash {
        Objects.requireNonNull(value, "hash");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hash: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    /** Returns {@code true} for {@link #ZERO}. */
    public boolean isZero() {
        return ZERO.value.equals(value);
    }

    public static Hash fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Hash must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Hash("0x" + Hex.encodeNoPrefix(bytes));
    }
}
