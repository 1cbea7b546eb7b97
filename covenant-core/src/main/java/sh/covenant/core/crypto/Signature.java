// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.crypto;

import java.util.Arrays;
import java.util.Objects;

import sh.covenant.primitives.Hex;

/**
 * Recoverable secp256k1 ECDSA signature.
 *
 * <p>
 * {@code v} is the recovery id, either raw ({@code 0}/{@code 1}) or in the
 * {@code 27}/{@code 28} form produced for typed-data signatures.
 *
 * @param r first 32 bytes of signature
 * @param s second 32 bytes of signature (low-s normalized when produced locally)
 * @param v recovery id
 * @since 0.1.0
 */
public record Signature(byte[] r, byte[] s, int v) {

    /** Length of the compact {@code r || s || v} form. */
    public static final int COMPACT_LENGTH = 65;

    public Signature {
        Objects.requireNonNull(r, "r cannot be null");
        Objects.requireNonNull(s, "s cannot be null");

        if (r.length != 32) {
            throw new IllegalArgumentException("r must be 32 bytes, got " + r.length);
        }
        if (s.length != 32) {
            throw new IllegalArgumentException("s must be 32 bytes, got " + s.length);
        }

        r = Arrays.copyOf(r, 32);
        s = Arrays.copyOf(s, 32);
    }

    /**
     * Parses the 65-byte {@code r || s || v} encoding.
     *
     * @param compact 65 bytes
     * @return the signature
     * @throws IllegalArgumentException if the length is wrong
     */
    public static Signature fromCompact(final byte[] compact) {
        Objects.requireNonNull(compact, "compact");
        if (compact.length != COMPACT_LENGTH) {
            throw new IllegalArgumentException(
                    "Signature must be " + COMPACT_LENGTH + " bytes, got " + compact.length);
        }
        return new Signature(
                Arrays.copyOfRange(compact, 0, 32),
                Arrays.copyOfRange(compact, 32, 64),
                compact[64] & 0xFF);
    }

    /**
     * Encodes this signature as {@code r || s || v}.
     *
     * @return 65 bytes
     */
    public byte[] toCompact() {
        final byte[] out = new byte[COMPACT_LENGTH];
        System.arraycopy(r, 0, out, 0, 32);
        System.arraycopy(s, 0, out, 32, 32);
        out[64] = (byte) v;
        return out;
    }

    /**
     * Returns the r component of the signature.
     *
     * @return a copy of the r bytes (32 bytes)
     */
    @Override
    public byte[] r() {
        return Arrays.copyOf(r, r.length);
    }

    /**
     * Returns the s component of the signature.
     *
     * @return a copy of the s bytes (32 bytes)
     */
    @Override
    public byte[] s() {
        return Arrays.copyOf(s, s.length);
    }

    /**
     * Returns the recovery id (0 or 1) encoded in {@code v}.
     *
     * @return 0 or 1
     * @throws IllegalArgumentException if v is not one of 0, 1, 27, 28
     */
    public int recoveryId() {
        if (v == 0 || v == 1) {
            return v;
        }
        if (v == 27 || v == 28) {
            return v - 27;
        }
        throw new IllegalArgumentException("Invalid recovery id: v=" + v);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Signature other))
            return false;
        return Arrays.equals(r, other.r) && Arrays.equals(s, other.s) && v == other.v;
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(r), Arrays.hashCode(s), v);
    }

    @Override
    public String toString() {
        return "Signature[r=" + Hex.encodeNoPrefix(r, 0, 4) + "..., s="
                + Hex.encodeNoPrefix(s, 0, 4) + "..., v=" + v + "]";
    }
}
